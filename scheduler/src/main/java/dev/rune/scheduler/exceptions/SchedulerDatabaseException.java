package dev.rune.scheduler.exceptions;

import java.sql.SQLException;

/**
 * This exception is thrown when the scheduler database cannot be reached despite retries, or a
 * statement fails for a reason that retrying will not fix.
 */
public class SchedulerDatabaseException extends SchedulerException {
  private final Throwable underlyingException;

  public SchedulerDatabaseException(Throwable e) {
    super(
        ErrorCode.DATABASE_ERROR,
        String.format(
            "Scheduler database access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
    this.underlyingException = e;
  }

  /** A recent exception received from the database connection */
  public Throwable databaseException() {
    return underlyingException;
  }
}
