package dev.rune.scheduler.database;

import dev.rune.scheduler.exceptions.SchedulerDatabaseException;
import dev.rune.scheduler.execution.ThrowingRunnable;
import dev.rune.scheduler.execution.ThrowingSupplier;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a database operation while it fails with a transient SQL error. Backoff doubles from
 * {@code initialBackoff} up to {@code maxBackoff}, with a random factor between 0.5 and 1.5.
 * Non-transient failures are rethrown at once, checked ones wrapped in {@link
 * SchedulerDatabaseException}.
 */
public final class DbRetry {
  private static final Logger logger = LoggerFactory.getLogger(DbRetry.class);

  private DbRetry() {}

  public record Options(
      Duration initialBackoff,
      Duration maxBackoff,
      int maxAttempts,
      Predicate<Throwable> retriablePredicate) {

    public Options {
      Objects.requireNonNull(initialBackoff);
      Objects.requireNonNull(maxBackoff);
      Objects.requireNonNull(retriablePredicate);
    }

    /** Backoff 1s..60s, 10 attempts, SQL-transient detection. */
    public static Options defaults() {
      return new Options(
          Duration.ofSeconds(1), Duration.ofSeconds(60), 10, DbRetry::isRetriableSql);
    }

    public Options withInitialBackoff(Duration d) {
      return new Options(d, maxBackoff, maxAttempts, retriablePredicate);
    }

    public Options withMaxBackoff(Duration d) {
      return new Options(initialBackoff, d, maxAttempts, retriablePredicate);
    }

    public Options withMaxAttempts(int n) {
      return new Options(initialBackoff, maxBackoff, n, retriablePredicate);
    }

    public Options withRetriablePredicate(Predicate<Throwable> p) {
      return new Options(initialBackoff, maxBackoff, maxAttempts, p);
    }
  }

  public static <T, E extends Exception> T call(ThrowingSupplier<T, E> body) {
    return call(body, Options.defaults());
  }

  public static <T, E extends Exception> T call(ThrowingSupplier<T, E> body, Options opts) {
    Objects.requireNonNull(body);
    Objects.requireNonNull(opts);

    int maxAttempts = Math.max(1, opts.maxAttempts());
    int attempt = 0;
    Duration backoff = opts.initialBackoff();
    Throwable last = null;

    while (attempt < maxAttempts) {
      try {
        return body.execute();
      } catch (Exception t) {
        last = t;
        if (!opts.retriablePredicate().test(t)) {
          throw wrapUnchecked(t);
        }

        attempt++;
        if (attempt >= maxAttempts) break;

        double jitterFactor = 0.5 + ThreadLocalRandom.current().nextDouble();
        long sleepMillis = Math.max(1L, (long) (backoff.toMillis() * jitterFactor));

        logger.warn(
            "Scheduler database operation failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            maxAttempts,
            t.getMessage(),
            sleepMillis);

        if (!sleep(sleepMillis)) {
          break;
        }

        long next = Math.min(backoff.toMillis() * 2, opts.maxBackoff().toMillis());
        backoff = Duration.ofMillis(next);
      }
    }

    throw new SchedulerDatabaseException(last);
  }

  public static <E extends Exception> void run(ThrowingRunnable<E> body) {
    run(body, Options.defaults());
  }

  public static <E extends Exception> void run(ThrowingRunnable<E> body, Options opts) {
    call(
        () -> {
          body.execute();
          return null;
        },
        opts);
  }

  private static RuntimeException wrapUnchecked(Throwable t) {
    return (t instanceof RuntimeException re) ? re : new SchedulerDatabaseException(t);
  }

  // false when interrupted; the interrupt flag is restored and retrying stops
  private static boolean sleep(long millis) {
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Transient SQL failures: {@link SQLTransientException}, {@link SQLRecoverableException}, SQL
   * states of class 08 (connection) and 40 (transaction rollback), and the Postgres codes 55P03
   * lock_not_available, 53300 too_many_connections and 57014 query_canceled.
   */
  public static boolean isRetriableSql(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx) {
        String state = sqlEx.getSQLState();
        if (state == null) continue;

        if (state.startsWith("08")) return true;
        if (state.startsWith("40")) return true;
        if (state.equals("55P03")) return true;
        if (state.equals("53300")) return true;
        if (state.equals("57014")) return true;
      }
    }
    return false;
  }
}
