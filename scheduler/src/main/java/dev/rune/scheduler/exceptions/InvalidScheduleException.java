package dev.rune.scheduler.exceptions;

/** Thrown when schedule parameters or the scheduled workflow fail validation. */
public class InvalidScheduleException extends SchedulerException {

  public InvalidScheduleException(String message) {
    super(ErrorCode.INVALID_SCHEDULE, message);
  }
}
