package dev.rune.scheduler.exceptions;

public class SchedulerException extends RuntimeException {

  private final ErrorCode errorCode;

  public SchedulerException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public SchedulerException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return String.format("SchedulerException[%d]: %s", errorCode.getCode(), getMessage());
  }
}
