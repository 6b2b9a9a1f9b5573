package dev.rune.scheduler.exceptions;

/**
 * Stable error codes for scheduler failures. The management layer maps each code to the HTTP
 * status returned to its callers.
 */
public enum ErrorCode {
  WORKFLOW_NOT_FOUND(1, 404),
  CREDENTIAL_NOT_FOUND(2, 404),
  SCHEDULE_CONFLICT(3, 400),
  INVALID_SCHEDULE(4, 400),
  INVALID_WORKFLOW_GRAPH(5, 400),
  CREDENTIAL_DECRYPTION(6, 500),
  BROKER_UNAVAILABLE(7, 503),
  DATABASE_ERROR(8, 503);

  private final int code;
  private final int httpStatus;

  ErrorCode(int code, int httpStatus) {
    this.code = code;
    this.httpStatus = httpStatus;
  }

  public int getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }
}
