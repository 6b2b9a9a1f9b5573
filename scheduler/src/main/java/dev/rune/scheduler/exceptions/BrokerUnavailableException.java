package dev.rune.scheduler.exceptions;

/**
 * Thrown by {@code SchedulerDaemon.start()} when the initial message broker connection cannot be
 * established within its retry budget. The daemon never starts polling without a working publish
 * path, so this is fatal for the process.
 */
public class BrokerUnavailableException extends SchedulerException {

  public BrokerUnavailableException(String message, Throwable cause) {
    super(ErrorCode.BROKER_UNAVAILABLE, message, cause);
  }
}
