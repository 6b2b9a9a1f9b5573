package dev.rune.scheduler.messaging;

/** Opens the broker connection a {@link MessagePublisher} publishes over. */
@FunctionalInterface
public interface BrokerConnector {

  /**
   * @throws dev.rune.scheduler.exceptions.BrokerUnavailableException if no connection could be
   *     established within the retry budget
   */
  MessagePublisher connect();
}
