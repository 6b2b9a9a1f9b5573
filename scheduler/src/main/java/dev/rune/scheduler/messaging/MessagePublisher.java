package dev.rune.scheduler.messaging;

/** Publishes JSON messages to a named durable queue on the message broker. */
public interface MessagePublisher extends AutoCloseable {

  /**
   * Publishes {@code message}, serialized as JSON, to {@code queueName} as a persistent message
   * and waits for the broker to confirm it.
   *
   * @return {@code true} once the broker has confirmed the message; {@code false} on any broker or
   *     serialization failure. Never throws.
   */
  boolean publish(String queueName, Object message);

  /** Whether the broker connection is open. */
  boolean isHealthy();

  @Override
  void close();
}
