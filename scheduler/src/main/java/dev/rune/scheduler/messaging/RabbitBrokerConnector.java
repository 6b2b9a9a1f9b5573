package dev.rune.scheduler.messaging;

import dev.rune.scheduler.config.BrokerConfig;
import dev.rune.scheduler.exceptions.BrokerUnavailableException;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects to RabbitMQ, retrying with exponential backoff up to {@link
 * BrokerConfig#connectAttempts()} times.
 */
public class RabbitBrokerConnector implements BrokerConnector {
  private static final Logger logger = LoggerFactory.getLogger(RabbitBrokerConnector.class);

  private static final String CONNECTION_NAME = "rune-scheduler";
  private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

  private final BrokerConfig config;
  private final ConnectionFactory factory;
  private final Duration initialBackoff;

  public RabbitBrokerConnector(BrokerConfig config) {
    this(config, new ConnectionFactory(), Duration.ofSeconds(1));
  }

  RabbitBrokerConnector(BrokerConfig config, ConnectionFactory factory, Duration initialBackoff) {
    this.config = Objects.requireNonNull(config);
    this.factory = Objects.requireNonNull(factory);
    this.initialBackoff = Objects.requireNonNull(initialBackoff);
  }

  void configure() {
    if (config.url() != null) {
      try {
        factory.setUri(config.url());
      } catch (Exception e) {
        throw new IllegalArgumentException("Invalid message broker URL", e);
      }
    } else {
      factory.setHost(config.host());
      factory.setPort(config.port());
      factory.setUsername(config.username());
      factory.setPassword(config.password());
      factory.setVirtualHost(config.virtualHost());
    }
    factory.setConnectionTimeout(config.timeoutMs());
    factory.setHandshakeTimeout(config.timeoutMs());
    factory.setChannelRpcTimeout(config.timeoutMs());
    factory.setAutomaticRecoveryEnabled(true);
  }

  @Override
  public MessagePublisher connect() {
    configure();

    Exception last = null;
    long backoffMs = initialBackoff.toMillis();
    for (int attempt = 1; attempt <= config.connectAttempts(); attempt++) {
      try {
        Connection connection = factory.newConnection(CONNECTION_NAME);
        logger.info("Connected to message broker (attempt {})", attempt);
        return new RabbitMessagePublisher(connection, config.timeoutMs());
      } catch (IOException | TimeoutException e) {
        last = e;
        if (attempt == config.connectAttempts()) {
          break;
        }
        logger.warn(
            "Message broker connection failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            config.connectAttempts(),
            e.getMessage(),
            backoffMs);
        try {
          Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new BrokerUnavailableException("Interrupted while connecting to broker", ie);
        }
        backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF.toMillis());
      }
    }
    throw new BrokerUnavailableException(
        "Could not connect to message broker after %d attempts".formatted(config.connectAttempts()),
        last);
  }
}
