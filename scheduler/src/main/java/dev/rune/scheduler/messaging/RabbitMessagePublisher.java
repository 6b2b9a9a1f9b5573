package dev.rune.scheduler.messaging;

import dev.rune.scheduler.json.JSONUtil;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes over one shared RabbitMQ connection, opening a short-lived channel per message so
 * concurrent dispatches never share a channel.
 */
public class RabbitMessagePublisher implements MessagePublisher {
  private static final Logger logger = LoggerFactory.getLogger(RabbitMessagePublisher.class);

  static final AMQP.BasicProperties PERSISTENT_JSON =
      new AMQP.BasicProperties.Builder()
          .contentType("application/json")
          .deliveryMode(2)
          .build();

  private final Connection connection;
  private final long confirmTimeoutMs;

  public RabbitMessagePublisher(Connection connection, long confirmTimeoutMs) {
    this.connection = Objects.requireNonNull(connection);
    this.confirmTimeoutMs = confirmTimeoutMs;
  }

  @Override
  public boolean publish(String queueName, Object message) {
    byte[] body;
    try {
      body = JSONUtil.toJsonBytes(message);
    } catch (JSONUtil.JsonRuntimeException e) {
      logger.error("Failed to serialize message for queue {}", queueName, e);
      return false;
    }

    try (Channel channel = connection.createChannel()) {
      if (channel == null) {
        logger.error("No channel available to publish to queue {}", queueName);
        return false;
      }
      channel.queueDeclare(queueName, true, false, false, null);
      channel.confirmSelect();
      channel.basicPublish("", queueName, PERSISTENT_JSON, body);
      channel.waitForConfirmsOrDie(confirmTimeoutMs);
      logger.debug("Published {} bytes to queue {}", body.length, queueName);
      return true;
    } catch (IOException | TimeoutException | RuntimeException e) {
      logger.error("Failed to publish message to queue {}: {}", queueName, e.toString());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.error("Interrupted while publishing to queue {}", queueName);
      return false;
    }
  }

  @Override
  public boolean isHealthy() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
      logger.info("Message broker connection closed");
    } catch (IOException e) {
      logger.warn("Error closing message broker connection", e);
    }
  }
}
