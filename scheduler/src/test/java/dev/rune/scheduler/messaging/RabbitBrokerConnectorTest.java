package dev.rune.scheduler.messaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.rune.scheduler.config.BrokerConfig;
import dev.rune.scheduler.exceptions.BrokerUnavailableException;
import dev.rune.scheduler.exceptions.ErrorCode;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.Test;

public class RabbitBrokerConnectorTest {

  @Test
  public void retriesUntilConnected() throws Exception {
    var factory = mock(ConnectionFactory.class);
    var connection = mock(Connection.class);
    when(factory.newConnection("rune-scheduler"))
        .thenThrow(new ConnectException("refused"))
        .thenThrow(new ConnectException("refused"))
        .thenReturn(connection);

    var connector =
        new RabbitBrokerConnector(
            BrokerConfig.defaults().withConnectAttempts(5), factory, Duration.ZERO);
    var publisher = connector.connect();

    assertInstanceOf(RabbitMessagePublisher.class, publisher);
    verify(factory, times(3)).newConnection("rune-scheduler");
  }

  @Test
  public void givesUpAfterConfiguredAttempts() throws Exception {
    var factory = mock(ConnectionFactory.class);
    when(factory.newConnection("rune-scheduler")).thenThrow(new IOException("down"));

    var connector =
        new RabbitBrokerConnector(
            BrokerConfig.defaults().withConnectAttempts(3), factory, Duration.ZERO);
    var e = assertThrows(BrokerUnavailableException.class, connector::connect);

    assertEquals(ErrorCode.BROKER_UNAVAILABLE, e.errorCode());
    assertEquals("Could not connect to message broker after 3 attempts", e.getMessage());
    assertInstanceOf(IOException.class, e.getCause());
    verify(factory, times(3)).newConnection("rune-scheduler");
  }

  @Test
  public void configuresFromHostSettings() throws Exception {
    var factory = mock(ConnectionFactory.class);
    var config =
        BrokerConfig.defaults()
            .withHost("mq.internal")
            .withPort(5673)
            .withUsername("svc")
            .withPassword("pw")
            .withVirtualHost("runs")
            .withTimeoutMs(2500);

    new RabbitBrokerConnector(config, factory, Duration.ZERO).configure();

    verify(factory).setHost("mq.internal");
    verify(factory).setPort(5673);
    verify(factory).setUsername("svc");
    verify(factory).setPassword("pw");
    verify(factory).setVirtualHost("runs");
    verify(factory).setConnectionTimeout(2500);
    verify(factory).setAutomaticRecoveryEnabled(true);
  }

  @Test
  public void urlTakesPrecedence() throws Exception {
    var factory = mock(ConnectionFactory.class);
    var config = BrokerConfig.defaults().withUrl("amqp://u:p@mq:5672/vh");

    new RabbitBrokerConnector(config, factory, Duration.ZERO).configure();

    verify(factory).setUri("amqp://u:p@mq:5672/vh");
    verify(factory, times(0)).setHost("localhost");
  }
}
