package dev.rune.scheduler.config;

import dev.rune.scheduler.Constants;

/**
 * Message broker settings. A non-null {@code url} (an {@code amqp://} URI) takes precedence over
 * the individual host, port, credential and virtual host settings.
 */
public record BrokerConfig(
    String url,
    String host,
    int port,
    String username,
    String password,
    String virtualHost,
    String queueName,
    int timeoutMs,
    int connectAttempts) {

  public BrokerConfig {
    if (queueName == null || queueName.isEmpty()) {
      throw new IllegalArgumentException("BrokerConfig.queueName must not be null or empty");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("BrokerConfig.port must be between 1 and 65535");
    }
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("BrokerConfig.timeoutMs must be positive");
    }
    if (connectAttempts < 1) {
      throw new IllegalArgumentException("BrokerConfig.connectAttempts must be at least 1");
    }
    if (url != null && url.isEmpty()) {
      url = null;
    }
  }

  public static BrokerConfig defaults() {
    return new BrokerConfig(
        null, "localhost", 5672, "guest", "guest", "/", Constants.DEFAULT_QUEUE_NAME, 10000, 5);
  }

  public static BrokerConfig defaultsFromEnv() {
    var config = defaults().withUrl(System.getenv(Constants.RABBITMQ_URL_ENV_VAR));
    String host = System.getenv(Constants.RABBITMQ_HOST_ENV_VAR);
    if (host != null && !host.isEmpty()) config = config.withHost(host);
    config =
        config.withPort(SchedulerConfig.intFromEnv(Constants.RABBITMQ_PORT_ENV_VAR, config.port()));
    String username =
        SchedulerConfig.firstFromEnv(
            Constants.RABBITMQ_USERNAME_ENV_VAR, Constants.RABBITMQ_USER_ENV_VAR);
    if (username != null) config = config.withUsername(username);
    String password = System.getenv(Constants.RABBITMQ_PASSWORD_ENV_VAR);
    if (password != null && !password.isEmpty()) config = config.withPassword(password);
    String vhost = System.getenv(Constants.RABBITMQ_VHOST_ENV_VAR);
    if (vhost != null && !vhost.isEmpty()) config = config.withVirtualHost(vhost);
    String queueName =
        SchedulerConfig.firstFromEnv(
            Constants.RABBITMQ_QUEUE_NAME_ENV_VAR, Constants.RABBITMQ_QUEUE_ENV_VAR);
    if (queueName != null) config = config.withQueueName(queueName);
    return config;
  }

  public BrokerConfig withUrl(String v) {
    return new BrokerConfig(
        v,
        host,
        port,
        username,
        password,
        virtualHost,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withHost(String v) {
    return new BrokerConfig(
        url,
        v,
        port,
        username,
        password,
        virtualHost,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withPort(int v) {
    return new BrokerConfig(
        url,
        host,
        v,
        username,
        password,
        virtualHost,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withUsername(String v) {
    return new BrokerConfig(
        url,
        host,
        port,
        v,
        password,
        virtualHost,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withPassword(String v) {
    return new BrokerConfig(
        url,
        host,
        port,
        username,
        v,
        virtualHost,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withVirtualHost(String v) {
    return new BrokerConfig(
        url,
        host,
        port,
        username,
        password,
        v,
        queueName,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withQueueName(String v) {
    return new BrokerConfig(
        url,
        host,
        port,
        username,
        password,
        virtualHost,
        v,
        timeoutMs,
        connectAttempts);
  }

  public BrokerConfig withTimeoutMs(int v) {
    return new BrokerConfig(
        url,
        host,
        port,
        username,
        password,
        virtualHost,
        queueName,
        v,
        connectAttempts);
  }

  public BrokerConfig withConnectAttempts(int v) {
    return new BrokerConfig(
        url,
        host,
        port,
        username,
        password,
        virtualHost,
        queueName,
        timeoutMs,
        v);
  }

  @Override
  public String toString() {
    return "BrokerConfig[url=%s, host=%s, port=%d, username=%s, password=***, virtualHost=%s, queueName=%s, timeoutMs=%d, connectAttempts=%d]"
        .formatted(
            url == null ? null : url.replaceAll("//[^@/]*@", "//***@"),
            host,
            port,
            username,
            virtualHost,
            queueName,
            timeoutMs,
            connectAttempts);
  }
}
