package dev.rune.scheduler.config;

import dev.rune.scheduler.Constants;

import java.time.Duration;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Immutable configuration of the scheduler process. Start from {@link #defaults()} or {@link
 * #defaultsFromEnv()} and adjust with the {@code withX} copy methods.
 *
 * <p>{@code dataSource} may carry a pool the caller already owns; when it is null the system
 * database builds its own pool from {@code databaseUrl}, {@code dbUser} and {@code dbPassword}.
 */
public record SchedulerConfig(
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    int queryTimeoutSeconds,
    String databaseSchema,
    String workflowsTable,
    String credentialsTable,
    int pollIntervalSeconds,
    int lookAheadSeconds,
    int healthCheckIntervalSeconds,
    int maxConsecutiveFailures,
    int maxConcurrentDispatches,
    String encryptionKey,
    BrokerConfig broker,
    HikariDataSource dataSource) {

  public SchedulerConfig {
    if (maximumPoolSize < 1) {
      throw new IllegalArgumentException("SchedulerConfig.maximumPoolSize must be at least 1");
    }
    if (connectionTimeout < 0) {
      throw new IllegalArgumentException("SchedulerConfig.connectionTimeout must not be negative");
    }
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException(
          "SchedulerConfig.queryTimeoutSeconds must not be negative");
    }
    if (pollIntervalSeconds <= 0) {
      throw new IllegalArgumentException("SchedulerConfig.pollIntervalSeconds must be positive");
    }
    if (lookAheadSeconds < 0) {
      throw new IllegalArgumentException("SchedulerConfig.lookAheadSeconds must not be negative");
    }
    if (healthCheckIntervalSeconds <= 0) {
      throw new IllegalArgumentException(
          "SchedulerConfig.healthCheckIntervalSeconds must be positive");
    }
    if (maxConsecutiveFailures < 1) {
      throw new IllegalArgumentException(
          "SchedulerConfig.maxConsecutiveFailures must be at least 1");
    }
    if (maxConcurrentDispatches < 1) {
      throw new IllegalArgumentException(
          "SchedulerConfig.maxConcurrentDispatches must be at least 1");
    }
    if (encryptionKey != null && encryptionKey.isEmpty()) {
      throw new IllegalArgumentException(
          "SchedulerConfig.encryptionKey must not be empty if specified");
    }
    if (databaseSchema == null || databaseSchema.isEmpty()) {
      databaseSchema = Constants.DB_SCHEMA;
    }
    if (workflowsTable == null || workflowsTable.isEmpty()) {
      workflowsTable = Constants.WORKFLOWS_TABLE;
    }
    if (credentialsTable == null || credentialsTable.isEmpty()) {
      credentialsTable = Constants.CREDENTIALS_TABLE;
    }
    if (broker == null) {
      broker = BrokerConfig.defaults();
    }
  }

  public static SchedulerConfig defaults() {
    return new SchedulerConfig(
        null,
        "postgres",
        null,
        4, // maximumPoolSize
        30000, // connectionTimeout
        10, // queryTimeoutSeconds
        Constants.DB_SCHEMA,
        Constants.WORKFLOWS_TABLE,
        Constants.CREDENTIALS_TABLE,
        Constants.DEFAULT_POLL_INTERVAL_SECONDS,
        Constants.DEFAULT_LOOK_AHEAD_SECONDS,
        Constants.DEFAULT_HEALTHCHECK_INTERVAL_SECONDS,
        Constants.DEFAULT_MAX_CONSECUTIVE_FAILURES,
        Constants.DEFAULT_MAX_CONCURRENT_DISPATCHES,
        null,
        BrokerConfig.defaults(),
        null);
  }

  /**
   * Defaults overridden by the process environment. Where two variable names are accepted, the
   * first one set wins; the second is the name used by earlier deployments of the scheduler.
   */
  public static SchedulerConfig defaultsFromEnv() {
    var defaults = defaults();
    String dbUser =
        firstFromEnv(Constants.POSTGRES_USER_ENV_VAR, Constants.POSTGRES_USER_FALLBACK_ENV_VAR);
    String databaseUrl = emptyToNull(System.getenv(Constants.SCHEDULER_JDBC_URL_ENV_VAR));
    if (databaseUrl == null) {
      databaseUrl = jdbcUrlFromParts();
    }
    return defaults
        .withDatabaseUrl(databaseUrl)
        .withDbUser(dbUser != null ? dbUser : defaults.dbUser())
        .withDbPassword(
            firstFromEnv(
                Constants.POSTGRES_PASSWORD_ENV_VAR, Constants.POSTGRES_PASSWORD_FALLBACK_ENV_VAR))
        .withMaximumPoolSize(
            intFromEnv(Constants.DB_POOL_MAX_SIZE_ENV_VAR, defaults.maximumPoolSize()))
        .withDatabaseSchema(System.getenv(Constants.SCHEDULER_DB_SCHEMA_ENV_VAR))
        .withPollIntervalSeconds(
            intFromEnv(Constants.POLL_INTERVAL_ENV_VAR, Constants.DEFAULT_POLL_INTERVAL_SECONDS))
        .withLookAheadSeconds(
            intFromEnv(
                Constants.LOOK_AHEAD_ENV_VAR,
                intFromEnv(
                    Constants.LOOK_AHEAD_FALLBACK_ENV_VAR, Constants.DEFAULT_LOOK_AHEAD_SECONDS)))
        .withHealthCheckIntervalSeconds(
            intFromEnv(
                Constants.HEALTHCHECK_INTERVAL_ENV_VAR,
                Constants.DEFAULT_HEALTHCHECK_INTERVAL_SECONDS))
        .withMaxConsecutiveFailures(
            intFromEnv(
                Constants.MAX_CONSECUTIVE_FAILURES_ENV_VAR,
                Constants.DEFAULT_MAX_CONSECUTIVE_FAILURES))
        .withMaxConcurrentDispatches(
            intFromEnv(
                Constants.MAX_CONCURRENT_DISPATCHES_ENV_VAR,
                Constants.DEFAULT_MAX_CONCURRENT_DISPATCHES))
        .withEncryptionKey(emptyToNull(System.getenv(Constants.ENCRYPTION_KEY_ENV_VAR)))
        .withBroker(BrokerConfig.defaultsFromEnv());
  }

  // null unless POSTGRES_HOST is set
  private static String jdbcUrlFromParts() {
    String host = emptyToNull(System.getenv(Constants.POSTGRES_HOST_ENV_VAR));
    if (host == null) {
      return null;
    }
    int port = intFromEnv(Constants.POSTGRES_PORT_ENV_VAR, Constants.DEFAULT_POSTGRES_PORT);
    String db = emptyToNull(System.getenv(Constants.POSTGRES_DB_ENV_VAR));
    return "jdbc:postgresql://%s:%d/%s"
        .formatted(host, port, db != null ? db : Constants.DEFAULT_POSTGRES_DB);
  }

  /** The value of the first of {@code names} that is set and not empty, else null. */
  static String firstFromEnv(String... names) {
    for (String name : names) {
      String value = emptyToNull(System.getenv(name));
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  static int intFromEnv(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Environment variable %s must be an integer, got '%s'".formatted(name, value), e);
    }
  }

  static String emptyToNull(String value) {
    return (value == null || value.isEmpty()) ? null : value;
  }

  public Duration pollInterval() {
    return Duration.ofSeconds(pollIntervalSeconds);
  }

  public Duration lookAhead() {
    return Duration.ofSeconds(lookAheadSeconds);
  }

  public Duration healthCheckInterval() {
    return Duration.ofSeconds(healthCheckIntervalSeconds);
  }

  public SchedulerConfig withDatabaseUrl(String v) {
    return new SchedulerConfig(
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withDbUser(String v) {
    return new SchedulerConfig(
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withDbPassword(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withMaximumPoolSize(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withConnectionTimeout(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withQueryTimeoutSeconds(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withDatabaseSchema(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        v,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withWorkflowsTable(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        v,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withCredentialsTable(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        v,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withPollIntervalSeconds(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        v,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withLookAheadSeconds(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        v,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withHealthCheckIntervalSeconds(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        v,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withMaxConsecutiveFailures(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        v,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withMaxConcurrentDispatches(int v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        v,
        encryptionKey,
        broker,
        dataSource);
  }

  public SchedulerConfig withEncryptionKey(String v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        v,
        broker,
        dataSource);
  }

  public SchedulerConfig withBroker(BrokerConfig v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        v,
        dataSource);
  }

  public SchedulerConfig withDataSource(HikariDataSource v) {
    return new SchedulerConfig(
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        queryTimeoutSeconds,
        databaseSchema,
        workflowsTable,
        credentialsTable,
        pollIntervalSeconds,
        lookAheadSeconds,
        healthCheckIntervalSeconds,
        maxConsecutiveFailures,
        maxConcurrentDispatches,
        encryptionKey,
        broker,
        v);
  }

  // Override toString to mask the DB password and the encryption key
  @Override
  public String toString() {
    return "SchedulerConfig[databaseUrl=%s, dbUser=%s, dbPassword=***, maximumPoolSize=%d, connectionTimeout=%d, queryTimeoutSeconds=%d, databaseSchema=%s, workflowsTable=%s, credentialsTable=%s, pollIntervalSeconds=%d, lookAheadSeconds=%d, healthCheckIntervalSeconds=%d, maxConsecutiveFailures=%d, maxConcurrentDispatches=%d, encryptionKey=%s, broker=%s, dataSource=%s]"
        .formatted(
            databaseUrl,
            dbUser,
            maximumPoolSize,
            connectionTimeout,
            queryTimeoutSeconds,
            databaseSchema,
            workflowsTable,
            credentialsTable,
            pollIntervalSeconds,
            lookAheadSeconds,
            healthCheckIntervalSeconds,
            maxConsecutiveFailures,
            maxConcurrentDispatches,
            encryptionKey == null ? null : "***",
            broker,
            dataSource);
  }
}
