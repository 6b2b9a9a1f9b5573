package dev.rune.scheduler;

public class Constants {

  public static final String DB_SCHEMA = "public";
  public static final String WORKFLOWS_TABLE = "workflows";
  public static final String CREDENTIALS_TABLE = "workflow_credentials";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String SCHEDULER_JDBC_URL_ENV_VAR = "SCHEDULER_JDBC_URL";
  public static final String SCHEDULER_DB_SCHEMA_ENV_VAR = "SCHEDULER_DB_SCHEMA";
  public static final String DB_POOL_MAX_SIZE_ENV_VAR = "DB_POOL_MAX_SIZE";

  // component-wise database settings, read when no JDBC URL is given
  public static final String POSTGRES_HOST_ENV_VAR = "POSTGRES_HOST";
  public static final String POSTGRES_PORT_ENV_VAR = "POSTGRES_PORT";
  public static final String POSTGRES_DB_ENV_VAR = "POSTGRES_DB";
  public static final String POSTGRES_USER_FALLBACK_ENV_VAR = "POSTGRES_USER";
  public static final String POSTGRES_PASSWORD_FALLBACK_ENV_VAR = "POSTGRES_PASSWORD";

  public static final String POLL_INTERVAL_ENV_VAR = "SCHEDULER_POLL_INTERVAL";
  public static final String LOOK_AHEAD_ENV_VAR = "SCHEDULER_LOOK_AHEAD_SECONDS";
  public static final String LOOK_AHEAD_FALLBACK_ENV_VAR = "SCHEDULER_LOOK_AHEAD";
  public static final String HEALTHCHECK_INTERVAL_ENV_VAR = "SCHEDULER_HEALTHCHECK_INTERVAL";
  public static final String MAX_CONSECUTIVE_FAILURES_ENV_VAR =
      "SCHEDULER_MAX_CONSECUTIVE_FAILURES";
  public static final String MAX_CONCURRENT_DISPATCHES_ENV_VAR =
      "SCHEDULER_MAX_CONCURRENT_DISPATCHES";

  public static final String RABBITMQ_URL_ENV_VAR = "RABBITMQ_URL";
  public static final String RABBITMQ_HOST_ENV_VAR = "RABBITMQ_HOST";
  public static final String RABBITMQ_PORT_ENV_VAR = "RABBITMQ_PORT";
  public static final String RABBITMQ_USERNAME_ENV_VAR = "RABBITMQ_USERNAME";
  public static final String RABBITMQ_USER_ENV_VAR = "RABBITMQ_USER";
  public static final String RABBITMQ_PASSWORD_ENV_VAR = "RABBITMQ_PASSWORD";
  public static final String RABBITMQ_VHOST_ENV_VAR = "RABBITMQ_VHOST";
  public static final String RABBITMQ_QUEUE_NAME_ENV_VAR = "RABBITMQ_QUEUE_NAME";
  public static final String RABBITMQ_QUEUE_ENV_VAR = "RABBITMQ_QUEUE";

  public static final String ENCRYPTION_KEY_ENV_VAR = "ENCRYPTION_KEY";

  public static final int DEFAULT_POLL_INTERVAL_SECONDS = 30;
  public static final int DEFAULT_LOOK_AHEAD_SECONDS = 60;
  public static final int DEFAULT_HEALTHCHECK_INTERVAL_SECONDS = 60;
  public static final int DEFAULT_POSTGRES_PORT = 5432;
  public static final String DEFAULT_POSTGRES_DB = "rune";
  public static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;
  public static final int DEFAULT_MAX_CONCURRENT_DISPATCHES = 8;
  public static final String DEFAULT_QUEUE_NAME = "workflow_queue";

  /** One year; the largest interval a schedule may carry. */
  public static final int MAX_INTERVAL_SECONDS = 31_536_000;

  public static final String EXECUTION_ID_PREFIX = "scheduled_";
}
