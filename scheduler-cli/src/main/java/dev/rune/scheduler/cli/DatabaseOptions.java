package dev.rune.scheduler.cli;

import dev.rune.scheduler.config.SchedulerConfig;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description =
          "JDBC URL of the platform database (defaults to SCHEDULER_JDBC_URL, or a URL built from"
              + " POSTGRES_HOST, POSTGRES_PORT and POSTGRES_DB)")
  String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "database user name (defaults to PGUSER or POSTGRES_USER)")
  String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "database password (defaults to PGPASSWORD or POSTGRES_PASSWORD)",
      arity = "0..1",
      interactive = true)
  String password;

  @Option(
      names = {"--schema"},
      description = "schema holding the scheduler tables (defaults to SCHEDULER_DB_SCHEMA or public)")
  String schema;

  /** Environment configuration with any options given on the command line applied on top. */
  public SchedulerConfig config() {
    var config = SchedulerConfig.defaultsFromEnv();
    if (url != null) config = config.withDatabaseUrl(url);
    if (user != null) config = config.withDbUser(user);
    if (password != null) config = config.withDbPassword(password);
    if (schema != null) config = config.withDatabaseSchema(schema);
    return config;
  }
}
