package dev.rune.scheduler.cli;

import dev.rune.scheduler.config.SchedulerConfig;
import dev.rune.scheduler.credentials.CredentialEncryption;
import dev.rune.scheduler.credentials.CredentialResolver;
import dev.rune.scheduler.database.SystemDatabase;
import dev.rune.scheduler.exceptions.BrokerUnavailableException;
import dev.rune.scheduler.execution.SchedulerDaemon;
import dev.rune.scheduler.messaging.RabbitBrokerConnector;
import dev.rune.scheduler.migrations.MigrationManager;

import java.time.Clock;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "run",
    description = "Run the scheduler daemon until it is terminated",
    mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-m", "--migrate"},
      description = "Create or upgrade the scheduler tables before starting")
  boolean migrate;

  @Option(
      names = {"--poll-interval"},
      description = "Seconds between polls (defaults to SCHEDULER_POLL_INTERVAL or 30)")
  Integer pollInterval;

  @Option(
      names = {"--look-ahead"},
      description = "Look-ahead window in seconds (defaults to SCHEDULER_LOOK_AHEAD_SECONDS or 60)")
  Integer lookAhead;

  @Option(
      names = {"--healthcheck-interval"},
      description =
          "Seconds between health checks (defaults to SCHEDULER_HEALTHCHECK_INTERVAL or 60)")
  Integer healthCheckInterval;

  @Spec CommandSpec spec;

  SchedulerConfig config() {
    var config = dbOptions.config();
    if (pollInterval != null) config = config.withPollIntervalSeconds(pollInterval);
    if (lookAhead != null) config = config.withLookAheadSeconds(lookAhead);
    if (healthCheckInterval != null) {
      config = config.withHealthCheckIntervalSeconds(healthCheckInterval);
    }
    return config;
  }

  @Override
  public Integer call() throws Exception {
    var config = config();
    var err = spec.commandLine().getErr();
    if (config.encryptionKey() == null) {
      err.println("ENCRYPTION_KEY must be set to decrypt workflow credentials");
      return 1;
    }
    var encryption = new CredentialEncryption(config.encryptionKey());

    if (migrate) {
      MigrationManager.runMigrations(config);
    }

    try (var systemDatabase = new SystemDatabase(config)) {
      var daemon =
          new SchedulerDaemon(
              config,
              systemDatabase,
              systemDatabase,
              new CredentialResolver(systemDatabase, encryption),
              new RabbitBrokerConnector(config.broker()),
              Clock.systemUTC());
      try {
        daemon.start();
      } catch (BrokerUnavailableException e) {
        err.println("Scheduler could not start: %s".formatted(e.getMessage()));
        return 1;
      }

      Runtime.getRuntime().addShutdownHook(new Thread(daemon::stop, "SchedulerShutdownHook"));
      logger.info("Scheduler daemon running; send SIGTERM or SIGINT to stop");
      daemon.awaitTermination();
    }
    return 0;
  }
}
