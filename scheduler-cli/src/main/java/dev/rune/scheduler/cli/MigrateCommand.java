package dev.rune.scheduler.cli;

import dev.rune.scheduler.migrations.MigrationManager;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create or upgrade the scheduler tables",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var config = dbOptions.config();
    var out = spec.commandLine().getOut();
    out.println("Starting scheduler migrations");
    out.println("  Database: %s".formatted(config.databaseUrl()));
    out.println("  Database User: %s".formatted(config.dbUser()));
    out.println("  Schema: %s".formatted(config.databaseSchema()));

    MigrationManager.runMigrations(config);
    out.println("Scheduler migrations complete");
    return 0;
  }
}
