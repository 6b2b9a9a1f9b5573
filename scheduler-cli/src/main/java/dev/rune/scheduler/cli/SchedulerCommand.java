package dev.rune.scheduler.cli;

import dev.rune.scheduler.execution.SchedulerDaemon;
import dev.rune.scheduler.json.JSONUtil;
import dev.rune.scheduler.json.JSONUtil.JsonRuntimeException;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "rune-scheduler",
    description = "Runs and manages the Rune workflow scheduler",
    mixinStandardHelpOptions = true,
    subcommands = {
      RunCommand.class,
      MigrateCommand.class,
      KeygenCommand.class,
      ScheduleCommand.class
    },
    versionProvider = SchedulerCommand.class)
public class SchedulerCommand implements Runnable, IVersionProvider {

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    var pkg = SchedulerDaemon.class.getPackage();
    var version = pkg == null ? null : pkg.getImplementationVersion();
    return new String[] {
      "${COMMAND-FULL-NAME} "
          + (version == null ? "<unknown version>" : "v%s".formatted(version))
    };
  }

  public static String prettyPrint(Object object) {
    var writer = JSONUtil.mapper().writerWithDefaultPrettyPrinter();
    try {
      return writer.writeValueAsString(Objects.requireNonNull(object));
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }
}
