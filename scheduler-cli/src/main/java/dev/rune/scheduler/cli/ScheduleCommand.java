package dev.rune.scheduler.cli;

import dev.rune.scheduler.database.SystemDatabase;
import dev.rune.scheduler.exceptions.InvalidScheduleException;
import dev.rune.scheduler.exceptions.SchedulerException;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.schedule.ScheduleService;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "schedule",
    aliases = {"sk"},
    description = "Inspect and manage workflow schedules",
    subcommands = {
      ListSchedulesCommand.class,
      GetScheduleCommand.class,
      CreateScheduleCommand.class,
      UpdateScheduleCommand.class,
      DeleteScheduleCommand.class,
    })
public class ScheduleCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  /**
   * Runs {@code action} against a service over a short-lived database connection, printing
   * scheduler errors instead of a stack trace.
   */
  static int withService(
      DatabaseOptions dbOptions, CommandSpec spec, Function<ScheduleService, Object> action) {
    try (var systemDatabase = new SystemDatabase(dbOptions.config())) {
      var service = new ScheduleService(systemDatabase, systemDatabase, Clock.systemUTC());
      var result = action.apply(service);
      if (result != null) {
        spec.commandLine().getOut().println(SchedulerCommand.prettyPrint(result));
      }
      return 0;
    } catch (SchedulerException e) {
      spec.commandLine()
          .getErr()
          .println("Error %d: %s".formatted(e.errorCode().getCode(), e.getMessage()));
      return 1;
    }
  }

  static ScheduleRecord require(ScheduleService service, long workflowId) {
    Optional<ScheduleRecord> schedule = service.getSchedule(workflowId);
    return schedule.orElseThrow(
        () -> new InvalidScheduleException("No schedule for workflow %d".formatted(workflowId)));
  }
}

@Command(name = "list", description = "List schedules, earliest next run first")
class ListSchedulesCommand implements Callable<Integer> {

  @Option(
      names = {"-a", "--active-only"},
      description = "Only list active schedules")
  boolean activeOnly;

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    return ScheduleCommand.withService(dbOptions, spec, s -> s.listSchedules(activeOnly));
  }
}

@Command(name = "get", description = "Show the schedule of a workflow")
class GetScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Workflow ID")
  long workflowId;

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    return ScheduleCommand.withService(
        dbOptions, spec, s -> ScheduleCommand.require(s, workflowId));
  }
}

@Command(name = "create", description = "Schedule a workflow to run at a fixed interval")
class CreateScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Workflow ID")
  long workflowId;

  @Option(
      names = {"-i", "--interval"},
      required = true,
      description = "Seconds between runs")
  int intervalSeconds;

  @Option(
      names = {"-s", "--start"},
      description = "First run time (ISO 8601 format, defaults to now)")
  String start;

  @Option(
      names = {"--inactive"},
      description = "Create the schedule paused")
  boolean inactive;

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    var startAt = start == null ? null : OffsetDateTime.parse(start).toInstant();
    return ScheduleCommand.withService(
        dbOptions,
        spec,
        s -> s.createSchedule(workflowId, intervalSeconds, startAt, !inactive));
  }
}

@Command(name = "update", description = "Change, pause or resume the schedule of a workflow")
class UpdateScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Workflow ID")
  long workflowId;

  @Option(
      names = {"-i", "--interval"},
      description = "Seconds between runs")
  Integer intervalSeconds;

  @Option(
      names = {"-s", "--start"},
      description = "Start time (ISO 8601 format)")
  String start;

  @Option(
      names = {"--active"},
      arity = "1",
      description = "true to resume the schedule, false to pause it")
  Boolean active;

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    var startAt = start == null ? null : OffsetDateTime.parse(start).toInstant();
    return ScheduleCommand.withService(
        dbOptions,
        spec,
        s ->
            s.updateSchedule(
                ScheduleCommand.require(s, workflowId), intervalSeconds, startAt, active));
  }
}

@Command(name = "delete", description = "Delete the schedule of a workflow")
class DeleteScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Workflow ID")
  long workflowId;

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    return ScheduleCommand.withService(
        dbOptions,
        spec,
        s -> {
          s.deleteSchedule(ScheduleCommand.require(s, workflowId));
          return null;
        });
  }
}
