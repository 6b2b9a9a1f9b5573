package dev.rune.scheduler.cli;

import picocli.CommandLine;

public class Main {
  public static void main(String[] args) {
    var cmd = new CommandLine(new SchedulerCommand());
    var exitCode = cmd.execute(args);
    System.exit(exitCode);
  }
}
