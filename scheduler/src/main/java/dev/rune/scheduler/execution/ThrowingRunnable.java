package dev.rune.scheduler.execution;

@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {
  void execute() throws E;
}
