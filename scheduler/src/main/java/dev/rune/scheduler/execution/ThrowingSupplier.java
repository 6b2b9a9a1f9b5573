package dev.rune.scheduler.execution;

@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {
  T execute() throws E;
}
