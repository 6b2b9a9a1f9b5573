package dev.rune.scheduler.execution;

public enum DaemonState {
  STOPPED,
  CONNECTING,
  POLLING
}
