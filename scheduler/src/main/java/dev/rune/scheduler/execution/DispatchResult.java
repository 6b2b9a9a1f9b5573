package dev.rune.scheduler.execution;

import org.jspecify.annotations.Nullable;

/** What happened to one due schedule during a tick. */
public record DispatchResult(
    long scheduleId,
    long workflowId,
    Status status,
    @Nullable String executionId,
    @Nullable String error) {

  public enum Status {
    /** Fetched through the look-ahead window but not yet due; nothing was recorded. */
    SKIPPED,
    SUCCEEDED,
    FAILED,
    /** The attempt happened but its outcome could not be written. */
    BOOKKEEPING_LOST
  }
}
