package dev.rune.scheduler.exceptions;

/**
 * {@code ScheduleConflictException} is thrown when a schedule is created for a workflow that
 * already has one. Existing schedules are never silently replaced; callers must update or delete
 * the existing schedule first.
 */
public class ScheduleConflictException extends SchedulerException {
  private final long workflowId;

  public ScheduleConflictException(long workflowId) {
    super(
        ErrorCode.SCHEDULE_CONFLICT,
        String.format(
            "Schedule already exists for workflow %d. Update or delete the existing schedule first.",
            workflowId));
    this.workflowId = workflowId;
  }

  /** The workflow that already owns a schedule */
  public long workflowId() {
    return this.workflowId;
  }
}
