package dev.rune.scheduler.exceptions;

/**
 * {@code WorkflowNotFoundException} is thrown when a schedule operation targets a workflow that
 * the workflow store does not know about.
 *
 * <p>At dispatch time the daemon records this as the failure outcome {@code Workflow not found}
 * rather than letting it escape.
 */
public class WorkflowNotFoundException extends SchedulerException {
  private final long workflowId;

  public WorkflowNotFoundException(long workflowId) {
    super(ErrorCode.WORKFLOW_NOT_FOUND, String.format("Workflow not found: %d", workflowId));
    this.workflowId = workflowId;
  }

  /** ID of the workflow that was targeted, but did not exist */
  public long workflowId() {
    return workflowId;
  }
}
