package dev.rune.scheduler.exceptions;

/**
 * Thrown when a workflow graph cannot be turned into an execution message: it has no nodes, it
 * does not have exactly one trigger node, or nothing follows the trigger node.
 */
public class InvalidWorkflowGraphException extends SchedulerException {

  public InvalidWorkflowGraphException(String message) {
    super(ErrorCode.INVALID_WORKFLOW_GRAPH, message);
  }
}
