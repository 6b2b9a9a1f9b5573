package dev.rune.scheduler.messaging;

import dev.rune.scheduler.exceptions.InvalidWorkflowGraphException;
import dev.rune.scheduler.workflow.WorkflowEdge;
import dev.rune.scheduler.workflow.WorkflowGraph;
import dev.rune.scheduler.workflow.WorkflowNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns a resolved workflow graph into a run request on the workflow queue. */
public class WorkflowRunPublisher {
  private static final Logger logger = LoggerFactory.getLogger(WorkflowRunPublisher.class);

  private final MessagePublisher publisher;
  private final String queueName;

  public WorkflowRunPublisher(MessagePublisher publisher, String queueName) {
    this.publisher = Objects.requireNonNull(publisher);
    this.queueName = Objects.requireNonNull(queueName);
  }

  public String queueName() {
    return queueName;
  }

  /**
   * Builds the run request for {@code graph} and publishes it. Execution starts at the
   * destination of the first edge leaving the trigger node, in stored edge order.
   *
   * @return whether the broker confirmed the message
   * @throws InvalidWorkflowGraphException if the graph has no nodes, does not have exactly one
   *     trigger node, or has no edge leaving the trigger node
   */
  public boolean publishWorkflowRun(long workflowId, String executionId, WorkflowGraph graph) {
    String entryNode = entryNode(graph);
    var message =
        new ExecutionMessage(
            String.valueOf(workflowId), executionId, entryNode, graph.toJson(), Map.of());
    boolean published = publisher.publish(queueName, message);
    if (published) {
      logger.debug(
          "Queued execution {} of workflow {} starting at node {}",
          executionId,
          workflowId,
          entryNode);
    }
    return published;
  }

  static String entryNode(WorkflowGraph graph) {
    if (graph.nodes().isEmpty()) {
      throw new InvalidWorkflowGraphException("Workflow has no nodes");
    }
    List<WorkflowNode> triggers = graph.triggerNodes();
    if (triggers.size() != 1) {
      throw new InvalidWorkflowGraphException(
          "Workflow must have exactly one trigger node, found %d".formatted(triggers.size()));
    }
    WorkflowNode trigger = triggers.get(0);
    List<WorkflowEdge> outgoing = graph.edgesFrom(trigger.id());
    if (outgoing.isEmpty()) {
      throw new InvalidWorkflowGraphException(
          "Trigger node %s has no outgoing edge".formatted(trigger.id()));
    }
    return outgoing.get(0).dst();
  }
}
