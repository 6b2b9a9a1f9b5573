package dev.rune.scheduler.messaging;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Body of a workflow run request as consumed by the workers. */
@JsonPropertyOrder({
  "workflow_id",
  "execution_id",
  "current_node",
  "workflow_definition",
  "accumulated_context"
})
public record ExecutionMessage(
    @JsonProperty("workflow_id") String workflowId,
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("current_node") String currentNode,
    @JsonProperty("workflow_definition") ObjectNode workflowDefinition,
    @JsonProperty("accumulated_context") Map<String, Object> accumulatedContext) {}
