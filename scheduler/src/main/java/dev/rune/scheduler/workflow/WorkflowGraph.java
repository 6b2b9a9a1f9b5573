package dev.rune.scheduler.workflow;

import dev.rune.scheduler.json.JSONUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Immutable workflow definition: nodes and edges in stored order. Built once from the workflow
 * document read out of the store; transformations return new graphs.
 */
public record WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {

  public WorkflowGraph {
    nodes = List.copyOf(Objects.requireNonNull(nodes));
    edges = List.copyOf(Objects.requireNonNull(edges));
  }

  public static WorkflowGraph fromJson(String json) {
    return fromJson(JSONUtil.readTree(json));
  }

  /**
   * Parses a {@code {"nodes": [...], "edges": [...]}} document. Missing arrays are read as empty.
   *
   * @throws IllegalArgumentException if the document is not shaped like a workflow
   */
  public static WorkflowGraph fromJson(JsonNode json) {
    if (json == null || !json.isObject()) {
      throw new IllegalArgumentException("workflow document must be a JSON object");
    }
    List<WorkflowNode> nodes = new ArrayList<>();
    for (JsonNode node : array(json, "nodes")) {
      nodes.add(WorkflowNode.fromJson(node));
    }
    List<WorkflowEdge> edges = new ArrayList<>();
    for (JsonNode edge : array(json, "edges")) {
      edges.add(JSONUtil.mapper().convertValue(edge, WorkflowEdge.class));
    }
    return new WorkflowGraph(nodes, edges);
  }

  private static Iterable<JsonNode> array(JsonNode json, String field) {
    JsonNode value = json.get(field);
    if (value == null || value.isNull()) {
      return List.of();
    }
    if (!value.isArray()) {
      throw new IllegalArgumentException("workflow '%s' must be an array".formatted(field));
    }
    return value;
  }

  public List<WorkflowNode> triggerNodes() {
    return nodes.stream().filter(WorkflowNode::isTrigger).toList();
  }

  /** Whether a schedule may be attached: some node is a {@code trigger}-typed trigger. */
  public boolean hasTriggerNode() {
    return nodes.stream().anyMatch(WorkflowNode::isScheduleTrigger);
  }

  public List<WorkflowEdge> edgesFrom(String nodeId) {
    return edges.stream().filter(e -> e.src().equals(nodeId)).toList();
  }

  public WorkflowGraph withNodes(List<WorkflowNode> newNodes) {
    return new WorkflowGraph(newNodes, edges);
  }

  public ObjectNode toJson() {
    ObjectNode root = JSONUtil.createObjectNode();
    ArrayNode nodeArray = root.putArray("nodes");
    nodes.forEach(n -> nodeArray.add(n.toJson()));
    ArrayNode edgeArray = root.putArray("edges");
    edges.forEach(e -> edgeArray.add(JSONUtil.mapper().valueToTree(e)));
    return root;
  }
}
