package dev.rune.scheduler.workflow;

import dev.rune.scheduler.json.JSONUtil;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

/**
 * One node of a workflow graph. The scheduler reads only the identity, the trigger flag and the
 * credential reference; every other field is carried through untouched so that the dispatched
 * definition matches what was stored.
 */
public final class WorkflowNode {

  /** Node type of the entry points a schedule may be attached to. */
  public static final String TRIGGER_TYPE = "trigger";

  private final ObjectNode document;

  private WorkflowNode(ObjectNode document) {
    this.document = document;
  }

  /** Wraps a copy of {@code json}, which must be an object with a textual {@code id}. */
  public static WorkflowNode fromJson(JsonNode json) {
    Objects.requireNonNull(json, "node must not be null");
    if (!json.isObject()) {
      throw new IllegalArgumentException("workflow node must be a JSON object");
    }
    JsonNode id = json.get("id");
    if (id == null || !id.isTextual()) {
      throw new IllegalArgumentException("workflow node is missing a string id");
    }
    return new WorkflowNode(((ObjectNode) json).deepCopy());
  }

  public String id() {
    return document.get("id").asText();
  }

  public @Nullable String name() {
    return text("name");
  }

  public @Nullable String type() {
    return text("type");
  }

  /** True only for a JSON boolean {@code true}; strings and numbers do not count. */
  public boolean isTrigger() {
    JsonNode trigger = document.get("trigger");
    return trigger != null && trigger.isBoolean() && trigger.booleanValue();
  }

  /** A trigger-flagged node of type {@value #TRIGGER_TYPE}. */
  public boolean isScheduleTrigger() {
    return isTrigger() && TRIGGER_TYPE.equals(type());
  }

  /** The credential object, if the node has one with an id. */
  public Optional<NodeCredentials> credentials() {
    JsonNode creds = document.get("credentials");
    if (creds == null || !creds.isObject()) {
      return Optional.empty();
    }
    JsonNode id = creds.get("id");
    if (id == null || id.isNull()) {
      return Optional.empty();
    }
    return Optional.of(JSONUtil.mapper().convertValue(creds, NodeCredentials.class));
  }

  /** Returns a new node whose {@code credentials} object is replaced by {@code credentials}. */
  public WorkflowNode withCredentials(NodeCredentials credentials) {
    ObjectNode copy = document.deepCopy();
    copy.set("credentials", JSONUtil.mapper().valueToTree(credentials));
    return new WorkflowNode(copy);
  }

  /** A copy of the underlying document. */
  public ObjectNode toJson() {
    return document.deepCopy();
  }

  private @Nullable String text(String field) {
    JsonNode value = document.get(field);
    return (value == null || value.isNull()) ? null : value.asText();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof WorkflowNode other && document.equals(other.document);
  }

  @Override
  public int hashCode() {
    return document.hashCode();
  }

  @Override
  public String toString() {
    return "WorkflowNode[id=%s, type=%s, trigger=%s]".formatted(id(), type(), isTrigger());
  }
}
