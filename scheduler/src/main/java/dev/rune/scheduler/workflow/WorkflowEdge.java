package dev.rune.scheduler.workflow;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Directed connection from node {@code src} to node {@code dst}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowEdge(String id, String src, String dst) {

  public WorkflowEdge {
    Objects.requireNonNull(src, "edge src must not be null");
    Objects.requireNonNull(dst, "edge dst must not be null");
  }
}
