package dev.rune.scheduler.messaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.rune.scheduler.exceptions.InvalidWorkflowGraphException;
import dev.rune.scheduler.utils.RecordingPublisher;
import dev.rune.scheduler.utils.TestGraphs;
import dev.rune.scheduler.workflow.WorkflowGraph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class WorkflowRunPublisherTest {

  private RecordingPublisher sink;
  private WorkflowRunPublisher publisher;

  @BeforeEach
  void setup() {
    sink = new RecordingPublisher();
    publisher = new WorkflowRunPublisher(sink, "workflow_queue");
  }

  @Test
  public void publishesRunRequest() {
    var graph = TestGraphs.triggered();
    assertTrue(publisher.publishWorkflowRun(42, "scheduled_abc", graph));

    var published = sink.published();
    assertEquals(1, published.size());
    assertEquals("workflow_queue", published.get(0).queueName());

    var body = published.get(0).body();
    assertEquals(
        List.of(
            "workflow_id",
            "execution_id",
            "current_node",
            "workflow_definition",
            "accumulated_context"),
        iterableToList(body.fieldNames()));
    assertEquals("42", body.get("workflow_id").asText());
    assertTrue(body.get("workflow_id").isTextual());
    assertEquals("scheduled_abc", body.get("execution_id").asText());
    assertEquals("2", body.get("current_node").asText());
    assertEquals(graph.toJson(), body.get("workflow_definition"));
    assertTrue(body.get("accumulated_context").isObject());
    assertEquals(0, body.get("accumulated_context").size());
  }

  @Test
  public void refusedPublishReturnsFalse() {
    sink.accept = false;
    assertFalse(publisher.publishWorkflowRun(1, "scheduled_x", TestGraphs.triggered()));
  }

  @Test
  public void entryIsFirstEdgeInStoredOrder() {
    var graph =
        WorkflowGraph.fromJson(
            """
            {"nodes": [
               {"id": "t", "trigger": true},
               {"id": "b"}, {"id": "a"}],
             "edges": [
               {"id": "e2", "src": "t", "dst": "b"},
               {"id": "e1", "src": "t", "dst": "a"}]}
            """);
    assertEquals("b", WorkflowRunPublisher.entryNode(graph));
  }

  @Test
  public void invalidGraphsAreRejected() {
    var empty = WorkflowGraph.fromJson("{\"nodes\": [], \"edges\": []}");
    var e = assertThrows(InvalidWorkflowGraphException.class, () -> WorkflowRunPublisher.entryNode(empty));
    assertEquals("Workflow has no nodes", e.getMessage());

    assertThrows(
        InvalidWorkflowGraphException.class,
        () -> WorkflowRunPublisher.entryNode(TestGraphs.withoutTrigger()));
    assertThrows(
        InvalidWorkflowGraphException.class,
        () -> WorkflowRunPublisher.entryNode(TestGraphs.twoTriggers()));

    var dangling = WorkflowGraph.fromJson("{\"nodes\": [{\"id\": \"t\", \"trigger\": true}]}");
    var e2 =
        assertThrows(
            InvalidWorkflowGraphException.class, () -> publisher.publishWorkflowRun(1, "x", dangling));
    assertEquals("Trigger node t has no outgoing edge", e2.getMessage());
    assertTrue(sink.published().isEmpty());
  }

  private static List<String> iterableToList(Iterator<String> it) {
    var list = new ArrayList<String>();
    it.forEachRemaining(list::add);
    return list;
  }
}
