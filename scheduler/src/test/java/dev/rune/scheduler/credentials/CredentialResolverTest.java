package dev.rune.scheduler.credentials;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.rune.scheduler.exceptions.CredentialDecryptionException;
import dev.rune.scheduler.exceptions.CredentialNotFoundException;
import dev.rune.scheduler.utils.InMemoryCredentialStore;
import dev.rune.scheduler.utils.TestGraphs;
import dev.rune.scheduler.workflow.NodeCredentials;
import dev.rune.scheduler.workflow.WorkflowGraph;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CredentialResolverTest {

  private CredentialEncryption encryption;
  private InMemoryCredentialStore store;
  private CredentialResolver resolver;

  @BeforeEach
  void setup() {
    encryption = new CredentialEncryption(CredentialEncryption.generateKey());
    store = new InMemoryCredentialStore();
    resolver = new CredentialResolver(store, encryption);
  }

  @Test
  public void replacesReferenceWithDecryptedValues() {
    store.put(
        new CredentialRecord("7", "Example API", "bearer", encryption.encrypt(Map.of("token", "t0k"))));
    var graph = WorkflowGraph.fromJson(TestGraphs.triggeredJson("7"));

    var resolved = resolver.resolve(graph);

    var creds = resolved.nodes().get(1).credentials().orElseThrow();
    assertEquals(new NodeCredentials("7", "Example API", "bearer", Map.of("token", "t0k")), creds);
    assertTrue(creds.isResolved());

    var json = resolved.nodes().get(1).toJson();
    assertEquals("t0k", json.at("/credentials/values/token").asText());
    assertEquals("https://example.com", json.at("/parameters/url").asText());
    assertEquals("halt", json.at("/error/type").asText());

    // input graph untouched
    assertFalse(graph.nodes().get(1).credentials().orElseThrow().isResolved());
    assertEquals(graph.edges(), resolved.edges());
  }

  @Test
  public void graphWithoutCredentialsIsUnchanged() {
    var graph = TestGraphs.triggered();
    var resolved = resolver.resolve(graph);
    assertEquals(graph, resolved);
    assertSame(graph.nodes().get(0), resolved.nodes().get(0));
  }

  @Test
  public void alreadyResolvedCredentialsAreKept() {
    var graph = WorkflowGraph.fromJson(TestGraphs.triggeredJson("7"));
    var node = graph.nodes().get(1).withCredentials(
        new NodeCredentials("7", "api", "bearer", Map.of("token", "inline")));
    var prepared = graph.withNodes(List.of(graph.nodes().get(0), node));

    // nothing stored under id 7, so a lookup would fail
    var resolved = resolver.resolve(prepared);
    assertEquals(
        Map.of("token", "inline"), resolved.nodes().get(1).credentials().orElseThrow().values());
  }

  @Test
  public void missingCredentialFails() {
    var graph = WorkflowGraph.fromJson(TestGraphs.triggeredJson("404"));
    var e = assertThrows(CredentialNotFoundException.class, () -> resolver.resolve(graph));
    assertEquals("404", e.credentialId());
    assertEquals(404, e.errorCode().getHttpStatus());
  }

  @Test
  public void undecryptableCredentialFails() {
    var otherKey = new CredentialEncryption(CredentialEncryption.generateKey());
    store.put(new CredentialRecord("7", "api", "bearer", otherKey.encrypt(Map.of("token", "x"))));
    var graph = WorkflowGraph.fromJson(TestGraphs.triggeredJson("7"));

    assertThrows(CredentialDecryptionException.class, () -> resolver.resolve(graph));
  }
}
