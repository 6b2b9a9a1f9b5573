package dev.rune.scheduler.credentials;

import dev.rune.scheduler.exceptions.CredentialNotFoundException;
import dev.rune.scheduler.workflow.NodeCredentials;
import dev.rune.scheduler.workflow.WorkflowGraph;
import dev.rune.scheduler.workflow.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces credential references in a workflow graph with the decrypted credential. Runs right
 * before each dispatch so that workers receive current secrets and never touch the credential
 * store themselves.
 */
public class CredentialResolver {
  private static final Logger logger = LoggerFactory.getLogger(CredentialResolver.class);

  private final CredentialStore credentialStore;
  private final CredentialEncryption encryption;

  public CredentialResolver(CredentialStore credentialStore, CredentialEncryption encryption) {
    this.credentialStore = Objects.requireNonNull(credentialStore);
    this.encryption = Objects.requireNonNull(encryption);
  }

  /**
   * Returns a graph in which every node whose credentials carry an id but no values has them
   * replaced by {@code {id, name, type, values}}. Nodes without credentials, or with values
   * already present, are returned as they are. {@code graph} is not modified.
   *
   * @throws CredentialNotFoundException if a referenced credential does not exist
   * @throws dev.rune.scheduler.exceptions.CredentialDecryptionException if a payload cannot be
   *     decrypted
   */
  public WorkflowGraph resolve(WorkflowGraph graph) {
    List<WorkflowNode> resolved = new ArrayList<>(graph.nodes().size());
    int count = 0;
    for (WorkflowNode node : graph.nodes()) {
      Optional<NodeCredentials> credentials = node.credentials();
      if (credentials.isEmpty() || credentials.get().isResolved()) {
        resolved.add(node);
        continue;
      }
      String credentialId = credentials.get().id();
      CredentialRecord record =
          credentialStore
              .getCredential(credentialId)
              .orElseThrow(() -> new CredentialNotFoundException(credentialId));
      Map<String, Object> values = encryption.decrypt(record.encryptedPayload());
      resolved.add(
          node.withCredentials(
              new NodeCredentials(record.id(), record.name(), record.type(), values)));
      count++;
    }
    logger.debug("Resolved {} credential reference(s)", count);
    return graph.withNodes(resolved);
  }
}
