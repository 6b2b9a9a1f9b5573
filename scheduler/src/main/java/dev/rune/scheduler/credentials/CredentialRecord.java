package dev.rune.scheduler.credentials;

import java.util.Objects;

/**
 * A stored credential as read from the credential store. {@code encryptedPayload} is never
 * decrypted outside {@link CredentialEncryption}.
 */
public record CredentialRecord(String id, String name, String type, String encryptedPayload) {

  public CredentialRecord {
    Objects.requireNonNull(id);
    Objects.requireNonNull(encryptedPayload);
  }

  @Override
  public String toString() {
    return "CredentialRecord[id=%s, name=%s, type=%s, encryptedPayload=***]"
        .formatted(id, name, type);
  }
}
