package dev.rune.scheduler.credentials;

import java.util.Optional;

public interface CredentialStore {

  Optional<CredentialRecord> getCredential(String credentialId);
}
