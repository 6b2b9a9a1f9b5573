package dev.rune.scheduler.utils;

import dev.rune.scheduler.credentials.CredentialRecord;
import dev.rune.scheduler.credentials.CredentialStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCredentialStore implements CredentialStore {

  private final Map<String, CredentialRecord> credentials = new ConcurrentHashMap<>();

  public void put(CredentialRecord record) {
    credentials.put(record.id(), record);
  }

  @Override
  public Optional<CredentialRecord> getCredential(String credentialId) {
    return Optional.ofNullable(credentials.get(credentialId));
  }
}
