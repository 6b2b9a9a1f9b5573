package dev.rune.scheduler.exceptions;

/**
 * {@code CredentialNotFoundException} is thrown during credential resolution when a node refers to
 * a credential id that the credential store does not contain, for example because the credential
 * was deleted after the workflow was saved.
 */
public class CredentialNotFoundException extends SchedulerException {
  private final String credentialId;

  public CredentialNotFoundException(String credentialId) {
    super(ErrorCode.CREDENTIAL_NOT_FOUND, String.format("Credential not found: %s", credentialId));
    this.credentialId = credentialId;
  }

  /** The credential id referenced by the workflow graph */
  public String credentialId() {
    return credentialId;
  }
}
