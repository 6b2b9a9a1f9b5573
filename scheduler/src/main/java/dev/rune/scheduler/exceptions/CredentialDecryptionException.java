package dev.rune.scheduler.exceptions;

/**
 * {@code CredentialDecryptionException} is thrown when a stored credential payload cannot be
 * decrypted: the payload was tampered with, was encrypted under a different key, or is not a
 * valid token at all. It is never thrown for a payload that decrypts successfully.
 */
public class CredentialDecryptionException extends SchedulerException {

  public CredentialDecryptionException(String message) {
    super(ErrorCode.CREDENTIAL_DECRYPTION, message);
  }

  public CredentialDecryptionException(String message, Throwable cause) {
    super(ErrorCode.CREDENTIAL_DECRYPTION, message, cause);
  }
}
