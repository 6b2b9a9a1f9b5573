package dev.rune.scheduler.credentials;

import dev.rune.scheduler.exceptions.CredentialDecryptionException;
import dev.rune.scheduler.json.JSONUtil;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated encryption of credential payloads, compatible with the Fernet token format.
 *
 * <p>The key is 32 url-safe base64 encoded bytes: the first half signs, the second half is the
 * AES-128 key. A token is {@code 0x80 | timestamp (8 bytes) | IV (16 bytes) | AES-CBC ciphertext |
 * HMAC-SHA256 over everything before it}, url-safe base64 encoded. The value stored in the
 * credential table is the standard base64 encoding of that token string.
 */
public class CredentialEncryption {

  private static final byte VERSION = (byte) 0x80;
  private static final int KEY_BYTES = 32;
  private static final int IV_BYTES = 16;
  private static final int HMAC_BYTES = 32;
  private static final int HEADER_BYTES = 1 + 8 + IV_BYTES;

  private static final SecureRandom secureRandom = new SecureRandom();

  private final SecretKeySpec signingKey;
  private final SecretKeySpec encryptionKey;
  private final Clock clock;

  public CredentialEncryption(String key) {
    this(key, Clock.systemUTC());
  }

  public CredentialEncryption(String key, Clock clock) {
    Objects.requireNonNull(key, "encryption key must not be null");
    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(key.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("encryption key must be url-safe base64", e);
    }
    if (raw.length != KEY_BYTES) {
      throw new IllegalArgumentException(
          "encryption key must decode to %d bytes, got %d".formatted(KEY_BYTES, raw.length));
    }
    this.signingKey = new SecretKeySpec(Arrays.copyOfRange(raw, 0, 16), "HmacSHA256");
    this.encryptionKey = new SecretKeySpec(Arrays.copyOfRange(raw, 16, 32), "AES");
    this.clock = Objects.requireNonNull(clock);
  }

  /** Creates a new random key in the format the constructor accepts. */
  public static String generateKey() {
    byte[] raw = new byte[KEY_BYTES];
    secureRandom.nextBytes(raw);
    return Base64.getUrlEncoder().encodeToString(raw);
  }

  public String encrypt(Map<String, Object> values) {
    String token = encryptToken(JSONUtil.toJsonBytes(values));
    return Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.US_ASCII));
  }

  public Map<String, Object> decrypt(String encryptedPayload) {
    if (encryptedPayload == null || encryptedPayload.isBlank()) {
      throw new CredentialDecryptionException("Credential payload is empty");
    }
    String token;
    try {
      token =
          new String(Base64.getDecoder().decode(encryptedPayload.trim()), StandardCharsets.US_ASCII);
    } catch (IllegalArgumentException e) {
      throw new CredentialDecryptionException("Credential payload is not valid base64", e);
    }
    byte[] plaintext = decryptToken(token);
    Map<String, Object> values;
    try {
      values = JSONUtil.toMap(new String(plaintext, StandardCharsets.UTF_8));
    } catch (JSONUtil.JsonRuntimeException e) {
      throw new CredentialDecryptionException("Decrypted credential is not a JSON object", e);
    }
    if (values == null) {
      throw new CredentialDecryptionException("Decrypted credential is not a JSON object");
    }
    return values;
  }

  String encryptToken(byte[] plaintext) {
    byte[] iv = new byte[IV_BYTES];
    secureRandom.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      byte[] ciphertext = cipher.doFinal(plaintext);

      ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + ciphertext.length + HMAC_BYTES);
      buffer.put(VERSION);
      buffer.putLong(clock.instant().getEpochSecond());
      buffer.put(iv);
      buffer.put(ciphertext);
      byte[] signed = Arrays.copyOf(buffer.array(), buffer.position());
      buffer.put(hmac(signed));
      return Base64.getUrlEncoder().encodeToString(buffer.array());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to encrypt credential", e);
    }
  }

  byte[] decryptToken(String token) {
    byte[] data;
    try {
      data = Base64.getUrlDecoder().decode(token.trim());
    } catch (IllegalArgumentException e) {
      throw new CredentialDecryptionException("Credential token is not valid base64", e);
    }
    if (data.length < HEADER_BYTES + 16 + HMAC_BYTES || data[0] != VERSION) {
      throw new CredentialDecryptionException("Credential token is malformed");
    }
    int signedLength = data.length - HMAC_BYTES;
    byte[] expected;
    try {
      expected = hmac(Arrays.copyOf(data, signedLength));
    } catch (GeneralSecurityException e) {
      throw new CredentialDecryptionException("Failed to verify credential token", e);
    }
    byte[] actual = Arrays.copyOfRange(data, signedLength, data.length);
    if (!MessageDigest.isEqual(expected, actual)) {
      throw new CredentialDecryptionException("Credential token signature does not match");
    }
    byte[] iv = Arrays.copyOfRange(data, 9, HEADER_BYTES);
    byte[] ciphertext = Arrays.copyOfRange(data, HEADER_BYTES, signedLength);
    try {
      Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
      return cipher.doFinal(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new CredentialDecryptionException("Failed to decrypt credential token", e);
    }
  }

  private byte[] hmac(byte[] data) throws GeneralSecurityException {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(signingKey);
    return mac.doFinal(data);
  }
}
