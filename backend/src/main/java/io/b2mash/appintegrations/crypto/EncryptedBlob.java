package io.b2mash.appintegrations.crypto;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Persisted form of an encrypted secret bundle. Serialized as {@code <keyId>:<base64(iv ||
 * ciphertext)>} so every blob names the key that can open it.
 */
public record EncryptedBlob(String keyId, byte[] iv, byte[] ciphertext) {

  private static final char SEPARATOR = ':';

  public EncryptedBlob {
    Objects.requireNonNull(keyId, "keyId");
    iv = iv.clone();
    ciphertext = ciphertext.clone();
  }

  @Override
  public byte[] iv() {
    return iv.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  public String serialize() {
    byte[] payload = new byte[iv.length + ciphertext.length];
    System.arraycopy(iv, 0, payload, 0, iv.length);
    System.arraycopy(ciphertext, 0, payload, iv.length, ciphertext.length);
    return keyId + SEPARATOR + Base64.getEncoder().encodeToString(payload);
  }

  /**
   * Parses a serialized blob whose IV occupies the first {@code ivLength} bytes of the payload.
   *
   * @throws IllegalArgumentException if the value is not a well-formed blob
   */
  static EncryptedBlob parse(String serialized, int ivLength) {
    if (serialized == null) {
      throw new IllegalArgumentException("Encrypted blob is null");
    }
    int separator = serialized.indexOf(SEPARATOR);
    if (separator <= 0 || separator == serialized.length() - 1) {
      throw new IllegalArgumentException("Encrypted blob has no key id prefix");
    }
    String keyId = serialized.substring(0, separator);
    byte[] payload = Base64.getDecoder().decode(serialized.substring(separator + 1));
    if (payload.length <= ivLength) {
      throw new IllegalArgumentException("Encrypted blob payload is truncated");
    }
    return new EncryptedBlob(
        keyId,
        Arrays.copyOfRange(payload, 0, ivLength),
        Arrays.copyOfRange(payload, ivLength, payload.length));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof EncryptedBlob other
        && keyId.equals(other.keyId)
        && Arrays.equals(iv, other.iv)
        && Arrays.equals(ciphertext, other.ciphertext);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * keyId.hashCode() + Arrays.hashCode(iv)) + Arrays.hashCode(ciphertext);
  }

  @Override
  public String toString() {
    return "EncryptedBlob[keyId=" + keyId + ", length=" + ciphertext.length + "]";
  }
}
