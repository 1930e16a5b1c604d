package io.b2mash.appintegrations.crypto;

import javax.crypto.SecretKey;

/** A named AES-256 key. {@link #toString()} deliberately omits the key bytes. */
public record KeyRingEntry(String keyId, SecretKey key) {

  @Override
  public String toString() {
    return "KeyRingEntry[keyId=" + keyId + "]";
  }
}
