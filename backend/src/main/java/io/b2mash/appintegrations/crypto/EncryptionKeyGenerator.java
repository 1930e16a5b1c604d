package io.b2mash.appintegrations.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Operator tool that prints a fresh Base64-encoded 256-bit key for {@code
 * integration.encryption.keys[n].key}. Keys are never generated by the running service.
 */
public final class EncryptionKeyGenerator {

  private EncryptionKeyGenerator() {}

  public static String generateKey() {
    byte[] key = new byte[KeyRing.KEY_LENGTH_BYTES];
    new SecureRandom().nextBytes(key);
    return Base64.getEncoder().encodeToString(key);
  }

  public static void main(String[] args) {
    System.out.println(generateKey());
  }
}
