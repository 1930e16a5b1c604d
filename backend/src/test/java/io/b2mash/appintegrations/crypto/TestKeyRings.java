package io.b2mash.appintegrations.crypto;

import io.b2mash.appintegrations.crypto.EncryptionProperties.KeyProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;

/** Key rings built from freshly generated keys for unit tests. */
public final class TestKeyRings {

  private TestKeyRings() {}

  public static KeyRing withKeys(String activeKeyId, String... keyIds) {
    var keys =
        Arrays.stream(keyIds)
            .map(id -> new KeyProperties(id, EncryptionKeyGenerator.generateKey()))
            .toList();
    return KeyRing.from(new EncryptionProperties(activeKeyId, keys));
  }

  /** A ring that reuses {@code base}'s key material but uses a different active key. */
  public static KeyRing rotatedTo(KeyRing base, String newActiveKeyId) {
    var keys =
        new ArrayList<>(
            base.keyIds().stream()
                .map(
                    id ->
                        new KeyProperties(
                            id,
                            Base64.getEncoder()
                                .encodeToString(base.lookup(id).orElseThrow().key().getEncoded())))
                .toList());
    keys.add(new KeyProperties(newActiveKeyId, EncryptionKeyGenerator.generateKey()));
    return KeyRing.from(new EncryptionProperties(newActiveKeyId, keys));
  }
}
