package io.b2mash.appintegrations.crypto;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Key material for integration secret encryption. Keys are Base64-encoded 256-bit AES keys; the
 * entry whose id equals {@code activeKeyId} encrypts new writes, all entries remain usable for
 * decryption.
 *
 * @param activeKeyId id of the key used for new encryptions
 * @param keys every key the process can decrypt with, active and retired
 */
@ConfigurationProperties(prefix = "integration.encryption")
public record EncryptionProperties(String activeKeyId, List<KeyProperties> keys) {

  public EncryptionProperties {
    keys = keys == null ? List.of() : List.copyOf(keys);
  }

  /**
   * @param id key id embedded in every blob encrypted with this key
   * @param key Base64-encoded key bytes
   */
  public record KeyProperties(String id, String key) {

    @Override
    public String toString() {
      return "KeyProperties[id=" + id + "]";
    }
  }
}
