package io.b2mash.appintegrations.crypto;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import javax.crypto.spec.SecretKeySpec;

/**
 * Immutable set of encryption keys loaded once at startup. Exactly one entry is active and used for
 * new encryptions; every entry, active or retired, can be looked up by id for decryption.
 *
 * <p>Removing a key id from configuration strands every blob encrypted under it. Such blobs surface
 * as {@link DecryptionFailure#KEY_NOT_FOUND} on read.
 */
public final class KeyRing {

  static final int KEY_LENGTH_BYTES = 32;

  /** Key ids are embedded in serialized blobs before a ':' separator. */
  static final Pattern KEY_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

  private final Map<String, KeyRingEntry> entries;
  private final KeyRingEntry active;

  private KeyRing(Map<String, KeyRingEntry> entries, String activeKeyId) {
    this.entries = Map.copyOf(entries);
    this.active = entries.get(activeKeyId);
  }

  /**
   * Builds and validates a key ring from configuration.
   *
   * @throws KeyRingConfigurationException if the active id is missing, a key id is malformed or
   *     duplicated, or any key is not Base64 encoding exactly 32 bytes
   */
  public static KeyRing from(EncryptionProperties properties) {
    if (properties == null || properties.keys().isEmpty()) {
      throw new KeyRingConfigurationException(
          "No integration encryption keys configured. Set integration.encryption.keys[0].id and "
              + "integration.encryption.keys[0].key (generate a key with EncryptionKeyGenerator).");
    }
    String activeKeyId = properties.activeKeyId();
    if (activeKeyId == null || activeKeyId.isBlank()) {
      throw new KeyRingConfigurationException(
          "integration.encryption.active-key-id is not set. Cannot start without an active key.");
    }

    var entries = new LinkedHashMap<String, KeyRingEntry>();
    for (var keyProps : properties.keys()) {
      String keyId = keyProps.id();
      if (keyId == null || !KEY_ID_PATTERN.matcher(keyId).matches()) {
        throw new KeyRingConfigurationException(
            "Invalid encryption key id '" + keyId + "'. Key ids must match " + KEY_ID_PATTERN);
      }
      if (entries.containsKey(keyId)) {
        throw new KeyRingConfigurationException("Duplicate encryption key id '" + keyId + "'");
      }
      entries.put(keyId, new KeyRingEntry(keyId, decodeKey(keyId, keyProps.key())));
    }

    if (!entries.containsKey(activeKeyId)) {
      throw new KeyRingConfigurationException(
          "Active encryption key id '"
              + activeKeyId
              + "' is not present in the configured keys "
              + entries.keySet());
    }
    return new KeyRing(entries, activeKeyId);
  }

  private static SecretKeySpec decodeKey(String keyId, String encodedKey) {
    if (encodedKey == null || encodedKey.isBlank()) {
      throw new KeyRingConfigurationException("Encryption key '" + keyId + "' has no key material");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(encodedKey.trim());
    } catch (IllegalArgumentException e) {
      throw new KeyRingConfigurationException(
          "Encryption key '" + keyId + "' is not valid Base64", e);
    }
    if (keyBytes.length != KEY_LENGTH_BYTES) {
      throw new KeyRingConfigurationException(
          "Encryption key '"
              + keyId
              + "' must be a Base64-encoded 256-bit (32-byte) key. Got "
              + keyBytes.length
              + " bytes.");
    }
    return new SecretKeySpec(keyBytes, "AES");
  }

  /** The key used for all new encryptions. */
  public KeyRingEntry active() {
    return active;
  }

  public Optional<KeyRingEntry> lookup(String keyId) {
    if (keyId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(keyId));
  }

  public Set<String> keyIds() {
    return entries.keySet();
  }

  @Override
  public String toString() {
    return "KeyRing[active=" + active.keyId() + ", keys=" + entries.keySet() + "]";
  }
}
