package io.b2mash.appintegrations.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.appintegrations.secret.SecretBundle;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import org.springframework.stereotype.Component;

/**
 * AES-256-GCM encryption of {@link SecretBundle}s. Holds no key material of its own: the active key
 * is passed to {@link #encrypt} and the ring to {@link #decrypt}, so the cipher is safe to share
 * across threads. The blob's key id is bound in as additional authenticated data.
 */
@Component
public class SecretCipher {

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128; // bits
  static final int IV_LENGTH = 12; // bytes (96 bits)

  private final ObjectMapper objectMapper;
  private final SecureRandom secureRandom = new SecureRandom();

  public SecretCipher(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public EncryptedBlob encrypt(SecretBundle bundle, KeyRingEntry activeKey) {
    byte[] plaintext;
    try {
      plaintext = objectMapper.writeValueAsBytes(bundle);
    } catch (JsonProcessingException e) {
      throw new SecretEncryptionException("Failed to serialize secret bundle", e);
    }

    byte[] iv = generateIv();
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, activeKey.key(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(aad(activeKey.keyId()));
      return new EncryptedBlob(activeKey.keyId(), iv, cipher.doFinal(plaintext));
    } catch (GeneralSecurityException e) {
      throw new SecretEncryptionException("Encryption failed", e);
    }
  }

  public DecryptionResult decrypt(String serializedBlob, KeyRing keyRing) {
    EncryptedBlob blob;
    try {
      blob = EncryptedBlob.parse(serializedBlob, IV_LENGTH);
    } catch (IllegalArgumentException e) {
      return DecryptionResult.failure(DecryptionFailure.INVALID_CIPHERTEXT, null);
    }
    return decrypt(blob, keyRing);
  }

  public DecryptionResult decrypt(EncryptedBlob blob, KeyRing keyRing) {
    var entry = keyRing.lookup(blob.keyId());
    if (entry.isEmpty()) {
      return DecryptionResult.failure(DecryptionFailure.KEY_NOT_FOUND, blob.keyId());
    }

    byte[] iv = blob.iv();
    if (iv.length != IV_LENGTH) {
      return DecryptionResult.failure(DecryptionFailure.INVALID_CIPHERTEXT, blob.keyId());
    }

    byte[] plaintext;
    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(
          Cipher.DECRYPT_MODE, entry.get().key(), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(aad(blob.keyId()));
      plaintext = cipher.doFinal(blob.ciphertext());
    } catch (GeneralSecurityException e) {
      // AEADBadTagException for tampered data or the wrong key
      return DecryptionResult.failure(DecryptionFailure.INVALID_CIPHERTEXT, blob.keyId());
    }

    try {
      var bundle = objectMapper.readValue(plaintext, SecretBundle.class);
      return DecryptionResult.success(
          bundle != null ? bundle : SecretBundle.empty(), blob.keyId());
    } catch (IOException e) {
      return DecryptionResult.failure(DecryptionFailure.INVALID_CIPHERTEXT, blob.keyId());
    }
  }

  private byte[] generateIv() {
    byte[] iv = new byte[IV_LENGTH];
    secureRandom.nextBytes(iv);
    return iv;
  }

  private static byte[] aad(String keyId) {
    return keyId.getBytes(StandardCharsets.UTF_8);
  }
}
