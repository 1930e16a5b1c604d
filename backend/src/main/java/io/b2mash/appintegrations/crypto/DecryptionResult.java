package io.b2mash.appintegrations.crypto;

import io.b2mash.appintegrations.secret.SecretBundle;

/**
 * Outcome of {@link SecretCipher#decrypt}. Exactly one of {@code bundle} and {@code failure} is
 * non-null.
 *
 * @param bundle decrypted secrets on success
 * @param failure failure kind otherwise
 * @param keyId key id named by the blob, when it could be read
 */
public record DecryptionResult(SecretBundle bundle, DecryptionFailure failure, String keyId) {

  public static DecryptionResult success(SecretBundle bundle, String keyId) {
    return new DecryptionResult(bundle, null, keyId);
  }

  public static DecryptionResult failure(DecryptionFailure failure, String keyId) {
    return new DecryptionResult(null, failure, keyId);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /** The decrypted bundle, or an empty bundle when decryption failed. */
  public SecretBundle bundleOrEmpty() {
    return isSuccess() ? bundle : SecretBundle.empty();
  }
}
