package io.b2mash.appintegrations.crypto;

/** Encryption could not complete (serialization or JCE failure). Not retried. */
public class SecretEncryptionException extends IllegalStateException {

  public SecretEncryptionException(String message, Throwable cause) {
    super(message, cause);
  }
}
