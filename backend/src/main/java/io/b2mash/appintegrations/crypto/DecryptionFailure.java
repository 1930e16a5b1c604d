package io.b2mash.appintegrations.crypto;

/** Why a blob could not be opened. Both kinds are per-record and recoverable. */
public enum DecryptionFailure {
  /** The blob names a key id that is not in the ring, e.g. after a key was removed too early. */
  KEY_NOT_FOUND,
  /** Malformed blob or authentication tag mismatch. May indicate tampering. */
  INVALID_CIPHERTEXT
}
