package io.b2mash.appintegrations.crypto;

/** Thrown at startup when the configured key ring cannot be used. The process must not serve. */
public class KeyRingConfigurationException extends IllegalStateException {

  public KeyRingConfigurationException(String message) {
    super(message);
  }

  public KeyRingConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
