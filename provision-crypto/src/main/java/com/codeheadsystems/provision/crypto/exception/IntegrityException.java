package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when an authentication tag does not verify. The data was tampered with, corrupted,
 * or sealed under a different key.
 */
public class IntegrityException extends ProvisionCryptoException {

  public IntegrityException(String message) {
    super(message);
  }

  public IntegrityException(String message, Throwable cause) {
    super(message, cause);
  }
}
