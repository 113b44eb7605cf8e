package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when a credential is empty, too short or a known placeholder value.
 */
public class InvalidSecretException extends ProvisionCryptoException {

  public InvalidSecretException(String message) {
    super(message);
  }

  public InvalidSecretException(String message, Throwable cause) {
    super(message, cause);
  }
}
