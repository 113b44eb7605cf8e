package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when a sealed payload authenticates but its embedded timestamp is outside the
 * accepted freshness window.
 */
public class FreshnessException extends ProvisionCryptoException {

  public FreshnessException(String message) {
    super(message);
  }

  public FreshnessException(String message, Throwable cause) {
    super(message, cause);
  }
}
