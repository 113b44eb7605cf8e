package com.codeheadsystems.provision.crypto.exception;

/**
 * Base type for every failure raised by the crypto primitives. Subclasses identify the
 * failure class so callers can map it without inspecting messages.
 */
public abstract class ProvisionCryptoException extends RuntimeException {

  protected ProvisionCryptoException(String message) {
    super(message);
  }

  protected ProvisionCryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
