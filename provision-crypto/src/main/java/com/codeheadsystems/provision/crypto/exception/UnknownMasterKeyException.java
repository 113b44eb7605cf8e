package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when a stored secret references a master key that is not in the key ring.
 */
public class UnknownMasterKeyException extends ProvisionCryptoException {

  public UnknownMasterKeyException(String message) {
    super(message);
  }

  public UnknownMasterKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
