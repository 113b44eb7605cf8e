package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when a stored key version is below the supported minimum or a rotation target does
 * not move the version forward.
 */
public class UnsupportedVersionException extends ProvisionCryptoException {

  public UnsupportedVersionException(String message) {
    super(message);
  }

  public UnsupportedVersionException(String message, Throwable cause) {
    super(message, cause);
  }
}
