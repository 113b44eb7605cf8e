package com.codeheadsystems.provision.crypto.exception;

/**
 * Thrown when a public key, private key or key identifier does not decode to the expected
 * encoding and length, or the point is not on the curve.
 */
public class InvalidKeyFormatException extends ProvisionCryptoException {

  public InvalidKeyFormatException(String message) {
    super(message);
  }

  public InvalidKeyFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
