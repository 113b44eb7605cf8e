package com.codeheadsystems.provision.crypto.exchange;

/**
 * A single-use ECDH key pair.
 *
 * @param publicKey  base64url (no padding) of the 65-byte uncompressed P-256 point
 * @param privateKey base64 of the 32-byte big-endian scalar
 * @param keyId      base64url (no padding) of 16 random bytes
 */
public record EphemeralKeyPair(String publicKey, String privateKey, String keyId) {

  @Override
  public String toString() {
    return "EphemeralKeyPair{publicKey=" + publicKey + ", keyId=" + keyId + "}";
  }
}
