package com.codeheadsystems.provision.crypto.exchange;

import com.codeheadsystems.provision.crypto.common.ByteUtils;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.exception.InvalidKeyFormatException;
import java.math.BigInteger;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;

/**
 * Ephemeral ECDH over P-256. Every key pair is generated independently; nothing is cached.
 */
public class KeyExchange {

  public static final int KEY_ID_LENGTH = 16;

  private final Curve curve;
  private final RandomProvider randomProvider;

  public KeyExchange(RandomProvider randomProvider) {
    this(Curve.P256_CURVE, randomProvider);
  }

  public KeyExchange(Curve curve, RandomProvider randomProvider) {
    this.curve = curve;
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a fresh key pair and key id.
   *
   * @return the key pair
   */
  public EphemeralKeyPair generateEphemeralKeyPair() {
    BigInteger d = BigIntegers.createRandomInRange(BigInteger.ONE, curve.n().subtract(BigInteger.ONE),
        randomProvider.random());
    ECPoint q = curve.g().multiply(d).normalize();
    byte[] scalar = BigIntegers.asUnsignedByteArray(curve.fieldLength(), d);
    try {
      return new EphemeralKeyPair(
          ByteUtils.toBase64Url(q.getEncoded(false)),
          ByteUtils.toBase64(scalar),
          ByteUtils.toBase64Url(randomProvider.randomBytes(KEY_ID_LENGTH)));
    } finally {
      ByteUtils.wipe(scalar);
    }
  }

  /**
   * Format check only: base64url of an uncompressed point with the 0x04 prefix. Says
   * nothing about who holds the matching private key.
   *
   * @param publicKey the encoded public key
   * @return true if the encoding and length are right
   */
  public boolean validatePublicKey(String publicKey) {
    try {
      byte[] bytes = ByteUtils.fromBase64Url(publicKey);
      return bytes.length == curve.uncompressedPointLength() && bytes[0] == 0x04;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Format check only: base64url of 16 bytes.
   *
   * @param keyId the encoded key id
   * @return true if the encoding and length are right
   */
  public boolean validateKeyId(String keyId) {
    try {
      return ByteUtils.fromBase64Url(keyId).length == KEY_ID_LENGTH;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Computes the x-coordinate of {@code privateKey * publicKey}. Both parties obtain the
   * same value from their own private key and the other's public key.
   *
   * @param privateKey base64 scalar
   * @param publicKey  base64url uncompressed point
   * @return the 32-byte shared secret; callers wipe it after use
   * @throws InvalidKeyFormatException if either key is malformed or the point is invalid
   */
  public byte[] deriveSharedSecret(String privateKey, String publicKey) {
    ECPoint q = decodePublicKey(publicKey);
    BigInteger d = decodePrivateKey(privateKey);
    ECPoint shared = q.multiply(d).normalize();
    if (shared.isInfinity()) {
      throw new InvalidKeyFormatException("Key agreement produced the point at infinity");
    }
    return BigIntegers.asUnsignedByteArray(curve.fieldLength(), shared.getAffineXCoord().toBigInteger());
  }

  private ECPoint decodePublicKey(String publicKey) {
    if (!validatePublicKey(publicKey)) {
      throw new InvalidKeyFormatException("Public key must be a base64url uncompressed P-256 point");
    }
    ECPoint point;
    try {
      point = curve.curve().decodePoint(ByteUtils.fromBase64Url(publicKey));
    } catch (IllegalArgumentException e) {
      throw new InvalidKeyFormatException("Public key is not a point on the curve", e);
    }
    if (point.isInfinity() || !point.isValid()) {
      throw new InvalidKeyFormatException("Public key is not a valid point on the curve");
    }
    return point;
  }

  private BigInteger decodePrivateKey(String privateKey) {
    byte[] bytes;
    try {
      bytes = ByteUtils.fromBase64(privateKey);
    } catch (IllegalArgumentException e) {
      throw new InvalidKeyFormatException("Private key is not valid base64", e);
    }
    try {
      if (bytes.length != curve.fieldLength()) {
        throw new InvalidKeyFormatException("Private key must be " + curve.fieldLength() + " bytes");
      }
      BigInteger d = new BigInteger(1, bytes);
      if (d.signum() == 0 || d.compareTo(curve.n()) >= 0) {
        throw new InvalidKeyFormatException("Private key is out of range");
      }
      return d;
    } finally {
      ByteUtils.wipe(bytes);
    }
  }
}
