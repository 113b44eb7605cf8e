package com.codeheadsystems.provision.crypto.common;

import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESLightEngine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-256-GCM with a detached tag, plus HKDF-SHA256 key derivation. A fresh cipher
 * instance is created per call so the class is safe to use from any thread.
 */
public class AesGcm {

  public static final int KEY_LENGTH = 32;
  public static final int NONCE_LENGTH = 12;
  public static final int TAG_LENGTH = 16;

  private static final byte[] EMPTY = new byte[0];

  private AesGcm() {
  }

  /**
   * Ciphertext and authentication tag, kept apart the way they are stored.
   *
   * @param ciphertext the ciphertext without tag
   * @param tag        the 16-byte GCM tag
   */
  public record Sealed(byte[] ciphertext, byte[] tag) {
  }

  /**
   * Encrypts the plaintext.
   *
   * @param key       32-byte AES key
   * @param nonce     12-byte nonce, never reused with the same key
   * @param plaintext the plaintext
   * @param aad       associated data bound to the tag, may be null
   * @return the ciphertext and tag
   */
  public static Sealed seal(byte[] key, byte[] nonce, byte[] plaintext, byte[] aad) {
    checkKeyAndNonce(key, nonce);
    GCMModeCipher gcm = GCMBlockCipher.newInstance(new AESLightEngine());
    gcm.init(true, new AEADParameters(new KeyParameter(key), TAG_LENGTH * 8, nonce, aad == null ? EMPTY : aad));
    byte[] output = new byte[gcm.getOutputSize(plaintext.length)];
    int len = gcm.processBytes(plaintext, 0, plaintext.length, output, 0);
    try {
      len += gcm.doFinal(output, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("GCM encryption failed", e);
    }
    byte[] ciphertext = Arrays.copyOf(output, len - TAG_LENGTH);
    byte[] tag = Arrays.copyOfRange(output, len - TAG_LENGTH, len);
    ByteUtils.wipe(output);
    return new Sealed(ciphertext, tag);
  }

  /**
   * Decrypts and verifies.
   *
   * @param key        32-byte AES key
   * @param nonce      12-byte nonce used at encryption
   * @param ciphertext the ciphertext without tag
   * @param tag        the 16-byte tag
   * @param aad        associated data, may be null
   * @return the plaintext
   * @throws IntegrityException if the tag does not verify
   */
  public static byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] aad) {
    checkKeyAndNonce(key, nonce);
    if (tag == null || tag.length != TAG_LENGTH) {
      throw new IntegrityException("Authentication tag has the wrong length");
    }
    GCMModeCipher gcm = GCMBlockCipher.newInstance(new AESLightEngine());
    gcm.init(false, new AEADParameters(new KeyParameter(key), TAG_LENGTH * 8, nonce, aad == null ? EMPTY : aad));
    byte[] input = ByteUtils.concat(ciphertext, tag);
    byte[] output = new byte[gcm.getOutputSize(input.length)];
    try {
      int len = gcm.processBytes(input, 0, input.length, output, 0);
      len += gcm.doFinal(output, len);
      return len == output.length ? output : Arrays.copyOf(output, len);
    } catch (InvalidCipherTextException e) {
      ByteUtils.wipe(output);
      throw new IntegrityException("Authentication tag mismatch", e);
    }
  }

  /**
   * HKDF-SHA256 (RFC 5869) producing a 32-byte key.
   *
   * @param secret input keying material
   * @param salt   optional salt, may be null
   * @param info   context string
   * @return the derived key
   */
  public static byte[] deriveKey(byte[] secret, byte[] salt, byte[] info) {
    HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
    hkdf.init(new HKDFParameters(secret, salt, info));
    byte[] out = new byte[KEY_LENGTH];
    hkdf.generateBytes(out, 0, out.length);
    return out;
  }

  private static void checkKeyAndNonce(byte[] key, byte[] nonce) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("AES-256 key must be " + KEY_LENGTH + " bytes");
    }
    if (nonce == null || nonce.length != NONCE_LENGTH) {
      throw new IntegrityException("Nonce must be " + NONCE_LENGTH + " bytes");
    }
  }
}
