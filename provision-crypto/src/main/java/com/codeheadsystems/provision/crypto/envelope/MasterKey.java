package com.codeheadsystems.provision.crypto.envelope;

import com.codeheadsystems.provision.crypto.common.AesGcm;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A root AES-256 key and its identifier. The key material is only reachable from this
 * package; {@link #toString()} never prints it.
 */
public final class MasterKey {

  private final String keyId;
  private final byte[] material;

  public MasterKey(String keyId, byte[] material) {
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("Master key id must not be blank");
    }
    if (material == null || material.length != AesGcm.KEY_LENGTH) {
      throw new IllegalArgumentException("Master key must be " + AesGcm.KEY_LENGTH + " bytes");
    }
    this.keyId = keyId;
    this.material = material.clone();
  }

  /**
   * Parses a 64-character hex string.
   *
   * @param keyId the key id
   * @param hex   the key material in hex
   * @return the master key
   */
  public static MasterKey fromHex(String keyId, String hex) {
    return new MasterKey(keyId, HexFormat.of().parseHex(Objects.requireNonNull(hex, "hex")));
  }

  /**
   * Generates a random master key. Only suitable for development and tests since records
   * written under it cannot be decrypted after a restart.
   *
   * @param keyId          the key id
   * @param randomProvider the source of randomness
   * @return the master key
   */
  public static MasterKey random(String keyId, RandomProvider randomProvider) {
    return new MasterKey(keyId, randomProvider.randomBytes(AesGcm.KEY_LENGTH));
  }

  public String keyId() {
    return keyId;
  }

  byte[] material() {
    return material;
  }

  @Override
  public String toString() {
    return "MasterKey{keyId=" + keyId + "}";
  }
}
