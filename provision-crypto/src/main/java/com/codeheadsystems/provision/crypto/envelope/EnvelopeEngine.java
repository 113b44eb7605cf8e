package com.codeheadsystems.provision.crypto.envelope;

import static com.codeheadsystems.provision.crypto.common.ByteUtils.concat;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.fromBase64;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.toBase64;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.uint32;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.wipe;

import com.codeheadsystems.provision.crypto.common.AesGcm;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import com.codeheadsystems.provision.crypto.exception.UnknownMasterKeyException;
import com.codeheadsystems.provision.crypto.exception.UnsupportedVersionException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope encryption of credentials at rest.
 *
 * <p>Each {@link #encrypt(String)} generates a fresh 32-byte data key, encrypts the credential
 * under it with AES-256-GCM, then wraps the data key under the primary master key with an
 * independent nonce. The wrap binds {@code keyVersion} and {@code masterKeyId} as associated
 * data, so editing either field in storage fails decryption with an {@link IntegrityException}.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class EnvelopeEngine {

  public static final int DEFAULT_KEY_VERSION = 1;

  private static final Logger log = LoggerFactory.getLogger(EnvelopeEngine.class);
  private static final byte[] DATA_KEY_LABEL = "provision-data-key".getBytes(StandardCharsets.US_ASCII);

  private final MasterKeyRing keyRing;
  private final RandomProvider randomProvider;
  private final SecretStrengthPolicy strengthPolicy;
  private final int currentKeyVersion;
  private final int minimumSupportedVersion;

  public EnvelopeEngine(MasterKeyRing keyRing, RandomProvider randomProvider) {
    this(keyRing, randomProvider, new SecretStrengthPolicy(), DEFAULT_KEY_VERSION, DEFAULT_KEY_VERSION);
  }

  /**
   * Creates the engine.
   *
   * @param keyRing                 primary and retired master keys
   * @param randomProvider          source of data keys and nonces
   * @param strengthPolicy          check applied to new plaintext
   * @param currentKeyVersion       version assigned by {@link #encrypt(String)}
   * @param minimumSupportedVersion versions below this fail to decrypt
   */
  public EnvelopeEngine(MasterKeyRing keyRing,
                        RandomProvider randomProvider,
                        SecretStrengthPolicy strengthPolicy,
                        int currentKeyVersion,
                        int minimumSupportedVersion) {
    if (minimumSupportedVersion < 1 || currentKeyVersion < minimumSupportedVersion) {
      throw new IllegalArgumentException("Key versions must satisfy 1 <= minimum <= current");
    }
    this.keyRing = keyRing;
    this.randomProvider = randomProvider;
    this.strengthPolicy = strengthPolicy;
    this.currentKeyVersion = currentKeyVersion;
    this.minimumSupportedVersion = minimumSupportedVersion;
    log.info("EnvelopeEngine(primary={}, masterKeys={}, currentVersion={}, minimumVersion={})",
        keyRing.primary().keyId(), keyRing.size(), currentKeyVersion, minimumSupportedVersion);
  }

  /**
   * Encrypts a credential at the current key version.
   *
   * @param plaintext the credential
   * @return the stored form
   * @throws com.codeheadsystems.provision.crypto.exception.InvalidSecretException if the
   *                                                                              credential is weak
   */
  public StoredSecret encrypt(String plaintext) {
    strengthPolicy.check(plaintext);
    byte[] bytes = plaintext.getBytes(StandardCharsets.UTF_8);
    try {
      return seal(bytes, currentKeyVersion);
    } finally {
      wipe(bytes);
    }
  }

  /**
   * Decrypts a stored credential.
   *
   * @param stored the stored form
   * @return the credential
   * @throws UnsupportedVersionException if the version is not supported
   * @throws UnknownMasterKeyException   if the master key id is not in the ring
   * @throws IntegrityException          if any tag fails to verify
   */
  public String decrypt(StoredSecret stored) {
    byte[] bytes = open(stored);
    try {
      return new String(bytes, StandardCharsets.UTF_8);
    } finally {
      wipe(bytes);
    }
  }

  /**
   * Re-encrypts to the next version under the primary master key.
   *
   * @param stored the current stored form
   * @return the rotated stored form at {@code keyVersion + 1}
   */
  public StoredSecret rotate(StoredSecret stored) {
    return rotate(stored, stored.keyVersion() + 1);
  }

  /**
   * Re-encrypts to the target version under the primary master key. The input is not
   * modified; on failure nothing is produced.
   *
   * @param stored        the current stored form
   * @param targetVersion the new version, must exceed the current one
   * @return the rotated stored form
   * @throws UnsupportedVersionException if the target does not exceed the current version
   */
  public StoredSecret rotate(StoredSecret stored, int targetVersion) {
    if (targetVersion <= stored.keyVersion()) {
      throw new UnsupportedVersionException("Target version " + targetVersion
          + " must be greater than current version " + stored.keyVersion());
    }
    byte[] bytes = open(stored);
    try {
      return seal(bytes, targetVersion);
    } finally {
      wipe(bytes);
    }
  }

  public int currentKeyVersion() {
    return currentKeyVersion;
  }

  public int minimumSupportedVersion() {
    return minimumSupportedVersion;
  }

  public String primaryMasterKeyId() {
    return keyRing.primary().keyId();
  }

  private StoredSecret seal(byte[] plaintext, int keyVersion) {
    MasterKey masterKey = keyRing.primary();
    byte[] dataKey = randomProvider.randomBytes(AesGcm.KEY_LENGTH);
    try {
      byte[] nonce = randomProvider.randomBytes(AesGcm.NONCE_LENGTH);
      AesGcm.Sealed body = AesGcm.seal(dataKey, nonce, plaintext, null);
      byte[] dataKeyNonce = randomProvider.randomBytes(AesGcm.NONCE_LENGTH);
      AesGcm.Sealed wrapped = AesGcm.seal(masterKey.material(), dataKeyNonce, dataKey,
          wrapAad(keyVersion, masterKey.keyId()));
      return new StoredSecret(
          toBase64(body.ciphertext()),
          toBase64(nonce),
          toBase64(body.tag()),
          toBase64(wrapped.ciphertext()),
          toBase64(dataKeyNonce),
          toBase64(wrapped.tag()),
          keyVersion,
          masterKey.keyId());
    } finally {
      wipe(dataKey);
    }
  }

  private byte[] open(StoredSecret stored) {
    if (stored.keyVersion() < minimumSupportedVersion) {
      throw new UnsupportedVersionException("Unsupported key version: " + stored.keyVersion());
    }
    MasterKey masterKey = keyRing.find(stored.masterKeyId())
        .orElseThrow(() -> new UnknownMasterKeyException("Unknown master key: " + stored.masterKeyId()));
    byte[] dataKey = null;
    try {
      dataKey = AesGcm.open(masterKey.material(),
          decode(stored.dataKeyNonce()),
          decode(stored.wrappedDataKey()),
          decode(stored.dataKeyTag()),
          wrapAad(stored.keyVersion(), stored.masterKeyId()));
      if (dataKey.length != AesGcm.KEY_LENGTH) {
        throw new IntegrityException("Unwrapped data key has the wrong length");
      }
      return AesGcm.open(dataKey, decode(stored.nonce()), decode(stored.ciphertext()), decode(stored.tag()), null);
    } finally {
      wipe(dataKey);
    }
  }

  private static byte[] wrapAad(int keyVersion, String masterKeyId) {
    return concat(DATA_KEY_LABEL, uint32(keyVersion), masterKeyId.getBytes(StandardCharsets.UTF_8));
  }

  private static byte[] decode(String field) {
    try {
      return fromBase64(field);
    } catch (IllegalArgumentException e) {
      throw new IntegrityException("Stored secret field is not valid base64", e);
    }
  }
}
