package com.codeheadsystems.provision.crypto.exchange;

import static com.codeheadsystems.provision.crypto.common.ByteUtils.uint32;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.uint64;
import static com.codeheadsystems.provision.crypto.common.ByteUtils.wipe;

import com.codeheadsystems.provision.crypto.common.AesGcm;
import com.codeheadsystems.provision.crypto.common.ByteUtils;
import com.codeheadsystems.provision.crypto.common.RandomProvider;
import com.codeheadsystems.provision.crypto.exception.FreshnessException;
import com.codeheadsystems.provision.crypto.exception.IntegrityException;
import com.codeheadsystems.provision.crypto.exception.InvalidKeyFormatException;
import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Seals a bundle of named secrets for exactly one recipient.
 *
 * <p>The AES-256-GCM key is HKDF-SHA256 over the ECDH shared secret of the sender's
 * ephemeral private key and the recipient's ephemeral public key. The recipient key id is
 * bound as associated data. The plaintext is a deterministic binary encoding:
 * <pre>
 *   uint64 createdAtMillis
 *   uint32 count
 *   count x (uint32 nameLength, name, uint32 valueLength, value)   sorted by name
 * </pre>
 *
 * <p>On unpack the tag is verified first, then the embedded timestamp. A payload that fails
 * authentication always raises {@link IntegrityException}; one that authenticates but is
 * outside the window raises {@link FreshnessException}.
 */
public class SealedDelivery {

  public static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofMinutes(5);

  private static final byte[] HKDF_INFO =
      "sidecar-provision/sealed-delivery/v1".getBytes(StandardCharsets.US_ASCII);

  private final KeyExchange keyExchange;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final Duration freshnessWindow;

  public SealedDelivery(KeyExchange keyExchange, RandomProvider randomProvider) {
    this(keyExchange, randomProvider, Clock.systemUTC(), DEFAULT_FRESHNESS_WINDOW);
  }

  public SealedDelivery(KeyExchange keyExchange,
                        RandomProvider randomProvider,
                        Clock clock,
                        Duration freshnessWindow) {
    if (freshnessWindow.isNegative() || freshnessWindow.isZero()) {
      throw new IllegalArgumentException("Freshness window must be positive");
    }
    this.keyExchange = keyExchange;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.freshnessWindow = freshnessWindow;
  }

  /**
   * Seals the secrets for the recipient.
   *
   * @param secrets            name to secret value
   * @param recipientPublicKey the recipient's ephemeral public key
   * @param senderPrivateKey   the sender's ephemeral private key
   * @param recipientKeyId     the recipient's key id
   * @return the sealed payload
   * @throws InvalidKeyFormatException if any key or the key id is malformed
   */
  public SealedPayload packageSecrets(Map<String, String> secrets,
                                      String recipientPublicKey,
                                      String senderPrivateKey,
                                      String recipientKeyId) {
    if (!keyExchange.validateKeyId(recipientKeyId)) {
      throw new InvalidKeyFormatException("Recipient key id must be base64url of "
          + KeyExchange.KEY_ID_LENGTH + " bytes");
    }
    byte[] key = deriveKey(senderPrivateKey, recipientPublicKey);
    byte[] plaintext = encode(secrets, clock.millis());
    try {
      byte[] nonce = randomProvider.randomBytes(AesGcm.NONCE_LENGTH);
      AesGcm.Sealed sealed = AesGcm.seal(key, nonce, plaintext, aad(recipientKeyId));
      return new SealedPayload(
          ByteUtils.toBase64Url(sealed.ciphertext()),
          ByteUtils.toBase64Url(nonce),
          ByteUtils.toBase64Url(sealed.tag()),
          recipientKeyId);
    } finally {
      wipe(key, plaintext);
    }
  }

  /**
   * Opens a payload sealed for this recipient.
   *
   * @param payload             the sealed payload
   * @param recipientPrivateKey the recipient's ephemeral private key
   * @param senderPublicKey     the sender's ephemeral public key
   * @return the secrets, sorted by name
   * @throws IntegrityException        if any byte of the payload was altered
   * @throws FreshnessException        if the payload is older than the window
   * @throws InvalidKeyFormatException if a key is malformed
   */
  public Map<String, String> unpackSecrets(SealedPayload payload,
                                           String recipientPrivateKey,
                                           String senderPublicKey) {
    byte[] key = deriveKey(recipientPrivateKey, senderPublicKey);
    byte[] plaintext = null;
    try {
      plaintext = AesGcm.open(key,
          decode(payload.nonce()),
          decode(payload.ciphertext()),
          decode(payload.tag()),
          aad(payload.recipientKeyId()));
      ByteBuffer buffer = ByteBuffer.wrap(plaintext);
      long createdAt = buffer.getLong();
      checkFreshness(createdAt);
      return decodeEntries(buffer);
    } catch (BufferUnderflowException e) {
      throw new IntegrityException("Sealed payload is truncated", e);
    } finally {
      wipe(key, plaintext);
    }
  }

  public Duration freshnessWindow() {
    return freshnessWindow;
  }

  private void checkFreshness(long createdAtMillis) {
    long ageMillis = clock.millis() - createdAtMillis;
    if (Math.abs(ageMillis) > freshnessWindow.toMillis()) {
      throw new FreshnessException("Sealed payload is outside the freshness window (age " + ageMillis + " ms)");
    }
  }

  private byte[] deriveKey(String privateKey, String publicKey) {
    byte[] shared = keyExchange.deriveSharedSecret(privateKey, publicKey);
    try {
      return AesGcm.deriveKey(shared, null, HKDF_INFO);
    } finally {
      wipe(shared);
    }
  }

  private static byte[] aad(String recipientKeyId) {
    if (recipientKeyId == null) {
      throw new IntegrityException("Sealed payload has no recipient key id");
    }
    return recipientKeyId.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] decode(String field) {
    try {
      return ByteUtils.fromBase64Url(field);
    } catch (IllegalArgumentException e) {
      throw new IntegrityException("Sealed payload field is not valid base64url", e);
    }
  }

  static byte[] encode(Map<String, String> secrets, long createdAtMillis) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(uint64(createdAtMillis));
    out.writeBytes(uint32(secrets.size()));
    for (Map.Entry<String, String> entry : new TreeMap<>(secrets).entrySet()) {
      writeField(out, entry.getKey());
      writeField(out, entry.getValue());
    }
    return out.toByteArray();
  }

  private static void writeField(ByteArrayOutputStream out, String value) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    out.writeBytes(uint32(bytes.length));
    out.writeBytes(bytes);
    wipe(bytes);
  }

  private static Map<String, String> decodeEntries(ByteBuffer buffer) {
    int count = buffer.getInt();
    if (count < 0) {
      throw new IntegrityException("Sealed payload has a negative entry count");
    }
    Map<String, String> secrets = new TreeMap<>();
    for (int i = 0; i < count; i++) {
      secrets.put(readField(buffer), readField(buffer));
    }
    if (buffer.hasRemaining()) {
      throw new IntegrityException("Sealed payload has trailing bytes");
    }
    return Collections.unmodifiableMap(secrets);
  }

  private static String readField(ByteBuffer buffer) {
    int length = buffer.getInt();
    if (length < 0 || length > buffer.remaining()) {
      throw new IntegrityException("Sealed payload field length is out of range");
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
