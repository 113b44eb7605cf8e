package com.codeheadsystems.provision.crypto.exchange;

/**
 * A bundle of named secrets sealed for one recipient. Byte fields are base64url.
 *
 * @param ciphertext     the sealed bundle
 * @param nonce          12-byte GCM nonce
 * @param tag            16-byte GCM tag
 * @param recipientKeyId key id of the recipient's ephemeral key pair, bound as associated data
 */
public record SealedPayload(String ciphertext, String nonce, String tag, String recipientKeyId) {
}
