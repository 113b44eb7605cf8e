package com.codeheadsystems.provision.model.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire form of a sealed credential bundle. All byte fields are base64url without padding.
 * <p>
 * Only the holder of the private key matching {@code recipientKeyId} can open it, and only
 * within the freshness window after it was sealed.
 *
 * @param ciphertext     the sealed bundle
 * @param nonce          the 12-byte GCM nonce
 * @param tag            the 16-byte GCM tag
 * @param recipientKeyId the sidecar key id the bundle was sealed for
 */
public record EncryptedProviderKeys(
    @JsonProperty("ciphertext") String ciphertext,
    @JsonProperty("nonce") String nonce,
    @JsonProperty("tag") String tag,
    @JsonProperty("recipientKeyId") String recipientKeyId) {
}
