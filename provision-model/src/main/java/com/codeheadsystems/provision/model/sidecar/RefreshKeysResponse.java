package com.codeheadsystems.provision.model.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a refresh. The orchestrator key pair is new on every call, so the sidecar must
 * use the public key returned here to open the bundle.
 *
 * @param success               always true
 * @param orchestratorPublicKey the new orchestrator ephemeral public key
 * @param orchestratorKeyId     the new orchestrator key id
 * @param credentialCount       number of credentials in the sealed bundle
 * @param encryptedProviderKeys the sealed credentials
 */
public record RefreshKeysResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("orchestratorPublicKey") String orchestratorPublicKey,
    @JsonProperty("orchestratorKeyId") String orchestratorKeyId,
    @JsonProperty("credentialCount") int credentialCount,
    @JsonProperty("encryptedProviderKeys") EncryptedProviderKeys encryptedProviderKeys) {
}
