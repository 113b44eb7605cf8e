package com.codeheadsystems.provision.model.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a successful registration.
 *
 * @param success               always true
 * @param sidecarAuthToken      bearer token for later refresh calls, valid for 24 hours
 * @param orchestratorPublicKey the orchestrator's ephemeral public key for this exchange
 * @param orchestratorKeyId     the orchestrator's ephemeral key id
 * @param opencodePort          port of the agent service inside the sidecar
 * @param credentialCount       number of credentials in the sealed bundle
 * @param encryptedProviderKeys the sealed credentials
 */
public record SidecarRegistrationResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("sidecarAuthToken") String sidecarAuthToken,
    @JsonProperty("orchestratorPublicKey") String orchestratorPublicKey,
    @JsonProperty("orchestratorKeyId") String orchestratorKeyId,
    @JsonProperty("opencodePort") int opencodePort,
    @JsonProperty("credentialCount") int credentialCount,
    @JsonProperty("encryptedProviderKeys") EncryptedProviderKeys encryptedProviderKeys) {

  @Override
  public String toString() {
    return "SidecarRegistrationResponse{orchestratorKeyId=" + orchestratorKeyId
        + ", credentialCount=" + credentialCount + "}";
  }
}
