package com.codeheadsystems.provision.server.model;

import com.codeheadsystems.provision.crypto.exchange.SealedPayload;

/**
 * Everything a sidecar receives from a successful registration.
 */
public record RegistrationResult(SealedPayload sealedPayload,
                                 String sidecarToken,
                                 int credentialCount,
                                 String orchestratorPublicKey,
                                 String orchestratorKeyId,
                                 int sidecarServicePort) {

  @Override
  public String toString() {
    return "RegistrationResult{credentialCount=" + credentialCount + ", orchestratorKeyId=" + orchestratorKeyId + "}";
  }
}
