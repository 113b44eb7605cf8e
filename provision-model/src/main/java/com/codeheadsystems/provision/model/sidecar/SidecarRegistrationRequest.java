package com.codeheadsystems.provision.model.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sent by a freshly booted sidecar to bind itself to its session.
 * <p>
 * The sidecar generates an ephemeral P-256 key pair before calling; only the public half
 * and its key id leave the sidecar. The registration token was injected into the sidecar
 * environment when the session was created and is accepted exactly once.
 * <p>
 * Used by: {@code POST /sidecar/register}
 *
 * @param sessionId         the session being registered
 * @param registrationToken the one-time token issued with the session
 * @param publicKey         base64url of the sidecar's uncompressed public point
 * @param keyId             base64url of the sidecar's 16-byte key id
 */
public record SidecarRegistrationRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("registrationToken") String registrationToken,
    @JsonProperty("publicKey") String publicKey,
    @JsonProperty("keyId") String keyId) {

  @Override
  public String toString() {
    return "SidecarRegistrationRequest{sessionId=" + sessionId + ", keyId=" + keyId + "}";
  }
}
