package com.codeheadsystems.provision.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The registration token is returned only here, to be injected into the sidecar.
 *
 * @param sessionId         the new session id
 * @param registrationToken the one-time registration token
 */
public record CreateSessionResponse(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("registrationToken") String registrationToken) {

  @Override
  public String toString() {
    return "CreateSessionResponse{sessionId=" + sessionId + "}";
  }
}
