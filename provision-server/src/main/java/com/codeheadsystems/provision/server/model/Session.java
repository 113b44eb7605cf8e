package com.codeheadsystems.provision.server.model;

import java.time.Instant;

/**
 * A sidecar session. {@code version} increases by one on every successful conditional
 * write and is what the store compares against.
 */
public record Session(String id,
                      String userId,
                      SessionStatus status,
                      String registrationToken,
                      String sidecarKeyId,
                      String sidecarPublicKey,
                      String orchestratorPublicKey,
                      String orchestratorKeyId,
                      Instant registeredAt,
                      Instant createdAt,
                      Instant updatedAt,
                      long version) {

  public static Session create(String id, String userId, String registrationToken, Instant now) {
    return new Session(id, userId, SessionStatus.CREATING, registrationToken,
        null, null, null, null, null, now, now, 0L);
  }

  public boolean isRegistered() {
    return sidecarKeyId != null && sidecarPublicKey != null;
  }

  public Session withStatus(SessionStatus newStatus, Instant now) {
    return new Session(id, userId, newStatus, registrationToken, sidecarKeyId, sidecarPublicKey,
        orchestratorPublicKey, orchestratorKeyId, registeredAt, createdAt, now, version);
  }

  public Session withRegistration(String sidecarKeyId,
                                  String sidecarPublicKey,
                                  String orchestratorPublicKey,
                                  String orchestratorKeyId,
                                  Instant now) {
    return new Session(id, userId, SessionStatus.ACTIVE, registrationToken, sidecarKeyId, sidecarPublicKey,
        orchestratorPublicKey, orchestratorKeyId, now, createdAt, now, version);
  }

  public Session withVersion(long newVersion) {
    return new Session(id, userId, status, registrationToken, sidecarKeyId, sidecarPublicKey,
        orchestratorPublicKey, orchestratorKeyId, registeredAt, createdAt, updatedAt, newVersion);
  }

  @Override
  public String toString() {
    return "Session{id=" + id + ", userId=" + userId + ", status=" + status + ", sidecarKeyId=" + sidecarKeyId
        + ", version=" + version + "}";
  }
}
