package com.codeheadsystems.provision.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a session. Omits the registration token and the public keys.
 *
 * @param sessionId         session id
 * @param userId            owning user
 * @param status            lower-case status name
 * @param sidecarKeyId      key id of the registered sidecar, null before registration
 * @param orchestratorKeyId orchestrator key id of the last exchange, null before registration
 * @param registeredAt      ISO-8601 registration instant, null before registration
 * @param createdAt         ISO-8601 creation instant
 * @param updatedAt         ISO-8601 instant of the last change
 */
public record SessionView(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("userId") String userId,
    @JsonProperty("status") String status,
    @JsonProperty("sidecarKeyId") String sidecarKeyId,
    @JsonProperty("orchestratorKeyId") String orchestratorKeyId,
    @JsonProperty("registeredAt") String registeredAt,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("updatedAt") String updatedAt) {
}
