package com.codeheadsystems.provision.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /sessions}
 *
 * @param userId owner of the session and of the credentials it will receive
 */
public record CreateSessionRequest(@JsonProperty("userId") String userId) {
}
