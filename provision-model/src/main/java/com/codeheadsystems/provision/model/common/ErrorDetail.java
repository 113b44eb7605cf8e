package com.codeheadsystems.provision.model.common;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Machine-readable error code and a human-readable message.
 *
 * @param code    stable error code, e.g. {@code INVALID_SESSION_OR_TOKEN}
 * @param message description safe to show to the caller
 */
public record ErrorDetail(
    @JsonProperty("code") String code,
    @JsonProperty("message") String message) {
}
