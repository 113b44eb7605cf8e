package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of rotating one credential.
 *
 * @param provider   provider name
 * @param success    whether the new version was committed
 * @param oldVersion version before rotation, null if the credential was missing
 * @param newVersion version after rotation, null on failure
 * @param errorCode  error code on failure, otherwise null
 * @param error      error message on failure, otherwise null
 */
public record RotationResultView(
    @JsonProperty("provider") String provider,
    @JsonProperty("success") boolean success,
    @JsonProperty("oldVersion") Integer oldVersion,
    @JsonProperty("newVersion") Integer newVersion,
    @JsonProperty("errorCode") String errorCode,
    @JsonProperty("error") String error) {
}
