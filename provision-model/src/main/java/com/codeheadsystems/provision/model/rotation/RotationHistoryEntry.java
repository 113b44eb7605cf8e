package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One audit record of a rotation attempt.
 */
public record RotationHistoryEntry(
    @JsonProperty("id") String id,
    @JsonProperty("provider") String provider,
    @JsonProperty("oldVersion") Integer oldVersion,
    @JsonProperty("newVersion") Integer newVersion,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("success") boolean success,
    @JsonProperty("error") String error) {
}
