package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param scheduledFor  ISO-8601 instant in the future
 * @param targetVersion optional target version
 */
public record ScheduleRotationRequest(
    @JsonProperty("scheduledFor") String scheduledFor,
    @JsonProperty("targetVersion") Integer targetVersion) {
}
