package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param id      id of the pending schedule
 * @param created true when a new schedule was created
 * @param updated true when an existing pending schedule was moved
 */
public record ScheduleRotationResponse(
    @JsonProperty("id") String id,
    @JsonProperty("created") boolean created,
    @JsonProperty("updated") boolean updated) {
}
