package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * @param totalKeys    number of credentials attempted
 * @param successCount number committed at the new version
 * @param failureCount number that failed
 * @param rolledBack   true when all-or-nothing mode left every credential unchanged
 * @param results      one entry per credential
 */
public record BatchRotationResponse(
    @JsonProperty("totalKeys") int totalKeys,
    @JsonProperty("successCount") int successCount,
    @JsonProperty("failureCount") int failureCount,
    @JsonProperty("rolledBack") boolean rolledBack,
    @JsonProperty("results") List<RotationResultView> results) {
}
