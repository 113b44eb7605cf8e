package com.codeheadsystems.provision.model.rotation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code POST /users/{userId}/rotations}
 *
 * @param providers optional provider filter; null or empty means every stored credential
 * @param mode      required, {@code best_effort} or {@code all_or_nothing}
 */
public record RotateAllRequest(
    @JsonProperty("providers") List<String> providers,
    @JsonProperty("mode") String mode) {
}
