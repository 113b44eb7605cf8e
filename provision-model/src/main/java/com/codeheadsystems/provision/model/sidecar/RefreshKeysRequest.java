package com.codeheadsystems.provision.model.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Asks for a freshly sealed credential bundle. The sidecar token travels in the
 * {@code Authorization: Bearer} header.
 *
 * @param sessionId the registered session
 * @param providers optional provider filter; null or empty means all
 */
public record RefreshKeysRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("providers") List<String> providers) {
}
