package com.codeheadsystems.provision.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata about a stored credential. Never carries the credential itself.
 *
 * @param provider    provider name
 * @param keyVersion  current key version
 * @param masterKeyId master key wrapping the data key
 * @param createdAt   ISO-8601 instant of first store
 * @param updatedAt   ISO-8601 instant of last replace or rotation
 */
public record ProviderKeySummary(
    @JsonProperty("provider") String provider,
    @JsonProperty("keyVersion") int keyVersion,
    @JsonProperty("masterKeyId") String masterKeyId,
    @JsonProperty("createdAt") String createdAt,
    @JsonProperty("updatedAt") String updatedAt) {
}
