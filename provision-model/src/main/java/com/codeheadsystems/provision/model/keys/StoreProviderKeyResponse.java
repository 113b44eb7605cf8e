package com.codeheadsystems.provision.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param provider   normalized provider name
 * @param created    true on first store, false when an existing credential was replaced
 * @param keyVersion version of the stored record
 */
public record StoreProviderKeyResponse(
    @JsonProperty("provider") String provider,
    @JsonProperty("created") boolean created,
    @JsonProperty("keyVersion") int keyVersion) {
}
