package com.codeheadsystems.provision.model.keys;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code PUT /users/{userId}/provider-keys/{provider}}
 *
 * @param key the plaintext provider credential
 */
public record StoreProviderKeyRequest(@JsonProperty("key") String key) {

  @Override
  public String toString() {
    return "StoreProviderKeyRequest{key=<redacted>}";
  }
}
