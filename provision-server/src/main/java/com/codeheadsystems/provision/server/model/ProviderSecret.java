package com.codeheadsystems.provision.server.model;

import com.codeheadsystems.provision.crypto.envelope.StoredSecret;
import java.time.Instant;

/**
 * A stored credential with its owner and timestamps. Unique per (userId, provider).
 */
public record ProviderSecret(String userId,
                             String provider,
                             StoredSecret secret,
                             Instant createdAt,
                             Instant updatedAt) {

  public int keyVersion() {
    return secret.keyVersion();
  }

  public ProviderSecret withSecret(StoredSecret newSecret, Instant now) {
    return new ProviderSecret(userId, provider, newSecret, createdAt, now);
  }
}
