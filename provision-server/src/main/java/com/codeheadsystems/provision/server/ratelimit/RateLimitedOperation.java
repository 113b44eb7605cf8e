package com.codeheadsystems.provision.server.ratelimit;

import java.time.Duration;

/**
 * Mutating entry points guarded by the rate limiter, with their default policies.
 */
public enum RateLimitedOperation {
  REGISTER_SIDECAR(new RateLimitPolicy(3, Duration.ofMinutes(5))),
  REFRESH_KEYS(new RateLimitPolicy(10, Duration.ofMinutes(1))),
  ROTATE_KEYS(new RateLimitPolicy(10, Duration.ofMinutes(1))),
  STORE_SECRET(new RateLimitPolicy(100, Duration.ofMinutes(1))),
  SESSION_WRITE(new RateLimitPolicy(100, Duration.ofMinutes(1)));

  private final RateLimitPolicy defaultPolicy;

  RateLimitedOperation(RateLimitPolicy defaultPolicy) {
    this.defaultPolicy = defaultPolicy;
  }

  public RateLimitPolicy defaultPolicy() {
    return defaultPolicy;
  }
}
