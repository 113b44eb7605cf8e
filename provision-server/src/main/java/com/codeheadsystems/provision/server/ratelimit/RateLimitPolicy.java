package com.codeheadsystems.provision.server.ratelimit;

import java.time.Duration;

/**
 * Token bucket of {@code capacity} tokens refilled continuously at {@code capacity} per
 * {@code window}.
 *
 * @param capacity maximum burst, and tokens added per window
 * @param window   refill window
 */
public record RateLimitPolicy(int capacity, Duration window) {

  public RateLimitPolicy {
    if (capacity < 1) {
      throw new IllegalArgumentException("Rate limit capacity must be at least 1");
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("Rate limit window must be positive");
    }
  }

  double tokensPerMilli() {
    return (double) capacity / window.toMillis();
  }
}
