package com.codeheadsystems.provision.server.ratelimit;

/**
 * Per-(identity, operation) rate limiting. Implementations must update counters atomically.
 */
public interface RateLimiter {

  /**
   * Checks and, if allowed, consumes one unit of the caller's allowance.
   *
   * @param identity  who is calling, e.g. a user id or session id
   * @param operation what is being called
   * @return the decision
   */
  RateLimitDecision checkLimit(String identity, RateLimitedOperation operation);
}
