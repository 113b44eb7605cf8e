package com.codeheadsystems.provision.server.ratelimit;

import com.codeheadsystems.provision.server.exception.CapacityException;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Applies the rate limiter in front of manager calls.
 */
@Singleton
public class RateLimitGuard {

  private final RateLimiter rateLimiter;
  private final SecurityEventLogger securityEvents;

  @Inject
  public RateLimitGuard(RateLimiter rateLimiter, SecurityEventLogger securityEvents) {
    this.rateLimiter = rateLimiter;
    this.securityEvents = securityEvents;
  }

  /**
   * Consumes one unit of allowance or fails.
   *
   * @param identity  the caller
   * @param operation the operation
   * @throws CapacityException if the allowance is exhausted
   */
  public void check(String identity, RateLimitedOperation operation) {
    RateLimitDecision decision = rateLimiter.checkLimit(identity == null ? "anonymous" : identity, operation);
    if (!decision.allowed()) {
      securityEvents.rateLimited(identity, operation);
      throw new CapacityException("Rate limit exceeded for " + operation, decision.resetAt());
    }
  }

  /**
   * Runs the action if the caller is within its allowance.
   *
   * @param identity  the caller
   * @param operation the operation
   * @param action    the guarded call
   * @param <T>       result type
   * @return the action's result
   * @throws CapacityException if the allowance is exhausted; the action is not run
   */
  public <T> T guard(String identity, RateLimitedOperation operation, Supplier<T> action) {
    check(identity, operation);
    return action.get();
  }
}
