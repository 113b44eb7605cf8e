package com.codeheadsystems.provision.server.exception;

import java.time.Instant;

/**
 * A rate limit was exceeded. Carries the instant at which the caller may retry.
 */
public class CapacityException extends ProvisioningException {

  private final Instant resetAt;

  public CapacityException(String message, Instant resetAt) {
    super(ErrorCode.RATE_LIMITED, message);
    this.resetAt = resetAt;
  }

  public Instant resetAt() {
    return resetAt;
  }
}
