package com.codeheadsystems.provision.server.ratelimit;

import java.time.Instant;

/**
 * Result of a rate-limit check.
 *
 * @param allowed   whether the call may proceed; a token was consumed if so
 * @param remaining whole tokens left after this call
 * @param resetAt   when denied, the instant the next token is available; when allowed,
 *                  the instant the bucket is full again
 */
public record RateLimitDecision(boolean allowed, int remaining, Instant resetAt) {
}
