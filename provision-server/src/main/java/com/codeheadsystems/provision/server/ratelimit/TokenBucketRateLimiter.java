package com.codeheadsystems.provision.server.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory token bucket rate limiter. Each bucket is updated inside
 * {@link ConcurrentHashMap#compute}, so concurrent checks on the same bucket serialize.
 */
public class TokenBucketRateLimiter implements RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

  private final Map<RateLimitedOperation, RateLimitPolicy> policies;
  private final Clock clock;
  private final ConcurrentHashMap<BucketKey, Bucket> buckets = new ConcurrentHashMap<>();

  public TokenBucketRateLimiter(Clock clock) {
    this(Map.of(), clock);
  }

  /**
   * Creates the limiter.
   *
   * @param overrides policies replacing the defaults of {@link RateLimitedOperation}
   * @param clock     time source
   */
  public TokenBucketRateLimiter(Map<RateLimitedOperation, RateLimitPolicy> overrides, Clock clock) {
    Map<RateLimitedOperation, RateLimitPolicy> merged = new EnumMap<>(RateLimitedOperation.class);
    for (RateLimitedOperation operation : RateLimitedOperation.values()) {
      merged.put(operation, overrides.getOrDefault(operation, operation.defaultPolicy()));
    }
    this.policies = merged;
    this.clock = clock;
    log.info("TokenBucketRateLimiter({})", merged);
  }

  @Override
  public RateLimitDecision checkLimit(String identity, RateLimitedOperation operation) {
    RateLimitPolicy policy = policies.get(operation);
    long now = clock.millis();
    AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
    buckets.compute(new BucketKey(identity, operation), (key, bucket) -> {
      double tokens = bucket == null
          ? policy.capacity()
          : Math.min(policy.capacity(), bucket.tokens() + (now - bucket.updatedAtMillis()) * policy.tokensPerMilli());
      if (tokens >= 1.0) {
        double left = tokens - 1.0;
        long untilFull = (long) Math.ceil((policy.capacity() - left) / policy.tokensPerMilli());
        decision.set(new RateLimitDecision(true, (int) Math.floor(left), Instant.ofEpochMilli(now + untilFull)));
        return new Bucket(left, now);
      }
      long untilNext = (long) Math.ceil((1.0 - tokens) / policy.tokensPerMilli());
      decision.set(new RateLimitDecision(false, 0, Instant.ofEpochMilli(now + untilNext)));
      return new Bucket(tokens, now);
    });
    return decision.get();
  }

  /**
   * Drops buckets that have refilled completely, since they are indistinguishable from new
   * ones.
   *
   * @return the number of buckets removed
   */
  public int evictFullBuckets() {
    long now = clock.millis();
    int before = buckets.size();
    buckets.entrySet().removeIf(e -> {
      RateLimitPolicy policy = policies.get(e.getKey().operation());
      Bucket b = e.getValue();
      return b.tokens() + (now - b.updatedAtMillis()) * policy.tokensPerMilli() >= policy.capacity();
    });
    return before - buckets.size();
  }

  int bucketCount() {
    return buckets.size();
  }

  private record BucketKey(String identity, RateLimitedOperation operation) {
  }

  private record Bucket(double tokens, long updatedAtMillis) {
  }
}
