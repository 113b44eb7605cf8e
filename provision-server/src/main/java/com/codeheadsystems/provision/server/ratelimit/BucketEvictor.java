package com.codeheadsystems.provision.server.ratelimit;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically drops refilled buckets from a {@link TokenBucketRateLimiter} so that callers
 * choosing fresh identities cannot grow it without bound.
 */
public class BucketEvictor {

  private static final Logger log = LoggerFactory.getLogger(BucketEvictor.class);

  private final TokenBucketRateLimiter rateLimiter;
  private final Duration interval;
  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "rate-limit-evictor");
    t.setDaemon(true);
    return t;
  });

  public BucketEvictor(TokenBucketRateLimiter rateLimiter, Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Eviction interval must be positive");
    }
    this.rateLimiter = rateLimiter;
    this.interval = interval;
  }

  public void start() {
    log.info("Starting rate limit bucket eviction every {}", interval);
    executor.scheduleWithFixedDelay(this::evict, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  public void shutdown() {
    executor.shutdownNow();
  }

  void evict() {
    try {
      int removed = rateLimiter.evictFullBuckets();
      if (removed > 0) {
        log.debug("Evicted {} refilled rate limit bucket(s)", removed);
      }
    } catch (RuntimeException e) {
      // A thrown exception would cancel every later run.
      log.error("Rate limit bucket eviction failed", e);
    }
  }
}
