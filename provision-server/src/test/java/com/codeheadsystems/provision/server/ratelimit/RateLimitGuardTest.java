package com.codeheadsystems.provision.server.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.provision.server.exception.CapacityException;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.security.SecurityEventLogger;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateLimitGuardTest {

  private static final Instant RESET = Instant.parse("2024-01-01T00:01:40Z");

  @Mock private RateLimiter rateLimiter;
  @Mock private SecurityEventLogger securityEvents;

  @Test
  void guard_allowed_runsAction() {
    when(rateLimiter.checkLimit("s-1", RateLimitedOperation.REFRESH_KEYS))
        .thenReturn(new RateLimitDecision(true, 9, RESET));
    RateLimitGuard guard = new RateLimitGuard(rateLimiter, securityEvents);

    assertThat(guard.guard("s-1", RateLimitedOperation.REFRESH_KEYS, () -> "ok")).isEqualTo("ok");
  }

  @Test
  void guard_denied_throwsWithoutRunningAction() {
    when(rateLimiter.checkLimit("s-1", RateLimitedOperation.REGISTER_SIDECAR))
        .thenReturn(new RateLimitDecision(false, 0, RESET));
    RateLimitGuard guard = new RateLimitGuard(rateLimiter, securityEvents);
    AtomicBoolean ran = new AtomicBoolean();

    assertThatThrownBy(() -> guard.guard("s-1", RateLimitedOperation.REGISTER_SIDECAR, () -> ran.getAndSet(true)))
        .isInstanceOfSatisfying(CapacityException.class, e -> {
          assertThat(e.code()).isEqualTo(ErrorCode.RATE_LIMITED);
          assertThat(e.resetAt()).isEqualTo(RESET);
        });
    assertThat(ran).isFalse();
    verify(securityEvents).rateLimited("s-1", RateLimitedOperation.REGISTER_SIDECAR);
  }

  @Test
  void check_nullIdentity_usesSharedAnonymousBucket() {
    when(rateLimiter.checkLimit("anonymous", RateLimitedOperation.SESSION_WRITE))
        .thenReturn(new RateLimitDecision(true, 1, RESET));

    new RateLimitGuard(rateLimiter, securityEvents).check(null, RateLimitedOperation.SESSION_WRITE);

    verify(rateLimiter).checkLimit("anonymous", RateLimitedOperation.SESSION_WRITE);
  }
}
