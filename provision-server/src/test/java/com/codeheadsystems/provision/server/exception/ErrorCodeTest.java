package com.codeheadsystems.provision.server.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ErrorCodeTest {

  @Test
  void statuses_followCategories() {
    assertThat(ErrorCode.INVALID_KEY_FORMAT.httpStatus()).isEqualTo(400);
    assertThat(ErrorCode.INVALID_SESSION_OR_TOKEN.httpStatus()).isEqualTo(401);
    assertThat(ErrorCode.NO_CREDENTIALS.httpStatus()).isEqualTo(403);
    assertThat(ErrorCode.NOT_FOUND.httpStatus()).isEqualTo(404);
    assertThat(ErrorCode.INVALID_STATE.httpStatus()).isEqualTo(409);
    assertThat(ErrorCode.RATE_LIMITED.httpStatus()).isEqualTo(429);
    assertThat(ErrorCode.ALL_DECRYPT_FAILED.httpStatus()).isEqualTo(500);
  }

  @Test
  void retryable_onlyForTransientCategories() {
    assertThat(ErrorCode.RATE_LIMITED.retryable()).isTrue();
    assertThat(ErrorCode.CONCURRENT_MODIFICATION.retryable()).isTrue();
    assertThat(ErrorCode.TIMEOUT.retryable()).isTrue();
    assertThat(ErrorCode.INTEGRITY_FAILURE.retryable()).isFalse();
    assertThat(ErrorCode.INVALID_REQUEST.retryable()).isFalse();
  }

  @Test
  void exception_exposesCategory() {
    ProvisioningException e = new ProvisioningException(ErrorCode.PAYLOAD_EXPIRED, "old");
    assertThat(e.code()).isEqualTo(ErrorCode.PAYLOAD_EXPIRED);
    assertThat(e.category()).isEqualTo(ErrorCategory.FRESHNESS);
  }
}
