package com.codeheadsystems.provision.server.exception;

/**
 * Stable error codes returned on the wire, each with its category and HTTP status.
 */
public enum ErrorCode {
  INVALID_REQUEST(ErrorCategory.FORMAT, 400),
  INVALID_KEY_FORMAT(ErrorCategory.FORMAT, 400),
  INVALID_PROVIDER(ErrorCategory.FORMAT, 400),
  INVALID_SECRET(ErrorCategory.FORMAT, 400),
  INVALID_SESSION_OR_TOKEN(ErrorCategory.AUTH, 401),
  INVALID_SIDECAR_TOKEN(ErrorCategory.AUTH, 401),
  NO_CREDENTIALS(ErrorCategory.STATE, 403),
  NOT_FOUND(ErrorCategory.NOT_FOUND, 404),
  INVALID_STATE(ErrorCategory.STATE, 409),
  INVALID_TRANSITION(ErrorCategory.STATE, 409),
  CONCURRENT_MODIFICATION(ErrorCategory.STATE, 409),
  BATCH_ABORTED(ErrorCategory.PARTIAL_FAILURE, 409),
  PAYLOAD_EXPIRED(ErrorCategory.FRESHNESS, 400),
  RATE_LIMITED(ErrorCategory.CAPACITY, 429),
  TIMEOUT(ErrorCategory.TIMEOUT, 503),
  ALL_DECRYPT_FAILED(ErrorCategory.INTEGRITY, 500),
  INTEGRITY_FAILURE(ErrorCategory.INTEGRITY, 500),
  UNSUPPORTED_VERSION(ErrorCategory.STATE, 409),
  UNKNOWN_MASTER_KEY(ErrorCategory.INTERNAL, 500),
  INTERNAL(ErrorCategory.INTERNAL, 500);

  private final ErrorCategory category;
  private final int httpStatus;

  ErrorCode(ErrorCategory category, int httpStatus) {
    this.category = category;
    this.httpStatus = httpStatus;
  }

  public ErrorCategory category() {
    return category;
  }

  public int httpStatus() {
    return httpStatus;
  }

  /**
   * Whether repeating the same call may succeed without any other change.
   *
   * @return true for timeouts, capacity and lost races
   */
  public boolean retryable() {
    return this == TIMEOUT || this == RATE_LIMITED || this == CONCURRENT_MODIFICATION;
  }
}
