package com.codeheadsystems.provision.server.exception;

/**
 * Failure classes. Callers branch on the category; the code gives the detail.
 */
public enum ErrorCategory {
  FORMAT,
  STATE,
  AUTH,
  NOT_FOUND,
  INTEGRITY,
  FRESHNESS,
  CAPACITY,
  PARTIAL_FAILURE,
  TIMEOUT,
  INTERNAL
}
