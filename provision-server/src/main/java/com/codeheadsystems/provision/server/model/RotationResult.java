package com.codeheadsystems.provision.server.model;

import com.codeheadsystems.provision.server.exception.ErrorCode;

/**
 * Outcome of rotating one credential. Failures are values, not exceptions.
 */
public record RotationResult(String provider,
                             boolean success,
                             Integer oldVersion,
                             Integer newVersion,
                             ErrorCode errorCode,
                             String error) {

  public static RotationResult succeeded(String provider, int oldVersion, int newVersion) {
    return new RotationResult(provider, true, oldVersion, newVersion, null, null);
  }

  public static RotationResult failed(String provider, Integer oldVersion, ErrorCode code, String error) {
    return new RotationResult(provider, false, oldVersion, null, code, error);
  }
}
