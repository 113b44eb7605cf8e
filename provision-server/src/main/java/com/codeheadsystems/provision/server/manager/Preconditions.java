package com.codeheadsystems.provision.server.manager;

import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;

final class Preconditions {

  private Preconditions() {
  }

  static String requireField(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "Missing required field: " + name);
    }
    return value;
  }
}
