package com.codeheadsystems.provision.server.resource;

import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;

final class ResourceSupport {

  private static final String BEARER_PREFIX = "Bearer ";

  private ResourceSupport() {
  }

  static <T> T requireBody(T body) {
    if (body == null) {
      throw new ProvisioningException(ErrorCode.INVALID_REQUEST, "Request body is required");
    }
    return body;
  }

  /**
   * Extracts the token from an {@code Authorization: Bearer <token>} header.
   *
   * @param authorization the header value, may be null
   * @return the token, or null if the header is missing or not a bearer header
   */
  static String bearerToken(String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = authorization.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
