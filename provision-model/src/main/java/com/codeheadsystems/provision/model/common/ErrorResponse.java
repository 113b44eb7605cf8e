package com.codeheadsystems.provision.model.common;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of every failed request: {@code {"success": false, "error": {"code", "message"}}}.
 *
 * @param success always false
 * @param error   the error detail
 */
public record ErrorResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("error") ErrorDetail error) {

  public ErrorResponse(String code, String message) {
    this(false, new ErrorDetail(code, message));
  }
}
