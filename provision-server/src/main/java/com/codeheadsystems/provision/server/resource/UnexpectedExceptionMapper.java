package com.codeheadsystems.provision.server.resource;

import com.codeheadsystems.provision.model.common.ErrorResponse;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the error body shape for framework rejections and hides the detail of anything unexpected.
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<RuntimeException> {

  private static final Logger log = LoggerFactory.getLogger(UnexpectedExceptionMapper.class);

  @Override
  public Response toResponse(RuntimeException exception) {
    if (exception instanceof WebApplicationException web) {
      int status = web.getResponse().getStatus();
      ErrorCode code = codeForStatus(status);
      String message = status >= 500 ? "Internal error" : web.getMessage();
      return error(status, code, message);
    }
    log.error("Unexpected failure", exception);
    return error(ErrorCode.INTERNAL.httpStatus(), ErrorCode.INTERNAL, "Internal error");
  }

  static ErrorCode codeForStatus(int status) {
    if (status == 404) {
      return ErrorCode.NOT_FOUND;
    }
    if (status == 401) {
      return ErrorCode.INVALID_SIDECAR_TOKEN;
    }
    if (status >= 400 && status < 500) {
      return ErrorCode.INVALID_REQUEST;
    }
    return ErrorCode.INTERNAL;
  }

  private static Response error(int status, ErrorCode code, String message) {
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(code.name(), message))
        .build();
  }
}
