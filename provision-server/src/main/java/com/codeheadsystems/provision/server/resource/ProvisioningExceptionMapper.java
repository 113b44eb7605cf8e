package com.codeheadsystems.provision.server.resource;

import com.codeheadsystems.provision.model.common.ErrorResponse;
import com.codeheadsystems.provision.server.exception.CapacityException;
import com.codeheadsystems.provision.server.exception.ErrorCode;
import com.codeheadsystems.provision.server.exception.ProvisioningException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link ProvisioningException} as {@code {success:false,error:{code,message}}} with the
 * status of its code. Rate-limit rejections also carry {@code Retry-After} in seconds.
 */
@Provider
public class ProvisioningExceptionMapper implements ExceptionMapper<ProvisioningException> {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningExceptionMapper.class);

  private final Clock clock;

  public ProvisioningExceptionMapper(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Response toResponse(ProvisioningException exception) {
    ErrorCode code = exception.code();
    if (code.httpStatus() >= 500) {
      log.error("Request failed: {}", code, exception);
    } else {
      log.debug("Request rejected: {} {}", code, exception.getMessage());
    }
    Response.ResponseBuilder builder = Response.status(code.httpStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(code.name(), exception.getMessage()));
    if (exception instanceof CapacityException capacity) {
      builder.header("Retry-After", retryAfterSeconds(capacity));
    }
    return builder.build();
  }

  long retryAfterSeconds(CapacityException exception) {
    if (exception.resetAt() == null) {
      return 1;
    }
    long millis = Duration.between(clock.instant(), exception.resetAt()).toMillis();
    return Math.max(1, (millis + 999) / 1000);
  }
}
