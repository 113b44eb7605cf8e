package com.codeheadsystems.provision.server.exception;

/**
 * Raised by the managers for every expected failure. Resources translate it to the JSON
 * error body using {@link ErrorCode#httpStatus()}; the message is safe to return.
 */
public class ProvisioningException extends RuntimeException {

  private final ErrorCode code;

  public ProvisioningException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ProvisioningException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorCategory category() {
    return code.category();
  }
}
