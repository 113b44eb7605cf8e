package com.codeheadsystems.provision.client.exceptions;

/**
 * Raised when a call to the orchestrator fails in transport or is rejected.
 */
public class ProvisionAccessorException extends RuntimeException {

  private final int status;
  private final String errorCode;

  /**
   * Transport failure; no response was received.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ProvisionAccessorException(final String message, final Throwable cause) {
    this(message, 0, null, cause);
  }

  /**
   * Rejection by the orchestrator.
   *
   * @param message   the message
   * @param status    the HTTP status
   * @param errorCode the error code from the response body, or null if there was none
   * @param cause     the cause, may be null
   */
  public ProvisionAccessorException(final String message, final int status, final String errorCode,
                                    final Throwable cause) {
    super(message, cause);
    this.status = status;
    this.errorCode = errorCode;
  }

  /**
   * @return the HTTP status, or 0 if no response was received
   */
  public int status() {
    return status;
  }

  public String errorCode() {
    return errorCode;
  }
}
