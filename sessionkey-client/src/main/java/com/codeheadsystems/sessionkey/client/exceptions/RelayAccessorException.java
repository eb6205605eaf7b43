package com.codeheadsystems.sessionkey.client.exceptions;

/**
 * The type Relay accessor exception.
 */
public class RelayAccessorException extends RuntimeException {
  /**
   * Instantiates a new Relay accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RelayAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
