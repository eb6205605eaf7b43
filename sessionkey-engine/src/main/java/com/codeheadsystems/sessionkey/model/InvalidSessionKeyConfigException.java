package com.codeheadsystems.sessionkey.model;

/**
 * Thrown when a session key is requested with a malformed policy. Nothing is stored.
 */
public class InvalidSessionKeyConfigException extends IllegalArgumentException {

  /**
   * Instantiates a new Invalid session key config exception.
   *
   * @param message the message
   */
  public InvalidSessionKeyConfigException(final String message) {
    super(message);
  }
}
