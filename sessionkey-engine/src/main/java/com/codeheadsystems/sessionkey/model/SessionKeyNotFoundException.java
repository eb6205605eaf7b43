package com.codeheadsystems.sessionkey.model;

/**
 * Thrown by operations that need an existing session key when the id is unknown.
 */
public class SessionKeyNotFoundException extends RuntimeException {

  private final String sessionKeyId;

  /**
   * Instantiates a new Session key not found exception.
   *
   * @param sessionKeyId the session key id
   */
  public SessionKeyNotFoundException(final String sessionKeyId) {
    super("Session key not found: " + sessionKeyId);
    this.sessionKeyId = sessionKeyId;
  }

  /**
   * Gets session key id.
   *
   * @return the session key id
   */
  public String getSessionKeyId() {
    return sessionKeyId;
  }
}
