package com.codeheadsystems.sessionkey.model;

/**
 * Exactly one of these holds for a session key at any instant.
 */
public enum SessionKeyStatus {
  ACTIVE,
  EXPIRED,
  REVOKED
}
