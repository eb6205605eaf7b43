package com.codeheadsystems.sessionkey.model;

/**
 * Filter for listing a principal's session keys.
 *
 * @param activeOnly      keep only keys that are active and not revoked
 * @param contractAddress keep only keys allowed to call this contract; null for any
 * @param includeExpired  keep keys whose expiration time has passed
 */
public record SessionKeyFilter(boolean activeOnly, String contractAddress, boolean includeExpired) {

  /**
   * Everything the principal ever held.
   *
   * @return the session key filter
   */
  public static SessionKeyFilter all() {
    return new SessionKeyFilter(false, null, true);
  }

  /**
   * Keys that can still act.
   *
   * @return the session key filter
   */
  public static SessionKeyFilter live() {
    return new SessionKeyFilter(true, null, false);
  }
}
