package com.codeheadsystems.sessionkey.lifecycle;

import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the state transitions of a session key: active to expired, and anything to revoked.
 * <p>
 * Both transitions are terminal. Revocation is idempotent: the first reason and instant win and
 * later calls report {@code false}. Every transition goes through the store's per-key atomic
 * update, so it never interleaves with a concurrent quota reservation on the same key.
 */
@Singleton
public class LifecycleController {

  /**
   * Reason recorded when the caller supplies none.
   */
  public static final String DEFAULT_REVOKE_REASON = "User revoked";

  private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

  private final SessionKeyStore store;
  private final Clock clock;

  /**
   * Instantiates a new Lifecycle controller.
   *
   * @param store the store
   * @param clock the clock
   */
  @Inject
  public LifecycleController(SessionKeyStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * Whether the key's expiration time has passed.
   *
   * @param state the state
   * @param now   the now
   * @return true if expired
   */
  public static boolean isExpired(SessionKeyState state, Instant now) {
    return state.expiredAt(now);
  }

  /**
   * Revokes a key.
   *
   * @param id     the session key id
   * @param reason the reason, defaulted when null or blank
   * @return true if this call revoked the key; false if it was already revoked or is unknown
   */
  public boolean revoke(String id, String reason) {
    String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_REVOKE_REASON : reason;
    Instant now = clock.instant();
    boolean[] transitioned = {false};
    store.update(id, state -> {
      if (state.revoked()) {
        return state;
      }
      transitioned[0] = true;
      return state.revoke(now, effectiveReason);
    });
    if (transitioned[0]) {
      log.info("revoke({}): {}", id, effectiveReason);
    } else {
      log.debug("revoke({}): no-op", id);
    }
    return transitioned[0];
  }

  /**
   * Deactivates a key whose expiration time has passed. Revocation fields are left alone.
   *
   * @param id  the session key id
   * @param now the now
   * @return true if this call deactivated the key
   */
  public boolean expireIfDue(String id, Instant now) {
    boolean[] transitioned = {false};
    store.update(id, state -> {
      if (!state.active() || state.revoked() || !state.expiredAt(now)) {
        return state;
      }
      transitioned[0] = true;
      return state.deactivate();
    });
    if (transitioned[0]) {
      log.info("expireIfDue({}): expired", id);
    }
    return transitioned[0];
  }

  /**
   * Expires every due key.
   *
   * @param now the now
   * @return the number of keys transitioned by this pass
   */
  public int cleanupExpired(Instant now) {
    int count = 0;
    for (SessionKeyState state : store.loadAll()) {
      if (state.active() && !state.revoked() && state.expiredAt(now) && expireIfDue(state.id(), now)) {
        count++;
      }
    }
    if (count > 0) {
      log.info("cleanupExpired: {} session key(s) expired", count);
    }
    return count;
  }

  /**
   * Expires every due key as of the clock's current instant.
   *
   * @return the number of keys transitioned
   */
  public int cleanupExpired() {
    return cleanupExpired(clock.instant());
  }

  /**
   * Revokes every live key of a principal that opted into emergency revocation.
   *
   * @param principal the principal
   * @param reason    the reason
   * @return the number of keys revoked
   */
  public int emergencyRevoke(String principal, String reason) {
    Objects.requireNonNull(principal, "principal");
    Instant now = clock.instant();
    int count = 0;
    for (SessionKeyState state : store.loadAll()) {
      if (principal.equals(state.principal())
          && state.config().emergencyRevocation()
          && state.liveAt(now)
          && revoke(state.id(), reason)) {
        count++;
      }
    }
    log.warn("emergencyRevoke({}): {} session key(s) revoked", principal, count);
    return count;
  }
}
