package com.codeheadsystems.sessionkey.store;

import com.codeheadsystems.sessionkey.model.SessionIdentity;
import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import java.time.Instant;
import java.util.List;

/**
 * On-disk form of a session key. In-flight reservations are deliberately absent: after a
 * restart only settled ledger entries count.
 *
 * @param id            the id
 * @param principal     the principal
 * @param identity      the identity (address, public key and custody handle only)
 * @param config        the config
 * @param usage         the ledger
 * @param active        the active flag
 * @param revoked       the revoked flag
 * @param revokedAt     the revocation instant
 * @param revokedReason the revocation reason
 */
record PersistedSessionKey(
    String id,
    String principal,
    SessionIdentity identity,
    SessionKeyConfig config,
    List<SessionKeyUsage> usage,
    boolean active,
    boolean revoked,
    Instant revokedAt,
    String revokedReason) {

  static PersistedSessionKey from(SessionKeyState state) {
    return new PersistedSessionKey(state.id(), state.principal(), state.identity(), state.config(),
        state.usage(), state.active(), state.revoked(), state.revokedAt(), state.revokedReason());
  }

  SessionKeyState toState() {
    return new SessionKeyState(id, principal, identity, config, usage, List.of(),
        active, revoked, revokedAt, revokedReason);
  }

  /**
   * Top-level document.
   *
   * @param version format version
   * @param keys    the keys
   */
  record Document(int version, List<PersistedSessionKey> keys) {
  }
}
