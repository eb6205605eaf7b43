package com.codeheadsystems.sessionkey.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time snapshot of a session key: its policy, signing identity, usage ledger,
 * in-flight quota reservations and lifecycle flags.
 * <p>
 * Snapshots are immutable. Every transition returns a new snapshot, and stores swap them
 * atomically per key, so a reader always observes one coherent version of an entry.
 * Once {@code revoked} is set no transition clears it.
 *
 * @param id            opaque session key id
 * @param principal     owning wallet
 * @param identity      ephemeral signing identity
 * @param config        policy fixed at issue time
 * @param usage         append-only ledger, oldest first
 * @param reservations  quota held by actions still with the signer; never persisted
 * @param active        false once expired or revoked
 * @param revoked       terminal revocation flag
 * @param revokedAt     revocation instant, null unless revoked
 * @param revokedReason revocation reason, null unless revoked
 */
public record SessionKeyState(
    String id,
    String principal,
    SessionIdentity identity,
    SessionKeyConfig config,
    List<SessionKeyUsage> usage,
    List<QuotaReservation> reservations,
    boolean active,
    boolean revoked,
    Instant revokedAt,
    String revokedReason) {

  public SessionKeyState {
    usage = usage == null ? List.of() : List.copyOf(usage);
    reservations = reservations == null ? List.of() : List.copyOf(reservations);
  }

  /**
   * Creates the initial snapshot of a freshly issued key: active, not revoked, no usage.
   *
   * @param id        the id
   * @param principal the principal
   * @param identity  the identity
   * @param config    the config
   * @return the session key state
   */
  public static SessionKeyState issue(String id, String principal, SessionIdentity identity,
                                      SessionKeyConfig config) {
    return new SessionKeyState(id, principal, identity, config, List.of(), List.of(),
        true, false, null, null);
  }

  /**
   * With usage appended.
   *
   * @param entry the ledger entry
   * @return the new snapshot
   */
  public SessionKeyState withUsage(SessionKeyUsage entry) {
    List<SessionKeyUsage> appended = new ArrayList<>(usage.size() + 1);
    appended.addAll(usage);
    appended.add(entry);
    return new SessionKeyState(id, principal, identity, config, appended, reservations,
        active, revoked, revokedAt, revokedReason);
  }

  /**
   * With reservation added.
   *
   * @param reservation the reservation
   * @return the new snapshot
   */
  public SessionKeyState withReservation(QuotaReservation reservation) {
    List<QuotaReservation> held = new ArrayList<>(reservations);
    held.add(reservation);
    return new SessionKeyState(id, principal, identity, config, usage, held,
        active, revoked, revokedAt, revokedReason);
  }

  /**
   * Without the given reservation. Unknown ids leave the snapshot unchanged.
   *
   * @param reservationId the reservation id
   * @return the new snapshot
   */
  public SessionKeyState withoutReservation(String reservationId) {
    List<QuotaReservation> held = reservations.stream()
        .filter(r -> !r.reservationId().equals(reservationId))
        .toList();
    if (held.size() == reservations.size()) {
      return this;
    }
    return new SessionKeyState(id, principal, identity, config, usage, held,
        active, revoked, revokedAt, revokedReason);
  }

  /**
   * Revoked snapshot. Callers check {@link #revoked()} first; revocation is not re-applied.
   *
   * @param at     the revocation instant
   * @param reason the reason
   * @return the new snapshot
   */
  public SessionKeyState revoke(Instant at, String reason) {
    return new SessionKeyState(id, principal, identity, config, usage, reservations,
        false, true, at, reason);
  }

  /**
   * Deactivated snapshot, used for expiry. Leaves the revocation fields alone.
   *
   * @return the new snapshot
   */
  public SessionKeyState deactivate() {
    return new SessionKeyState(id, principal, identity, config, usage, reservations,
        false, revoked, revokedAt, revokedReason);
  }

  /**
   * Expired at.
   *
   * @param now the now
   * @return true if the configured expiration time has passed
   */
  public boolean expiredAt(Instant now) {
    return config.expiredAt(now);
  }

  /**
   * Whether the key may still act at {@code now}: active, not revoked and not past expiry.
   *
   * @param now the now
   * @return the boolean
   */
  public boolean liveAt(Instant now) {
    return active && !revoked && !expiredAt(now);
  }

  /**
   * Status at.
   *
   * @param now the now
   * @return the session key status
   */
  public SessionKeyStatus statusAt(Instant now) {
    if (revoked) {
      return SessionKeyStatus.REVOKED;
    }
    if (!active || expiredAt(now)) {
      return SessionKeyStatus.EXPIRED;
    }
    return SessionKeyStatus.ACTIVE;
  }
}
