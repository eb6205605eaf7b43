package com.codeheadsystems.sessionkey.store;

import com.codeheadsystems.sessionkey.model.SessionKeyState;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage abstraction for session keys.
 * <p>
 * Implementations must be thread-safe, and every entry must be replaced as a whole so that
 * readers never observe a key mid-mutation.
 * <p>
 * <strong>Atomic update contract:</strong> {@link #update(String, UnaryOperator)} applies the
 * mutation under a mutual-exclusion scope keyed by the session key id. Two updates of the same
 * id never interleave; updates of different ids may run in parallel. The quota check-then-reserve
 * sequence of the execution gateway relies on this, so an implementation that reads, mutates and
 * writes back without that scope reintroduces a double-spend race.
 */
public interface SessionKeyStore {

  /**
   * Stores a new session key, or replaces an existing one with the same id.
   *
   * @param state the session key snapshot
   */
  void store(SessionKeyState state);

  /**
   * Loads a session key by id.
   *
   * @param id the session key id
   * @return the snapshot, or empty if the id is unknown
   */
  Optional<SessionKeyState> load(String id);

  /**
   * Loads every stored session key. Each element is a coherent snapshot of its entry.
   *
   * @return the snapshots, in no particular order
   */
  List<SessionKeyState> loadAll();

  /**
   * Atomically replaces the entry for {@code id} with {@code mutation.apply(current)}.
   * <p>
   * The mutation runs while the entry is locked: it must be quick, free of I/O and must not
   * call back into the store. Returning the argument unchanged is allowed and writes nothing.
   *
   * @param id       the session key id
   * @param mutation the transition to apply
   * @return the resulting snapshot, or empty if the id is unknown
   */
  Optional<SessionKeyState> update(String id, UnaryOperator<SessionKeyState> mutation);
}
