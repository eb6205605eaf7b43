package com.codeheadsystems.sessionkey.store;

import com.codeheadsystems.sessionkey.model.SessionKeyState;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionKeyStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * {@link #update} uses {@link ConcurrentHashMap#computeIfPresent}, which holds the entry's bin
 * lock for the duration of the mutation. All keys and their ledgers are lost on restart.
 */
public class InMemorySessionKeyStore implements SessionKeyStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionKeyStore.class);

  private final ConcurrentHashMap<String, SessionKeyState> store = new ConcurrentHashMap<>();

  @Override
  public void store(SessionKeyState state) {
    store.put(state.id(), state);
    log.debug("Stored session key id={}", state.id());
  }

  @Override
  public Optional<SessionKeyState> load(String id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public List<SessionKeyState> loadAll() {
    return List.copyOf(store.values());
  }

  @Override
  public Optional<SessionKeyState> update(String id, UnaryOperator<SessionKeyState> mutation) {
    return Optional.ofNullable(store.computeIfPresent(id, (key, current) -> mutation.apply(current)));
  }
}
