package com.codeheadsystems.sessionkey.store;

import static com.codeheadsystems.sessionkey.testing.SessionKeys.NOW;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.config;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.state;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sessionkey.model.SessionKeyState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * The type In memory session key store test.
 */
class InMemorySessionKeyStoreTest {

  private InMemorySessionKeyStore store;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionKeyStore();
  }

  @Test
  void storeAndLoad_roundTrip() {
    SessionKeyState state = state("sk_1", config(1, 2, 3));
    store.store(state);

    assertThat(store.load("sk_1")).contains(state);
    assertThat(store.loadAll()).containsExactly(state);
  }

  @Test
  void load_notFound_returnsEmpty() {
    assertThat(store.load("nonexistent")).isEmpty();
  }

  @Test
  void update_replacesSnapshot() {
    store.store(state("sk_1", config(1, 2, 3)));

    assertThat(store.update("sk_1", s -> s.revoke(NOW, "r"))).get()
        .extracting(SessionKeyState::revoked).isEqualTo(true);
    assertThat(store.load("sk_1").orElseThrow().revokedReason()).isEqualTo("r");
  }

  @Test
  void update_missing_returnsEmptyWithoutCallingMutation() {
    assertThat(store.update("missing", s -> {
      throw new AssertionError("must not be called");
    })).isEmpty();
  }
}
