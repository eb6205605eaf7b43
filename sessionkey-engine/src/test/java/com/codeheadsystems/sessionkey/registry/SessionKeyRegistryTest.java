package com.codeheadsystems.sessionkey.registry;

import static com.codeheadsystems.sessionkey.testing.SessionKeys.CONTRACT;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.IDENTITY;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.METHOD;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.NOW;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.OTHER_CONTRACT;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.PRINCIPAL;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.amount;
import static com.codeheadsystems.sessionkey.testing.SessionKeys.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sessionkey.keys.KeyMaterialProvider;
import com.codeheadsystems.sessionkey.lifecycle.LifecycleController;
import com.codeheadsystems.sessionkey.model.InvalidSessionKeyConfigException;
import com.codeheadsystems.sessionkey.model.PrincipalSummary;
import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyFilter;
import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyTier;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import com.codeheadsystems.sessionkey.store.InMemorySessionKeyStore;
import com.codeheadsystems.sessionkey.testing.MutableClock;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Session key registry test.
 */
@ExtendWith(MockitoExtension.class)
class SessionKeyRegistryTest {

  @Mock
  private KeyMaterialProvider keyMaterialProvider;

  private InMemorySessionKeyStore store;
  private MutableClock clock;
  private LifecycleController lifecycle;
  private SessionKeyRegistry registry;

  @BeforeEach
  void setUp() {
    store = new InMemorySessionKeyStore();
    clock = new MutableClock(NOW);
    lifecycle = new LifecycleController(store, clock);
    registry = new SessionKeyRegistry(store, keyMaterialProvider, lifecycle, clock);
  }

  private static SessionKeyConfig withScope(Set<String> contracts, Set<String> methods) {
    return new SessionKeyConfig(BigInteger.ONE, BigInteger.TEN, 1, NOW.plusSeconds(60), NOW, contracts, methods,
        false, true);
  }

  @Test
  void create_storesActiveKeyWithFreshIdentity() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);

    String id = registry.create(PRINCIPAL, config(100, 250, 3));

    assertThat(id).startsWith(SessionKeyRegistry.ID_PREFIX);
    SessionKeyState state = registry.require(id);
    assertThat(state.active()).isTrue();
    assertThat(state.revoked()).isFalse();
    assertThat(state.usage()).isEmpty();
    assertThat(state.identity()).isEqualTo(IDENTITY);
    assertThat(state.principal()).isEqualTo(PRINCIPAL);
  }

  @Test
  void create_idsAreUnique() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);

    assertThat(registry.create(PRINCIPAL, config(1, 1, 1))).isNotEqualTo(registry.create(PRINCIPAL, config(1, 1, 1)));
  }

  @Test
  void create_emptyContracts_rejectedAndNothingStored() {
    assertThatThrownBy(() -> registry.create(PRINCIPAL, withScope(Set.of(), Set.of(METHOD))))
        .isInstanceOf(InvalidSessionKeyConfigException.class)
        .hasMessageContaining("allowedContracts");
    assertThat(store.loadAll()).isEmpty();
    verify(keyMaterialProvider, never()).generateIdentity();
  }

  @Test
  void create_emptyMethods_rejected() {
    assertThatThrownBy(() -> registry.create(PRINCIPAL, withScope(Set.of(CONTRACT), Set.of())))
        .isInstanceOf(InvalidSessionKeyConfigException.class)
        .hasMessageContaining("allowedMethods");
  }

  @Test
  void create_expirationNotAfterCreation_rejected() {
    SessionKeyConfig config = config(1, 1, 1, NOW, Duration.ZERO);

    assertThatThrownBy(() -> registry.create(PRINCIPAL, config))
        .isInstanceOf(InvalidSessionKeyConfigException.class)
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void create_nonPositiveCount_rejected() {
    assertThatThrownBy(() -> registry.create(PRINCIPAL, config(1, 1, 0)))
        .isInstanceOf(InvalidSessionKeyConfigException.class);
  }

  @Test
  void createForTier_usesPresetLimitsFromNow() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);

    String id = registry.createForTier(PRINCIPAL, SessionKeyTier.STANDARD, Duration.ofHours(8), Set.of(CONTRACT));

    SessionKeyConfig config = registry.require(id).config();
    assertThat(config.createdAt()).isEqualTo(NOW);
    assertThat(config.expirationTime()).isEqualTo(NOW.plus(Duration.ofHours(8)));
    assertThat(config.maxTransactionAmount()).isEqualTo(SessionKeyTier.STANDARD.maxTransactionAmount());
    assertThat(config.allowedMethods()).containsExactlyInAnyOrder("depositAndSplit", "transferBetweenBuckets",
        "withdraw");
  }

  @Test
  void require_missing_throws() {
    assertThatThrownBy(() -> registry.require("sk_missing"))
        .isInstanceOf(SessionKeyNotFoundException.class)
        .hasMessageContaining("sk_missing");
    assertThat(registry.get(null)).isEmpty();
  }

  @Test
  void listActive_excludesRevokedExpiredAndOtherPrincipals() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);
    String live = registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofDays(2)));
    String shortLived = registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofHours(1)));
    String revoked = registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofDays(2)));
    registry.create("0xother", config(1, 1, 1, NOW, Duration.ofDays(2)));
    lifecycle.revoke(revoked, "r");

    assertThat(registry.listActive(PRINCIPAL)).containsExactlyInAnyOrder(live, shortLived);
    clock.advance(Duration.ofHours(2));
    // expiry is evaluated lazily, no sweep needed
    assertThat(registry.listActive(PRINCIPAL)).containsExactly(live);
  }

  @Test
  void find_filtersAndSortsNewestFirst() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);
    String older = registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofDays(2)));
    String newer = registry.create(PRINCIPAL, new SessionKeyConfig(BigInteger.ONE, BigInteger.ONE, 1,
        NOW.plus(Duration.ofDays(2)), NOW.plusSeconds(5), Set.of(OTHER_CONTRACT), Set.of(METHOD), false, true));

    assertThat(registry.find(PRINCIPAL, SessionKeyFilter.all()))
        .extracting(SessionKeyState::id).containsExactly(newer, older);
    assertThat(registry.find(PRINCIPAL, new SessionKeyFilter(false, OTHER_CONTRACT.toUpperCase(), true)))
        .extracting(SessionKeyState::id).containsExactly(newer);
  }

  @Test
  void summarize_countsStatusesAndTotals() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);
    String spender = registry.create(PRINCIPAL, config(100, 250, 3, NOW, Duration.ofDays(2)));
    registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofHours(1)));
    String revoked = registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofDays(2)));
    lifecycle.revoke(revoked, "r");
    Instant at = NOW.plusSeconds(10);
    store.update(spender, s -> s
        .withUsage(new SessionKeyUsage("a", amount(30), at, CONTRACT, METHOD, BigInteger.ZERO))
        .withUsage(new SessionKeyUsage("b", amount(12), at, CONTRACT, METHOD, BigInteger.ZERO)));
    clock.advance(Duration.ofHours(2));

    PrincipalSummary summary = registry.summarize(PRINCIPAL);

    assertThat(summary).isEqualTo(new PrincipalSummary(3, 1, 1, 1, 2, amount(42)));
  }

  @Test
  void cleanupExpired_delegatesToLifecycle() {
    when(keyMaterialProvider.generateIdentity()).thenReturn(IDENTITY);
    registry.create(PRINCIPAL, config(1, 1, 1, NOW, Duration.ofHours(1)));
    clock.advance(Duration.ofHours(2));

    assertThat(registry.cleanupExpired()).isEqualTo(1);
  }
}
