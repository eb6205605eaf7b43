package com.codeheadsystems.sessionkey.registry;

import com.codeheadsystems.sessionkey.keys.KeyMaterialProvider;
import com.codeheadsystems.sessionkey.lifecycle.LifecycleController;
import com.codeheadsystems.sessionkey.model.Addresses;
import com.codeheadsystems.sessionkey.model.InvalidSessionKeyConfigException;
import com.codeheadsystems.sessionkey.model.PrincipalSummary;
import com.codeheadsystems.sessionkey.model.SessionIdentity;
import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyFilter;
import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyStatus;
import com.codeheadsystems.sessionkey.model.SessionKeyTier;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues session keys and answers questions about them.
 * <p>
 * The registry is the only component that creates entries in the {@link SessionKeyStore}.
 * Listings evaluate expiry lazily against the clock, so a key past its expiration time is never
 * reported live even if no sweep has run yet.
 */
@Singleton
public class SessionKeyRegistry {

  /**
   * Prefix of every session key id.
   */
  public static final String ID_PREFIX = "sk_";

  private static final Logger log = LoggerFactory.getLogger(SessionKeyRegistry.class);

  private final SessionKeyStore store;
  private final KeyMaterialProvider keyMaterialProvider;
  private final LifecycleController lifecycleController;
  private final Clock clock;

  /**
   * Instantiates a new Session key registry.
   *
   * @param store               the store
   * @param keyMaterialProvider the key material provider
   * @param lifecycleController the lifecycle controller
   * @param clock               the clock
   */
  @Inject
  public SessionKeyRegistry(SessionKeyStore store,
                            KeyMaterialProvider keyMaterialProvider,
                            LifecycleController lifecycleController,
                            Clock clock) {
    this.store = store;
    this.keyMaterialProvider = keyMaterialProvider;
    this.lifecycleController = lifecycleController;
    this.clock = clock;
  }

  /**
   * Issues a new session key.
   *
   * @param principal the owning wallet
   * @param config    the policy
   * @return the new key's id
   * @throws InvalidSessionKeyConfigException if the config is malformed; nothing is stored
   */
  public String create(String principal, SessionKeyConfig config) {
    validate(principal, config);
    SessionIdentity identity = keyMaterialProvider.generateIdentity();
    String id = ID_PREFIX + UUID.randomUUID();
    store.store(SessionKeyState.issue(id, principal, identity, config));
    log.info("create({}): {} for {} until {}", principal, id, identity.address(), config.expirationTime());
    return id;
  }

  /**
   * Issues a session key from a tier preset, created now.
   *
   * @param principal        the owning wallet
   * @param tier             the tier
   * @param lifetime         how long the key lives
   * @param allowedContracts the contracts it may call
   * @return the new key's id
   */
  public String createForTier(String principal, SessionKeyTier tier, Duration lifetime,
                              Set<String> allowedContracts) {
    if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
      throw new InvalidSessionKeyConfigException("lifetime must be positive");
    }
    return create(principal, tier.toConfig(clock.instant(), lifetime, allowedContracts));
  }

  private void validate(String principal, SessionKeyConfig config) {
    if (principal == null || principal.isBlank()) {
      throw new InvalidSessionKeyConfigException("principal is required");
    }
    if (config == null) {
      throw new InvalidSessionKeyConfigException("config is required");
    }
    if (config.allowedContracts().isEmpty()) {
      throw new InvalidSessionKeyConfigException("allowedContracts must not be empty");
    }
    if (config.allowedMethods().isEmpty()) {
      throw new InvalidSessionKeyConfigException("allowedMethods must not be empty");
    }
    if (config.createdAt() == null || config.expirationTime() == null) {
      throw new InvalidSessionKeyConfigException("createdAt and expirationTime are required");
    }
    if (!config.expirationTime().isAfter(config.createdAt())) {
      throw new InvalidSessionKeyConfigException("expirationTime must be after createdAt");
    }
    if (isNegative(config.maxTransactionAmount()) || isNegative(config.maxDailyAmount())) {
      throw new InvalidSessionKeyConfigException("amount limits must be present and not negative");
    }
    if (config.maxTransactionCount() <= 0) {
      throw new InvalidSessionKeyConfigException("maxTransactionCount must be positive");
    }
  }

  private static boolean isNegative(BigInteger value) {
    return value == null || value.signum() < 0;
  }

  /**
   * Looks up a key.
   *
   * @param id the id
   * @return the snapshot, or empty
   */
  public Optional<SessionKeyState> get(String id) {
    return id == null ? Optional.empty() : store.load(id);
  }

  /**
   * Looks up a key that must exist.
   *
   * @param id the id
   * @return the snapshot
   * @throws SessionKeyNotFoundException if absent
   */
  public SessionKeyState require(String id) {
    return get(id).orElseThrow(() -> new SessionKeyNotFoundException(id));
  }

  /**
   * Ids of the principal's keys that are neither revoked nor expired now.
   *
   * @param principal the principal
   * @return the ids, newest first
   */
  public List<String> listActive(String principal) {
    return find(principal, SessionKeyFilter.live()).stream()
        .map(SessionKeyState::id)
        .toList();
  }

  /**
   * The principal's keys matching a filter, newest first.
   *
   * @param principal the principal
   * @param filter    the filter
   * @return the snapshots
   */
  public List<SessionKeyState> find(String principal, SessionKeyFilter filter) {
    Instant now = clock.instant();
    return store.loadAll().stream()
        .filter(state -> state.principal().equals(principal))
        .filter(state -> !filter.activeOnly() || state.liveAt(now))
        .filter(state -> filter.includeExpired() || state.statusAt(now) != SessionKeyStatus.EXPIRED)
        .filter(state -> filter.contractAddress() == null
            || filter.contractAddress().isBlank()
            || state.config().allowedContracts().contains(Addresses.normalize(filter.contractAddress())))
        .sorted(Comparator.comparing((SessionKeyState s) -> s.config().createdAt()).reversed()
            .thenComparing(SessionKeyState::id))
        .toList();
  }

  /**
   * Counts and totals over all of a principal's keys.
   *
   * @param principal the principal
   * @return the summary
   */
  public PrincipalSummary summarize(String principal) {
    Instant now = clock.instant();
    int total = 0;
    int active = 0;
    int expired = 0;
    int revoked = 0;
    long transactions = 0;
    BigInteger amount = BigInteger.ZERO;
    for (SessionKeyState state : find(principal, SessionKeyFilter.all())) {
      total++;
      SessionKeyStatus status = state.statusAt(now);
      if (status == SessionKeyStatus.ACTIVE) {
        active++;
      } else if (status == SessionKeyStatus.EXPIRED) {
        expired++;
      } else {
        revoked++;
      }
      transactions += state.usage().size();
      for (SessionKeyUsage usage : state.usage()) {
        amount = amount.add(usage.amount());
      }
    }
    return new PrincipalSummary(total, active, expired, revoked, transactions, amount);
  }

  /**
   * Expires every due key.
   *
   * @return the number of keys transitioned
   */
  public int cleanupExpired() {
    return lifecycleController.cleanupExpired();
  }
}
