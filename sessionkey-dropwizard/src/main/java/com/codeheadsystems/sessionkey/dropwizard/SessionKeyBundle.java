package com.codeheadsystems.sessionkey.dropwizard;

import com.codeheadsystems.sessionkey.client.accessor.RelayAccessor;
import com.codeheadsystems.sessionkey.client.config.RelayClientConfig;
import com.codeheadsystems.sessionkey.client.signer.RelayTransactionSigner;
import com.codeheadsystems.sessionkey.dropwizard.health.SessionKeyStoreHealthCheck;
import com.codeheadsystems.sessionkey.dropwizard.lifecycle.ManagedExpiredKeySweeper;
import com.codeheadsystems.sessionkey.gateway.ExecutionGateway;
import com.codeheadsystems.sessionkey.gateway.TransactionSigner;
import com.codeheadsystems.sessionkey.gateway.UserConfirmation;
import com.codeheadsystems.sessionkey.keys.Secp256k1KeyMaterialProvider;
import com.codeheadsystems.sessionkey.ledger.UsageLedger;
import com.codeheadsystems.sessionkey.lifecycle.ExpiredKeySweeper;
import com.codeheadsystems.sessionkey.lifecycle.LifecycleController;
import com.codeheadsystems.sessionkey.policy.PolicyEvaluator;
import com.codeheadsystems.sessionkey.registry.SessionKeyExporter;
import com.codeheadsystems.sessionkey.registry.SessionKeyRegistry;
import com.codeheadsystems.sessionkey.server.manager.SessionKeyServerManager;
import com.codeheadsystems.sessionkey.server.resource.SessionKeyResource;
import com.codeheadsystems.sessionkey.store.InMemorySessionKeyStore;
import com.codeheadsystems.sessionkey.store.JsonFileSessionKeyStore;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the session key service into an existing Dropwizard application.
 * <p>
 * Registers the session key JAX-RS resource, a health check and the managed expiry sweeper.
 * Requires a {@link SessionKeyConfiguration} block in the application's YAML config.
 * <p>
 * Embed with the store and relay taken from the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new SessionKeyBundle<>());
 * }</pre>
 * <p>
 * Or supply your own collaborators; a null store or signer falls back to the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new SessionKeyBundle<>(myStore, keyMaterial, mySigner, myConfirmation));
 * }</pre>
 * Authenticating the wallet in the request path is left to the application.
 */
@Singleton
public class SessionKeyBundle<C extends SessionKeyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyBundle.class);

  private final SessionKeyStore store;
  private final Secp256k1KeyMaterialProvider keyMaterial;
  private final TransactionSigner transactionSigner;
  private final UserConfirmation userConfirmation;

  /**
   * Creates a bundle that takes its store and relay from the configuration. Private keys stay
   * in process memory.
   */
  public SessionKeyBundle() {
    this(null, new Secp256k1KeyMaterialProvider(), null, UserConfirmation.declineAll());
  }

  /**
   * Creates a bundle with the supplied collaborators.
   *
   * @param store             the store, or null to build one from {@code storeFile}
   * @param keyMaterial       generates session identities and holds their private keys
   * @param transactionSigner the signer, or null to post to {@code relayEndpoint}
   * @param userConfirmation  asked before signing for keys that require confirmation
   */
  @Inject
  public SessionKeyBundle(SessionKeyStore store,
                          Secp256k1KeyMaterialProvider keyMaterial,
                          TransactionSigner transactionSigner,
                          UserConfirmation userConfirmation) {
    this.store = store;
    this.keyMaterial = keyMaterial;
    this.transactionSigner = transactionSigner;
    this.userConfirmation = userConfirmation;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Clock clock = Clock.systemUTC();
    ZoneId zone = ZoneId.of(configuration.getDayBoundaryZone());
    SessionKeyStore sessionKeyStore = store != null ? store : buildStore(configuration);
    TransactionSigner signer = transactionSigner != null
        ? transactionSigner
        : buildRelaySigner(configuration, environment);

    LifecycleController lifecycleController = new LifecycleController(sessionKeyStore, clock);
    UsageLedger usageLedger = new UsageLedger(sessionKeyStore, zone);
    SessionKeyRegistry registry = new SessionKeyRegistry(sessionKeyStore, keyMaterial, lifecycleController, clock);
    ExecutionGateway gateway = new ExecutionGateway(sessionKeyStore, new PolicyEvaluator(zone), usageLedger,
        lifecycleController, signer, userConfirmation, configuration.getQuotaConsumptionPoint(), clock);
    SessionKeyExporter exporter = new SessionKeyExporter(registry, environment.getObjectMapper(), clock);

    SessionKeyServerManager manager =
        new SessionKeyServerManager(registry, gateway, lifecycleController, usageLedger, exporter, clock);
    environment.jersey().register(new SessionKeyResource(manager));

    ExpiredKeySweeper sweeper = new ExpiredKeySweeper(lifecycleController,
        Duration.ofSeconds(configuration.getCleanupIntervalSeconds()));
    environment.lifecycle().manage(new ManagedExpiredKeySweeper(sweeper));
    environment.healthChecks().register("session-key-store", new SessionKeyStoreHealthCheck(sessionKeyStore, sweeper));

    log.info("Session keys: day boundary {}, quota consumed at {}, sweep every {}s",
        zone, configuration.getQuotaConsumptionPoint(), configuration.getCleanupIntervalSeconds());
  }

  private SessionKeyStore buildStore(C configuration) {
    String storeFile = configuration.getStoreFile();
    if (storeFile == null || storeFile.isEmpty()) {
      log.warn("""
          #################################################################
          # WARNING: No storeFile configured. Session keys, ledgers and   #
          # revocations live in memory and will be lost on restart.       #
          #################################################################
          """);
      return new InMemorySessionKeyStore();
    }
    return new JsonFileSessionKeyStore(Path.of(storeFile));
  }

  private TransactionSigner buildRelaySigner(C configuration, Environment environment) {
    String endpoint = configuration.getRelayEndpoint();
    if (endpoint == null || endpoint.isEmpty()) {
      throw new IllegalStateException(
          "relayEndpoint must be configured, or a TransactionSigner supplied to the SessionKeyBundle constructor.");
    }
    RelayClientConfig relayConfig = new RelayClientConfig(URI.create(endpoint),
        Duration.ofSeconds(configuration.getRelayTimeoutSeconds()));
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(relayConfig.timeout())
        .build();
    RelayAccessor accessor = new RelayAccessor(relayConfig, httpClient, environment.getObjectMapper());
    return new RelayTransactionSigner(keyMaterial, accessor);
  }
}
