package com.codeheadsystems.sessionkey.server.manager;

import com.codeheadsystems.sessionkey.gateway.ExecutionError;
import com.codeheadsystems.sessionkey.gateway.ExecutionGateway;
import com.codeheadsystems.sessionkey.gateway.ExecutionResult;
import com.codeheadsystems.sessionkey.ledger.UsageLedger;
import com.codeheadsystems.sessionkey.lifecycle.LifecycleController;
import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyTier;
import com.codeheadsystems.sessionkey.model.api.Amounts;
import com.codeheadsystems.sessionkey.model.api.CreateSessionKeyRequest;
import com.codeheadsystems.sessionkey.model.api.CreateTierSessionKeyRequest;
import com.codeheadsystems.sessionkey.model.api.ExecuteRequest;
import com.codeheadsystems.sessionkey.model.api.ExecuteResponse;
import com.codeheadsystems.sessionkey.model.api.LimitsResponse;
import com.codeheadsystems.sessionkey.model.api.RevokeRequest;
import com.codeheadsystems.sessionkey.model.api.RevokeResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyCreatedResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyListResponse;
import com.codeheadsystems.sessionkey.model.api.SessionKeyResponse;
import com.codeheadsystems.sessionkey.model.api.StatisticsResponse;
import com.codeheadsystems.sessionkey.model.api.SummaryResponse;
import com.codeheadsystems.sessionkey.registry.SessionKeyExporter;
import com.codeheadsystems.sessionkey.registry.SessionKeyRegistry;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service behind the session key HTTP API.
 * <p>
 * Translates wire DTOs to engine calls and back, and checks that the wallet in the path owns
 * the key it addresses, so that framework adapters stay thin and only map exceptions.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} - bad or missing request data, invalid config: HTTP 400</li>
 *   <li>{@link SessionKeyNotFoundException} - unknown key, or a key of another wallet: HTTP 404</li>
 *   <li>{@link IllegalStateException} or {@link java.io.UncheckedIOException} - backing store unavailable: HTTP 503</li>
 * </ul>
 * Policy denials are not exceptions; they come back inside {@link ExecuteResponse} and
 * {@link LimitsResponse}.
 */
@Singleton
public class SessionKeyServerManager {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyServerManager.class);

  private final SessionKeyRegistry registry;
  private final ExecutionGateway gateway;
  private final LifecycleController lifecycleController;
  private final UsageLedger usageLedger;
  private final SessionKeyExporter exporter;
  private final Clock clock;

  /**
   * Instantiates a new Session key server manager.
   *
   * @param registry            the registry
   * @param gateway             the gateway
   * @param lifecycleController the lifecycle controller
   * @param usageLedger         the usage ledger
   * @param exporter            the exporter
   * @param clock               the clock
   */
  @Inject
  public SessionKeyServerManager(SessionKeyRegistry registry,
                                 ExecutionGateway gateway,
                                 LifecycleController lifecycleController,
                                 UsageLedger usageLedger,
                                 SessionKeyExporter exporter,
                                 Clock clock) {
    this.registry = registry;
    this.gateway = gateway;
    this.lifecycleController = lifecycleController;
    this.usageLedger = usageLedger;
    this.exporter = exporter;
    this.clock = clock;
  }

  /**
   * Issues a session key with an explicit policy.
   *
   * @param principal the wallet
   * @param request   the request
   * @return the created key
   * @throws IllegalArgumentException if the request or resulting config is invalid
   */
  public SessionKeyCreatedResponse create(String principal, CreateSessionKeyRequest request) {
    log.debug("create({})", principal);
    if (request == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    SessionKeyConfig config = new SessionKeyConfig(
        Amounts.parse("maxTransactionAmount", request.maxTransactionAmount()),
        Amounts.parse("maxDailyAmount", request.maxDailyAmount()),
        request.maxTransactionCount(),
        request.expirationTime(),
        clock.instant(),
        request.allowedContracts(),
        request.allowedMethods(),
        request.requireUserConfirmation(),
        request.emergencyRevocation());
    return created(registry.create(principal, config));
  }

  /**
   * Issues a session key from a tier preset.
   *
   * @param principal the wallet
   * @param tierName  MICRO, STANDARD or HIGH_VALUE
   * @param request   the request
   * @return the created key
   */
  public SessionKeyCreatedResponse createForTier(String principal, String tierName,
                                                 CreateTierSessionKeyRequest request) {
    log.debug("createForTier({}, {})", principal, tierName);
    if (request == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    SessionKeyTier tier = SessionKeyTier.fromName(tierName);
    return created(registry.createForTier(principal, tier, Duration.ofSeconds(request.durationSeconds()),
        request.allowedContracts()));
  }

  private SessionKeyCreatedResponse created(String id) {
    SessionKeyState state = registry.require(id);
    return new SessionKeyCreatedResponse(id, state.identity().address(), state.config().expirationTime());
  }

  /**
   * Live keys of a wallet.
   *
   * @param principal the wallet
   * @return the ids
   */
  public SessionKeyListResponse listActive(String principal) {
    return new SessionKeyListResponse(registry.listActive(principal));
  }

  /**
   * One key of a wallet.
   *
   * @param principal the wallet
   * @param id        the key id
   * @return the key
   */
  public SessionKeyResponse get(String principal, String id) {
    return SessionKeyResponse.of(owned(principal, id), clock.instant());
  }

  /**
   * Limits for a proposed action.
   *
   * @param principal      the wallet
   * @param id             the key id
   * @param amount         decimal amount
   * @param targetContract the contract
   * @param methodName     the method
   * @return the limits
   */
  public LimitsResponse limits(String principal, String id, String amount, String targetContract,
                               String methodName) {
    owned(principal, id);
    BigInteger parsed = Amounts.parseOptional("amount", amount);
    return new LimitsResponse(gateway.checkSessionLimits(id, parsed,
        required("targetContract", targetContract), required("methodName", methodName)));
  }

  /**
   * Executes an action.
   *
   * @param principal the wallet
   * @param id        the key id
   * @param request   the request
   * @return the outcome
   */
  public ExecuteResponse execute(String principal, String id, ExecuteRequest request) {
    owned(principal, id);
    if (request == null) {
      throw new IllegalArgumentException("Request body is required");
    }
    ProposedAction action = new ProposedAction(
        required("targetContract", request.targetContract()),
        required("methodName", request.methodName()),
        Amounts.parse("amount", request.amount()),
        decodeHex(request.payloadHex()),
        Amounts.parseOptional("gasLimit", request.gasLimit()));
    ExecutionResult result = gateway.execute(id, action);
    if (result.isSuccess()) {
      return new ExecuteResponse(true, result.receipt().transactionReference(), result.receipt().status().name(),
          null, null, null, null);
    }
    ExecutionError error = result.error();
    return new ExecuteResponse(false, null, null, error.kind().name(),
        error.denialReason() == null ? null : error.denialReason().name(),
        error.message(), new LimitsResponse(error.limits()));
  }

  /**
   * Revokes a key.
   *
   * @param principal the wallet
   * @param id        the key id
   * @param request   the request, may be null
   * @return whether this call revoked it
   */
  public RevokeResponse revoke(String principal, String id, RevokeRequest request) {
    owned(principal, id);
    boolean revoked = lifecycleController.revoke(id, request == null ? null : request.reason());
    return new RevokeResponse(revoked, revoked ? 1 : 0);
  }

  /**
   * Revokes every opted-in live key of a wallet.
   *
   * @param principal the wallet
   * @param request   the request, may be null
   * @return how many were revoked
   */
  public RevokeResponse emergencyRevoke(String principal, RevokeRequest request) {
    String reason = request == null || request.reason() == null ? "Emergency revocation" : request.reason();
    int count = lifecycleController.emergencyRevoke(principal, reason);
    return new RevokeResponse(count > 0, count);
  }

  /**
   * Lifetime statistics of a key.
   *
   * @param principal the wallet
   * @param id        the key id
   * @return the statistics
   */
  public StatisticsResponse statistics(String principal, String id) {
    owned(principal, id);
    return new StatisticsResponse(usageLedger.statistics(id).orElseThrow(() -> new SessionKeyNotFoundException(id)));
  }

  /**
   * Totals over a wallet's keys.
   *
   * @param principal the wallet
   * @return the summary
   */
  public SummaryResponse summary(String principal) {
    return new SummaryResponse(registry.summarize(principal));
  }

  /**
   * Export of a wallet's keys.
   *
   * @param principal the wallet
   * @return the export document
   */
  public SessionKeyExporter.Export export(String principal) {
    return exporter.exportOf(principal);
  }

  private SessionKeyState owned(String principal, String id) {
    SessionKeyState state = registry.require(id);
    if (!state.principal().equals(principal)) {
      // Same answer as a missing key so ids of other wallets cannot be probed.
      log.warn("Principal {} addressed session key {} it does not own", principal, id);
      throw new SessionKeyNotFoundException(id);
    }
    return state;
  }

  private static String required(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    return value;
  }

  private static byte[] decodeHex(String hex) {
    if (hex == null || hex.isBlank()) {
      return new byte[0];
    }
    String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    try {
      return HexFormat.of().parseHex(digits);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid hex in field: payloadHex", e);
    }
  }
}
