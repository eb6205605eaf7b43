package com.codeheadsystems.sessionkey.gateway;

import com.codeheadsystems.sessionkey.ledger.UsageLedger;
import com.codeheadsystems.sessionkey.lifecycle.LifecycleController;
import com.codeheadsystems.sessionkey.model.Addresses;
import com.codeheadsystems.sessionkey.model.DenialReason;
import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.QuotaReservation;
import com.codeheadsystems.sessionkey.model.SessionKeyLimits;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import com.codeheadsystems.sessionkey.policy.PolicyEvaluator;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs actions under a session key.
 * <p>
 * The admit decision and the quota reservation happen in one atomic update of the key's store
 * entry, so concurrent callers on the same key can never both pass a limit that only one of
 * them fits in. The signer is called outside that update. Afterwards the reservation is either
 * settled into a single ledger entry or released; a failed, declined or (with
 * {@link QuotaConsumptionPoint#CONFIRMATION}) reverted action consumes no quota.
 * <p>
 * Revocation and expiry are checked again just before signing, after any user confirmation.
 * The call that lazily expires a key reports {@code EXPIRED}; later calls see it as
 * {@code INACTIVE}.
 * <p>
 * Policy outcomes are returned as {@link ExecutionResult} values. Nothing is retried.
 */
@Singleton
public class ExecutionGateway {

  private static final Logger log = LoggerFactory.getLogger(ExecutionGateway.class);

  private final SessionKeyStore store;
  private final PolicyEvaluator policyEvaluator;
  private final UsageLedger usageLedger;
  private final LifecycleController lifecycleController;
  private final TransactionSigner transactionSigner;
  private final UserConfirmation userConfirmation;
  private final QuotaConsumptionPoint quotaConsumptionPoint;
  private final Clock clock;

  /**
   * Instantiates a new Execution gateway.
   *
   * @param store                 the store
   * @param policyEvaluator       the policy evaluator
   * @param usageLedger           the usage ledger
   * @param lifecycleController   the lifecycle controller
   * @param transactionSigner     the transaction signer
   * @param userConfirmation      the user confirmation
   * @param quotaConsumptionPoint the quota consumption point
   * @param clock                 the clock
   */
  @Inject
  public ExecutionGateway(SessionKeyStore store,
                          PolicyEvaluator policyEvaluator,
                          UsageLedger usageLedger,
                          LifecycleController lifecycleController,
                          TransactionSigner transactionSigner,
                          UserConfirmation userConfirmation,
                          QuotaConsumptionPoint quotaConsumptionPoint,
                          Clock clock) {
    this.store = store;
    this.policyEvaluator = policyEvaluator;
    this.usageLedger = usageLedger;
    this.lifecycleController = lifecycleController;
    this.transactionSigner = transactionSigner;
    this.userConfirmation = userConfirmation;
    this.quotaConsumptionPoint = quotaConsumptionPoint;
    this.clock = clock;
  }

  /**
   * Gateway that declines confirmations and consumes quota at submission.
   *
   * @param store               the store
   * @param policyEvaluator     the policy evaluator
   * @param usageLedger         the usage ledger
   * @param lifecycleController the lifecycle controller
   * @param transactionSigner   the transaction signer
   * @param clock               the clock
   */
  public ExecutionGateway(SessionKeyStore store,
                          PolicyEvaluator policyEvaluator,
                          UsageLedger usageLedger,
                          LifecycleController lifecycleController,
                          TransactionSigner transactionSigner,
                          Clock clock) {
    this(store, policyEvaluator, usageLedger, lifecycleController, transactionSigner,
        UserConfirmation.declineAll(), QuotaConsumptionPoint.DEFAULT, clock);
  }

  /**
   * Checks an action against the key's current state without executing it. Applies a due
   * expiry as a side effect.
   *
   * @param id             the session key id
   * @param amount         the amount
   * @param targetContract the target contract
   * @param methodName     the method name
   * @return the limits
   */
  public SessionKeyLimits checkSessionLimits(String id, BigInteger amount, String targetContract,
                                             String methodName) {
    Instant now = clock.instant();
    if (lifecycleController.expireIfDue(id, now)) {
      return SessionKeyLimits.denied(DenialReason.EXPIRED);
    }
    SessionKeyState state = store.load(id).orElse(null);
    return policyEvaluator.evaluate(state, ProposedAction.of(targetContract, methodName, amount), now);
  }

  /**
   * Executes an action.
   *
   * @param id             the session key id
   * @param targetContract the target contract
   * @param methodName     the method name
   * @param amount         the amount
   * @param payload        the call data, may be null
   * @return the execution result
   */
  public ExecutionResult execute(String id, String targetContract, String methodName,
                                 BigInteger amount, byte[] payload) {
    return execute(id, new ProposedAction(targetContract, methodName, amount, payload, null));
  }

  /**
   * Executes an action.
   *
   * @param id     the session key id
   * @param action the action
   * @return the execution result
   */
  public ExecutionResult execute(String id, ProposedAction action) {
    Instant now = clock.instant();
    if (lifecycleController.expireIfDue(id, now)) {
      return ExecutionResult.failure(ExecutionError.policyDenied(SessionKeyLimits.denied(DenialReason.EXPIRED)));
    }

    String reservationId = UUID.randomUUID().toString();
    SessionKeyLimits[] decision = new SessionKeyLimits[1];
    Optional<SessionKeyState> reserved = store.update(id, state -> {
      decision[0] = policyEvaluator.evaluate(state, action, now);
      if (!decision[0].canExecuteTransaction()) {
        return state;
      }
      return state.withReservation(new QuotaReservation(reservationId, action.amount(), now));
    });
    if (reserved.isEmpty()) {
      decision[0] = policyEvaluator.evaluate(null, action, now);
    }
    SessionKeyLimits limits = decision[0];
    if (!limits.canExecuteTransaction()) {
      return ExecutionResult.failure(ExecutionError.policyDenied(limits));
    }

    SessionKeyState state = reserved.get();
    boolean settled = false;
    try {
      if (state.config().requireUserConfirmation() && !userConfirmation.confirm(state, action)) {
        log.info("execute({}): confirmation declined", id);
        return ExecutionResult.failure(ExecutionError.confirmationDeclined(limits));
      }
      // Revocation or expiry may have landed while the user was deciding.
      DenialReason lapsed = credentialLapse(id);
      if (lapsed != null) {
        log.info("execute({}): denied {} before signing", id, lapsed);
        return ExecutionResult.failure(ExecutionError.policyDenied(SessionKeyLimits.denied(lapsed)));
      }
      SubmissionReceipt receipt;
      try {
        receipt = transactionSigner.submit(state.identity(), action);
      } catch (TransactionSubmissionException | RuntimeException e) {
        log.warn("execute({}): submission failed: {}", id, e.getMessage());
        return ExecutionResult.failure(ExecutionError.submissionFailed(limits, e.getMessage(), e));
      }
      if (quotaConsumptionPoint == QuotaConsumptionPoint.CONFIRMATION
          && receipt.status() == SubmissionStatus.REVERTED) {
        log.warn("execute({}): transaction {} reverted", id, receipt.transactionReference());
        return ExecutionResult.failure(ExecutionError.submissionFailed(limits,
            "Transaction reverted: " + receipt.transactionReference(), null));
      }
      SessionKeyUsage usage = new SessionKeyUsage(receipt.transactionReference(), action.amount(), now,
          Addresses.normalize(action.targetContract()), action.methodName(), action.gasLimit());
      usageLedger.settle(id, reservationId, usage);
      settled = true;
      log.debug("execute({}): {} {}", id, receipt.transactionReference(), receipt.status());
      return ExecutionResult.success(
          new ExecutionReceipt(id, receipt.transactionReference(), receipt.status(), usage));
    } finally {
      if (!settled) {
        usageLedger.release(id, reservationId);
      }
    }
  }

  private DenialReason credentialLapse(String id) {
    Instant at = clock.instant();
    if (lifecycleController.expireIfDue(id, at)) {
      return DenialReason.EXPIRED;
    }
    return policyEvaluator.credentialViolation(store.load(id).orElse(null), at);
  }
}
