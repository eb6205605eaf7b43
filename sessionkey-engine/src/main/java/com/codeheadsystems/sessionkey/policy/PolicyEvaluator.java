package com.codeheadsystems.sessionkey.policy;

import com.codeheadsystems.sessionkey.model.DailyTotals;
import com.codeheadsystems.sessionkey.model.DenialReason;
import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyLimits;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a proposed action fits within a session key's policy.
 * <p>
 * The evaluator is a pure function of the snapshot, the action and the instant: it never
 * mutates state and never reads a clock. Checks run in a fixed order and the first failing one
 * is reported:
 * <ol>
 *   <li>credential: not found, revoked, inactive, expired</li>
 *   <li>scope: contract, then method</li>
 *   <li>quota: per-transaction amount, daily amount, daily count</li>
 * </ol>
 * Daily usage counts settled ledger entries plus reservations held by in-flight actions.
 */
@Singleton
public class PolicyEvaluator {

  private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

  private final ZoneId zone;

  /**
   * Instantiates a new Policy evaluator.
   *
   * @param zone zone that defines the calendar day
   */
  @Inject
  public PolicyEvaluator(ZoneId zone) {
    this.zone = zone;
  }

  /**
   * Evaluates an action.
   *
   * @param state  the snapshot, or null if the key does not exist
   * @param action the proposed action
   * @param now    the decision instant
   * @return the limits, with {@code canExecuteTransaction} set when admitted
   */
  public SessionKeyLimits evaluate(SessionKeyState state, ProposedAction action, Instant now) {
    if (state == null) {
      log.info("evaluate: denied NOT_FOUND");
      return SessionKeyLimits.denied(DenialReason.NOT_FOUND);
    }
    SessionKeyConfig config = state.config();
    DailyTotals used = dailyUsage(state, now);
    DenialReason reason = firstViolation(state, action, now, used);
    if (reason == null) {
      log.debug("evaluate({}): admitted {} {}", state.id(), action.methodName(), action.amount());
      return SessionKeyLimits.admitted(used, config);
    }
    if (reason.category() == DenialReason.Category.SCOPE) {
      log.warn("evaluate({}): denied {} for {}.{}", state.id(), reason,
          action.targetContract(), action.methodName());
    } else {
      log.info("evaluate({}): denied {}", state.id(), reason);
    }
    if (reason.category() == DenialReason.Category.CREDENTIAL) {
      return SessionKeyLimits.denied(reason);
    }
    return SessionKeyLimits.denied(reason, used, config);
  }

  private DenialReason firstViolation(SessionKeyState state, ProposedAction action,
                                      Instant now, DailyTotals used) {
    DenialReason credential = credentialViolation(state, now);
    if (credential != null) {
      return credential;
    }
    SessionKeyConfig config = state.config();
    if (!config.allowsContract(action.targetContract())) {
      return DenialReason.CONTRACT_NOT_ALLOWED;
    }
    if (!config.allowsMethod(action.methodName())) {
      return DenialReason.METHOD_NOT_ALLOWED;
    }
    if (action.amount().compareTo(config.maxTransactionAmount()) > 0) {
      return DenialReason.PER_TRANSACTION_LIMIT_EXCEEDED;
    }
    if (used.amount().add(action.amount()).compareTo(config.maxDailyAmount()) > 0) {
      return DenialReason.DAILY_AMOUNT_LIMIT_EXCEEDED;
    }
    if (used.count() >= config.maxTransactionCount()) {
      return DenialReason.DAILY_COUNT_LIMIT_EXCEEDED;
    }
    return null;
  }

  /**
   * The credential checks alone: revoked, then inactive, then expired.
   *
   * @param state the snapshot, or null if the key does not exist
   * @param now   the decision instant
   * @return the first failing credential check, or null if the key may act
   */
  public DenialReason credentialViolation(SessionKeyState state, Instant now) {
    if (state == null) {
      return DenialReason.NOT_FOUND;
    }
    if (state.revoked()) {
      return DenialReason.REVOKED;
    }
    if (!state.active()) {
      return DenialReason.INACTIVE;
    }
    if (state.config().expiredAt(now)) {
      return DenialReason.EXPIRED;
    }
    return null;
  }

  /**
   * Usage charged against today's quota: ledger entries plus held reservations.
   *
   * @param state the snapshot
   * @param now   the decision instant
   * @return the daily totals
   */
  public DailyTotals dailyUsage(SessionKeyState state, Instant now) {
    LocalDate today = LocalDate.ofInstant(now, zone);
    return DailyTotals.ofUsage(state.usage(), today, zone)
        .plus(DailyTotals.ofReservations(state.reservations(), today, zone));
  }
}
