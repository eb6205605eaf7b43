package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Result of evaluating a proposed action against a session key. Recomputed on every check and
 * never cached, since both the ledger and the clock move between calls.
 * <p>
 * Credential and scope denials carry zeroed usage figures; quota denials and admissions carry
 * the real usage for the current calendar day, including in-flight reservations.
 *
 * @param dailyAmountUsed           amount consumed today
 * @param transactionCountUsed      actions performed today
 * @param remainingDailyAmount      amount headroom left today, never negative
 * @param remainingTransactionCount action headroom left today, never negative
 * @param canExecuteTransaction     admit/deny
 * @param limitReachedReason        denial reason, null when admitted
 */
public record SessionKeyLimits(
    BigInteger dailyAmountUsed,
    int transactionCountUsed,
    BigInteger remainingDailyAmount,
    int remainingTransactionCount,
    boolean canExecuteTransaction,
    DenialReason limitReachedReason) {

  /**
   * A denial that carries no usage figures.
   *
   * @param reason the reason
   * @return the session key limits
   */
  public static SessionKeyLimits denied(DenialReason reason) {
    return new SessionKeyLimits(BigInteger.ZERO, 0, BigInteger.ZERO, 0, false, reason);
  }

  /**
   * A quota denial with today's usage.
   *
   * @param reason the reason
   * @param used   today's totals
   * @param config the key's policy
   * @return the session key limits
   */
  public static SessionKeyLimits denied(DenialReason reason, DailyTotals used, SessionKeyConfig config) {
    return of(used, config, false, reason);
  }

  /**
   * An admission with today's usage.
   *
   * @param used   today's totals
   * @param config the key's policy
   * @return the session key limits
   */
  public static SessionKeyLimits admitted(DailyTotals used, SessionKeyConfig config) {
    return of(used, config, true, null);
  }

  private static SessionKeyLimits of(DailyTotals used, SessionKeyConfig config,
                                     boolean admitted, DenialReason reason) {
    BigInteger remainingAmount = config.maxDailyAmount().subtract(used.amount()).max(BigInteger.ZERO);
    int remainingCount = Math.max(0, config.maxTransactionCount() - used.count());
    return new SessionKeyLimits(used.amount(), used.count(), remainingAmount, remainingCount,
        admitted, reason);
  }

  /**
   * Denial reason.
   *
   * @return the reason, empty when admitted
   */
  public Optional<DenialReason> denialReason() {
    return Optional.ofNullable(limitReachedReason);
  }
}
