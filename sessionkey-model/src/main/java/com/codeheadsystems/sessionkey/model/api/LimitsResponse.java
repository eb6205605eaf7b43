package com.codeheadsystems.sessionkey.model.api;

import com.codeheadsystems.sessionkey.model.DenialReason;
import com.codeheadsystems.sessionkey.model.SessionKeyLimits;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current usage and headroom of a session key for a proposed action.
 *
 * @param dailyAmountUsed           today's spent and reserved amount
 * @param transactionCountUsed      today's transactions
 * @param remainingDailyAmount      amount headroom
 * @param remainingTransactionCount count headroom
 * @param canExecuteTransaction     whether the action would be admitted
 * @param limitReachedReason        denial reason name, if denied
 * @param message                   denial message, if denied
 */
public record LimitsResponse(@JsonProperty("dailyAmountUsed") String dailyAmountUsed,
                             @JsonProperty("transactionCountUsed") int transactionCountUsed,
                             @JsonProperty("remainingDailyAmount") String remainingDailyAmount,
                             @JsonProperty("remainingTransactionCount") int remainingTransactionCount,
                             @JsonProperty("canExecuteTransaction") boolean canExecuteTransaction,
                             @JsonProperty("limitReachedReason") String limitReachedReason,
                             @JsonProperty("message") String message) {

  public LimitsResponse(SessionKeyLimits limits) {
    this(Amounts.format(limits.dailyAmountUsed()), limits.transactionCountUsed(),
        Amounts.format(limits.remainingDailyAmount()), limits.remainingTransactionCount(),
        limits.canExecuteTransaction(),
        limits.denialReason().map(DenialReason::name).orElse(null),
        limits.denialReason().map(DenialReason::message).orElse(null));
  }
}
