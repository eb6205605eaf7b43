package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only rollup of a session key's ledger.
 *
 * @param totalTransactions        number of ledger entries
 * @param totalAmountSpent         sum of all entry amounts
 * @param averageTransactionAmount total divided by count, rounded down; zero for an empty ledger
 * @param lastUsed                 timestamp of the newest entry, null for an empty ledger
 * @param dailyUsage               per-day breakdown, oldest day first
 */
public record UsageStatistics(
    long totalTransactions,
    BigInteger totalAmountSpent,
    BigInteger averageTransactionAmount,
    Instant lastUsed,
    List<DailyUsage> dailyUsage) {

  public UsageStatistics {
    dailyUsage = dailyUsage == null ? List.of() : List.copyOf(dailyUsage);
  }

  /**
   * Last used, if any.
   *
   * @return the optional instant
   */
  public Optional<Instant> lastUsedAt() {
    return Optional.ofNullable(lastUsed);
  }
}
