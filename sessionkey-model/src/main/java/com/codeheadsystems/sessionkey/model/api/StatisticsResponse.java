package com.codeheadsystems.sessionkey.model.api;

import com.codeheadsystems.sessionkey.model.UsageStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Lifetime usage of a session key.
 *
 * @param totalTransactions        ledger entries
 * @param totalAmountSpent         sum of amounts
 * @param averageTransactionAmount floor of the mean amount
 * @param lastUsed                 latest entry, if any
 * @param dailyUsage               per-day breakdown, oldest first
 */
public record StatisticsResponse(@JsonProperty("totalTransactions") long totalTransactions,
                                 @JsonProperty("totalAmountSpent") String totalAmountSpent,
                                 @JsonProperty("averageTransactionAmount") String averageTransactionAmount,
                                 @JsonProperty("lastUsed") Instant lastUsed,
                                 @JsonProperty("dailyUsage") List<Day> dailyUsage) {

  public StatisticsResponse(UsageStatistics statistics) {
    this(statistics.totalTransactions(), Amounts.format(statistics.totalAmountSpent()),
        Amounts.format(statistics.averageTransactionAmount()), statistics.lastUsed(),
        statistics.dailyUsage().stream()
            .map(d -> new Day(d.date(), d.transactions(), Amounts.format(d.amount())))
            .toList());
  }

  /**
   * One day of usage.
   *
   * @param date         the calendar day
   * @param transactions entries that day
   * @param amount       amount that day
   */
  public record Day(@JsonProperty("date") LocalDate date,
                    @JsonProperty("transactions") int transactions,
                    @JsonProperty("amount") String amount) {
  }
}
