package com.codeheadsystems.sessionkey.model.api;

import com.codeheadsystems.sessionkey.model.PrincipalSummary;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Totals over a principal's session keys.
 *
 * @param total             all keys
 * @param active            live keys
 * @param expired           expired keys
 * @param revoked           revoked keys
 * @param totalTransactions ledger entries over all keys
 * @param totalAmount       amount over all keys
 */
public record SummaryResponse(@JsonProperty("total") int total,
                              @JsonProperty("active") int active,
                              @JsonProperty("expired") int expired,
                              @JsonProperty("revoked") int revoked,
                              @JsonProperty("totalTransactions") long totalTransactions,
                              @JsonProperty("totalAmount") String totalAmount) {

  public SummaryResponse(PrincipalSummary summary) {
    this(summary.total(), summary.active(), summary.expired(), summary.revoked(), summary.totalTransactions(),
        Amounts.format(summary.totalAmount()));
  }
}
