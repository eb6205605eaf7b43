package com.codeheadsystems.sessionkey.model.api;

import com.codeheadsystems.sessionkey.model.SessionKeyConfig;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * A session key as the API shows it. The key handle is never included.
 *
 * @param sessionKeyId            the id
 * @param principal               the owning wallet
 * @param address                 the session signing address
 * @param status                  ACTIVE, EXPIRED or REVOKED
 * @param maxTransactionAmount    per-transaction cap
 * @param maxDailyAmount          daily cap
 * @param maxTransactionCount     daily count cap
 * @param createdAt               issue instant
 * @param expirationTime          expiry instant
 * @param allowedContracts        allowed contracts, sorted
 * @param allowedMethods          allowed methods, sorted
 * @param requireUserConfirmation confirmation flag
 * @param emergencyRevocation     emergency revocation flag
 * @param transactionCount        lifetime ledger entries
 * @param revokedAt               revocation instant, if revoked
 * @param revokedReason           revocation reason, if revoked
 */
public record SessionKeyResponse(@JsonProperty("sessionKeyId") String sessionKeyId,
                                 @JsonProperty("principal") String principal,
                                 @JsonProperty("address") String address,
                                 @JsonProperty("status") String status,
                                 @JsonProperty("maxTransactionAmount") String maxTransactionAmount,
                                 @JsonProperty("maxDailyAmount") String maxDailyAmount,
                                 @JsonProperty("maxTransactionCount") int maxTransactionCount,
                                 @JsonProperty("createdAt") Instant createdAt,
                                 @JsonProperty("expirationTime") Instant expirationTime,
                                 @JsonProperty("allowedContracts") Set<String> allowedContracts,
                                 @JsonProperty("allowedMethods") Set<String> allowedMethods,
                                 @JsonProperty("requireUserConfirmation") boolean requireUserConfirmation,
                                 @JsonProperty("emergencyRevocation") boolean emergencyRevocation,
                                 @JsonProperty("transactionCount") int transactionCount,
                                 @JsonProperty("revokedAt") Instant revokedAt,
                                 @JsonProperty("revokedReason") String revokedReason) {

  /**
   * View of a snapshot at an instant.
   *
   * @param state the state
   * @param now   the instant the status is evaluated at
   * @return the response
   */
  public static SessionKeyResponse of(SessionKeyState state, Instant now) {
    SessionKeyConfig config = state.config();
    return new SessionKeyResponse(state.id(), state.principal(), state.identity().address(),
        state.statusAt(now).name(),
        Amounts.format(config.maxTransactionAmount()), Amounts.format(config.maxDailyAmount()),
        config.maxTransactionCount(), config.createdAt(), config.expirationTime(),
        new TreeSet<>(config.allowedContracts()), new TreeSet<>(config.allowedMethods()),
        config.requireUserConfirmation(), config.emergencyRevocation(), state.usage().size(),
        state.revokedAt(), state.revokedReason());
  }
}
