package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Set;

/**
 * Request to issue a session key with an explicit policy. The creation instant is the server's.
 *
 * @param maxTransactionAmount    per-transaction cap, decimal base units
 * @param maxDailyAmount          calendar-day cap, decimal base units
 * @param maxTransactionCount     calendar-day transaction cap
 * @param expirationTime          when the key stops working
 * @param allowedContracts        contract addresses the key may call
 * @param allowedMethods          method names the key may call
 * @param requireUserConfirmation whether each action needs owner approval
 * @param emergencyRevocation     whether emergency revocation applies to this key
 */
public record CreateSessionKeyRequest(@JsonProperty("maxTransactionAmount") String maxTransactionAmount,
                                      @JsonProperty("maxDailyAmount") String maxDailyAmount,
                                      @JsonProperty("maxTransactionCount") int maxTransactionCount,
                                      @JsonProperty("expirationTime") Instant expirationTime,
                                      @JsonProperty("allowedContracts") Set<String> allowedContracts,
                                      @JsonProperty("allowedMethods") Set<String> allowedMethods,
                                      @JsonProperty("requireUserConfirmation") boolean requireUserConfirmation,
                                      @JsonProperty("emergencyRevocation") boolean emergencyRevocation) {
}
