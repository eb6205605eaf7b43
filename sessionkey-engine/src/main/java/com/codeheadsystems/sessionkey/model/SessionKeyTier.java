package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Preset policies for the common automation profiles. Amounts are in 18-decimal token base
 * units.
 */
public enum SessionKeyTier {

  /**
   * Small automated actions.
   */
  MICRO(token(1), token(10), 50, Set.of("transfer", "approve"), false),

  /**
   * Regular bucket operations.
   */
  STANDARD(token(100), token(1_000), 20,
      Set.of("depositAndSplit", "transferBetweenBuckets", "withdraw"), false),

  /**
   * Payroll and other large operations.
   */
  HIGH_VALUE(token(10_000), token(100_000), 5, Set.of("processPayroll", "batchTransfer"), true);

  private final BigInteger maxTransactionAmount;
  private final BigInteger maxDailyAmount;
  private final int maxTransactionCount;
  private final Set<String> allowedMethods;
  private final boolean requireUserConfirmation;

  SessionKeyTier(BigInteger maxTransactionAmount, BigInteger maxDailyAmount, int maxTransactionCount,
                 Set<String> allowedMethods, boolean requireUserConfirmation) {
    this.maxTransactionAmount = maxTransactionAmount;
    this.maxDailyAmount = maxDailyAmount;
    this.maxTransactionCount = maxTransactionCount;
    this.allowedMethods = allowedMethods;
    this.requireUserConfirmation = requireUserConfirmation;
  }

  private static BigInteger token(long whole) {
    return BigInteger.valueOf(whole).multiply(BigInteger.TEN.pow(18));
  }

  /**
   * Builds the policy for this tier. Every preset is swept by emergency revocation.
   *
   * @param createdAt        issue instant
   * @param lifetime         how long the key stays valid
   * @param allowedContracts contracts the key may target
   * @return the session key config
   */
  public SessionKeyConfig toConfig(Instant createdAt, Duration lifetime, Set<String> allowedContracts) {
    return new SessionKeyConfig(
        maxTransactionAmount,
        maxDailyAmount,
        maxTransactionCount,
        createdAt.plus(lifetime),
        createdAt,
        allowedContracts,
        allowedMethods,
        requireUserConfirmation,
        true);
  }

  /**
   * Resolves a tier from its name, case-insensitively.
   *
   * @param name the name
   * @return the session key tier
   * @throws IllegalArgumentException if the name is unknown
   */
  public static SessionKeyTier fromName(String name) {
    for (SessionKeyTier tier : values()) {
      if (tier.name().equalsIgnoreCase(name)) {
        return tier;
      }
    }
    throw new IllegalArgumentException("Unknown session key tier: " + name);
  }

  /**
   * Gets max transaction amount.
   *
   * @return the max transaction amount
   */
  public BigInteger maxTransactionAmount() {
    return maxTransactionAmount;
  }

  /**
   * Gets max daily amount.
   *
   * @return the max daily amount
   */
  public BigInteger maxDailyAmount() {
    return maxDailyAmount;
  }

  /**
   * Gets max transaction count.
   *
   * @return the max transaction count
   */
  public int maxTransactionCount() {
    return maxTransactionCount;
  }

  /**
   * Gets allowed methods.
   *
   * @return the allowed methods
   */
  public Set<String> allowedMethods() {
    return allowedMethods;
  }

  /**
   * Whether keys of this tier need a user confirmation per action.
   *
   * @return the boolean
   */
  public boolean requireUserConfirmation() {
    return requireUserConfirmation;
  }
}
