package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable policy attached to a session key when it is issued.
 * <p>
 * Amounts are token base units. Contract addresses are normalized to lower case on
 * construction; method identifiers are kept as given and compared exactly.
 *
 * @param maxTransactionAmount    largest amount a single action may move
 * @param maxDailyAmount          largest total the key may move per calendar day
 * @param maxTransactionCount     number of actions the key may perform per calendar day
 * @param expirationTime          instant after which the key can no longer act
 * @param createdAt               issue instant; must be before {@code expirationTime}
 * @param allowedContracts        contracts the key may target
 * @param allowedMethods          method identifiers the key may invoke
 * @param requireUserConfirmation whether every admitted action needs an explicit user approval
 * @param emergencyRevocation     whether the key is swept by a principal-wide emergency revoke
 */
public record SessionKeyConfig(
    BigInteger maxTransactionAmount,
    BigInteger maxDailyAmount,
    int maxTransactionCount,
    Instant expirationTime,
    Instant createdAt,
    Set<String> allowedContracts,
    Set<String> allowedMethods,
    boolean requireUserConfirmation,
    boolean emergencyRevocation) {

  public SessionKeyConfig {
    allowedContracts = allowedContracts == null
        ? Set.of()
        : allowedContracts.stream().map(Addresses::normalize).collect(Collectors.toUnmodifiableSet());
    allowedMethods = allowedMethods == null ? Set.of() : Set.copyOf(allowedMethods);
  }

  /**
   * Allows contract.
   *
   * @param contractAddress the target contract
   * @return true if the contract is on the allow-list
   */
  public boolean allowsContract(String contractAddress) {
    return contractAddress != null
        && !contractAddress.isBlank()
        && allowedContracts.contains(Addresses.normalize(contractAddress));
  }

  /**
   * Allows method.
   *
   * @param methodName the method identifier
   * @return true if the method is on the allow-list
   */
  public boolean allowsMethod(String methodName) {
    return methodName != null && allowedMethods.contains(methodName);
  }

  /**
   * Expiry predicate. A key is expired once {@code now} is strictly after its expiration time.
   *
   * @param now the instant to test
   * @return true if expired at {@code now}
   */
  public boolean expiredAt(Instant now) {
    return now.isAfter(expirationTime);
  }
}
