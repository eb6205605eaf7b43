package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;

/**
 * Counts across every session key a principal holds.
 *
 * @param total             all keys
 * @param active            keys that can still act
 * @param expired           keys past expiry (or deactivated by expiry) and not revoked
 * @param revoked           revoked keys
 * @param totalTransactions ledger entries across all keys
 * @param totalAmount       amount moved across all keys
 */
public record PrincipalSummary(
    int total,
    int active,
    int expired,
    int revoked,
    long totalTransactions,
    BigInteger totalAmount) {
}
