package com.codeheadsystems.sessionkey.gateway;

/**
 * When an admitted action's quota becomes a ledger entry.
 */
public enum QuotaConsumptionPoint {
  /**
   * Consumed once the signer accepts the transaction, even if it later reverts.
   */
  SUBMISSION,
  /**
   * Consumed only if the signer does not report the transaction as reverted.
   */
  CONFIRMATION;

  /**
   * The default consumption point.
   */
  public static final QuotaConsumptionPoint DEFAULT = SUBMISSION;
}
