package com.codeheadsystems.sessionkey.gateway;

import java.util.Objects;

/**
 * Signer's answer for a submitted transaction.
 *
 * @param transactionReference the transaction hash or relay reference
 * @param status               the status
 */
public record SubmissionReceipt(String transactionReference, SubmissionStatus status) {

  public SubmissionReceipt {
    Objects.requireNonNull(transactionReference, "transactionReference");
    status = status == null ? SubmissionStatus.SUBMITTED : status;
  }

  /**
   * A receipt for a transaction that was accepted but not yet confirmed.
   *
   * @param transactionReference the reference
   * @return the receipt
   */
  public static SubmissionReceipt submitted(String transactionReference) {
    return new SubmissionReceipt(transactionReference, SubmissionStatus.SUBMITTED);
  }
}
