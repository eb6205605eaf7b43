package com.codeheadsystems.sessionkey.gateway;

/**
 * Raised by a {@link TransactionSigner} that could not sign or submit a transaction.
 */
public class TransactionSubmissionException extends Exception {

  /**
   * Instantiates a new Transaction submission exception.
   *
   * @param message the message
   */
  public TransactionSubmissionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Transaction submission exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TransactionSubmissionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
