package com.codeheadsystems.sessionkey.gateway;

import com.codeheadsystems.sessionkey.model.ProposedAction;
import com.codeheadsystems.sessionkey.model.SessionIdentity;

/**
 * Signs an admitted action with the session identity and broadcasts it.
 * <p>
 * Implementations may block on network I/O and may retry internally; the gateway never retries.
 */
public interface TransactionSigner {

  /**
   * Signs and submits.
   *
   * @param identity the session identity
   * @param action   the admitted action
   * @return the receipt
   * @throws TransactionSubmissionException if the transaction could not be submitted
   */
  SubmissionReceipt submit(SessionIdentity identity, ProposedAction action)
      throws TransactionSubmissionException;
}
