package com.codeheadsystems.sessionkey.gateway;

import com.codeheadsystems.sessionkey.model.SessionKeyUsage;

/**
 * Successful execution.
 *
 * @param sessionKeyId         the key that executed
 * @param transactionReference the signer's reference
 * @param status               the signer's status
 * @param usage                the ledger entry recorded for it
 */
public record ExecutionReceipt(String sessionKeyId,
                               String transactionReference,
                               SubmissionStatus status,
                               SessionKeyUsage usage) {
}
