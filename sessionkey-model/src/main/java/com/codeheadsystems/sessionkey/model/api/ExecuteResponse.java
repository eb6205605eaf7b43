package com.codeheadsystems.sessionkey.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an execution. On success {@code transactionReference} is set; on failure
 * {@code errorKind} is, and {@code denialReason} too when policy refused the action.
 *
 * @param success              whether the action was submitted
 * @param transactionReference the signer's reference
 * @param status               the signer's status
 * @param errorKind            POLICY_DENIED, CONFIRMATION_DECLINED or SUBMISSION_FAILED
 * @param denialReason         the policy reason
 * @param message              a human readable message
 * @param limits               the limits seen by the decision
 */
public record ExecuteResponse(@JsonProperty("success") boolean success,
                              @JsonProperty("transactionReference") String transactionReference,
                              @JsonProperty("status") String status,
                              @JsonProperty("errorKind") String errorKind,
                              @JsonProperty("denialReason") String denialReason,
                              @JsonProperty("message") String message,
                              @JsonProperty("limits") LimitsResponse limits) {
}
