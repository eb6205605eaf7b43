package com.codeheadsystems.sessionkey.gateway;

import com.codeheadsystems.sessionkey.model.DenialReason;
import com.codeheadsystems.sessionkey.model.SessionKeyLimits;

/**
 * Failed execution.
 *
 * @param kind         what failed
 * @param denialReason the policy reason, set for {@link Kind#POLICY_DENIED}
 * @param limits       the limits seen by the decision
 * @param message      a human readable message
 * @param cause        the signer failure, set for {@link Kind#SUBMISSION_FAILED} when thrown
 */
public record ExecutionError(Kind kind,
                             DenialReason denialReason,
                             SessionKeyLimits limits,
                             String message,
                             Throwable cause) {

  /**
   * Policy denied.
   *
   * @param limits the limits carrying the reason
   * @return the execution error
   */
  public static ExecutionError policyDenied(SessionKeyLimits limits) {
    DenialReason reason = limits.limitReachedReason();
    return new ExecutionError(Kind.POLICY_DENIED, reason, limits, reason.message(), null);
  }

  /**
   * Confirmation declined.
   *
   * @param limits the limits
   * @return the execution error
   */
  public static ExecutionError confirmationDeclined(SessionKeyLimits limits) {
    return new ExecutionError(Kind.CONFIRMATION_DECLINED, null, limits, "User declined confirmation", null);
  }

  /**
   * Submission failed.
   *
   * @param limits  the limits
   * @param message the message
   * @param cause   the cause, may be null
   * @return the execution error
   */
  public static ExecutionError submissionFailed(SessionKeyLimits limits, String message, Throwable cause) {
    return new ExecutionError(Kind.SUBMISSION_FAILED, null, limits, message, cause);
  }

  /**
   * The kinds of failure.
   */
  public enum Kind {
    POLICY_DENIED,
    CONFIRMATION_DECLINED,
    SUBMISSION_FAILED
  }
}
