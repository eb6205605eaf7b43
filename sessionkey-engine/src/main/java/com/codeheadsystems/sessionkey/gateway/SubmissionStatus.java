package com.codeheadsystems.sessionkey.gateway;

/**
 * What the signer knows about a transaction when it returns.
 */
public enum SubmissionStatus {
  SUBMITTED,
  CONFIRMED,
  REVERTED
}
