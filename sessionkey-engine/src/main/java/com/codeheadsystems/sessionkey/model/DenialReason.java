package com.codeheadsystems.sessionkey.model;

/**
 * Why a session key may not perform an action. Declared in evaluation order: when several
 * conditions are violated at once, the first one listed here is the one reported.
 */
public enum DenialReason {
  NOT_FOUND(Category.CREDENTIAL, "Session key not found"),
  REVOKED(Category.CREDENTIAL, "Session key revoked"),
  INACTIVE(Category.CREDENTIAL, "Session key inactive"),
  EXPIRED(Category.CREDENTIAL, "Session key expired"),
  CONTRACT_NOT_ALLOWED(Category.SCOPE, "Contract not allowed"),
  METHOD_NOT_ALLOWED(Category.SCOPE, "Method not allowed"),
  PER_TRANSACTION_LIMIT_EXCEEDED(Category.QUOTA, "Transaction amount exceeds limit"),
  DAILY_AMOUNT_LIMIT_EXCEEDED(Category.QUOTA, "Daily amount limit exceeded"),
  DAILY_COUNT_LIMIT_EXCEEDED(Category.QUOTA, "Daily transaction count limit exceeded");

  private final Category category;
  private final String message;

  DenialReason(Category category, String message) {
    this.category = category;
    this.message = message;
  }

  /**
   * Gets category.
   *
   * @return the category
   */
  public Category category() {
    return category;
  }

  /**
   * Gets the user-facing message.
   *
   * @return the message
   */
  public String message() {
    return message;
  }

  /**
   * Denial families. Credential denials are never retried, scope denials point at a
   * misconfigured caller, quota denials clear with a larger key or the next calendar day.
   */
  public enum Category {
    CREDENTIAL,
    SCOPE,
    QUOTA
  }
}
