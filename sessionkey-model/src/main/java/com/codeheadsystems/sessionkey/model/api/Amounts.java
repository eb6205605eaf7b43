package com.codeheadsystems.sessionkey.model.api;

import java.math.BigInteger;

/**
 * Amounts travel as base-10 strings of base units so that no JSON number precision is lost.
 */
public final class Amounts {

  private Amounts() {
  }

  /**
   * Parses a non-negative amount.
   *
   * @param field the field name, used in the error message
   * @param value the decimal string
   * @return the amount
   * @throws IllegalArgumentException if the value is missing, not an integer or negative
   */
  public static BigInteger parse(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
    BigInteger amount;
    try {
      amount = new BigInteger(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(field + " is not an integer amount: " + value, e);
    }
    if (amount.signum() < 0) {
      throw new IllegalArgumentException(field + " must not be negative");
    }
    return amount;
  }

  /**
   * Parses an optional amount, returning zero when absent.
   *
   * @param field the field
   * @param value the value
   * @return the amount
   */
  public static BigInteger parseOptional(String field, String value) {
    return value == null || value.isBlank() ? BigInteger.ZERO : parse(field, value);
  }

  /**
   * Formats an amount.
   *
   * @param amount the amount, may be null
   * @return the decimal string, or null
   */
  public static String format(BigInteger amount) {
    return amount == null ? null : amount.toString();
  }
}
