package com.codeheadsystems.sessionkey.gateway;

import java.util.Optional;

/**
 * Outcome of {@link ExecutionGateway#execute}: exactly one of receipt and error is set.
 *
 * @param receipt the receipt on success
 * @param error   the error on failure
 */
public record ExecutionResult(ExecutionReceipt receipt, ExecutionError error) {

  public ExecutionResult {
    if ((receipt == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of receipt and error must be set");
    }
  }

  /**
   * Success execution result.
   *
   * @param receipt the receipt
   * @return the execution result
   */
  public static ExecutionResult success(ExecutionReceipt receipt) {
    return new ExecutionResult(receipt, null);
  }

  /**
   * Failure execution result.
   *
   * @param error the error
   * @return the execution result
   */
  public static ExecutionResult failure(ExecutionError error) {
    return new ExecutionResult(null, error);
  }

  /**
   * Is success boolean.
   *
   * @return the boolean
   */
  public boolean isSuccess() {
    return receipt != null;
  }

  /**
   * Receipt, if successful.
   *
   * @return the optional
   */
  public Optional<ExecutionReceipt> receiptIfPresent() {
    return Optional.ofNullable(receipt);
  }

  /**
   * Error, if failed.
   *
   * @return the optional
   */
  public Optional<ExecutionError> errorIfPresent() {
    return Optional.ofNullable(error);
  }
}
