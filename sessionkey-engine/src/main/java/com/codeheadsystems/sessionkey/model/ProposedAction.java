package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An action a caller wants to perform with a session key.
 *
 * @param targetContract contract to call
 * @param methodName     method identifier, matched against the key's allowed methods
 * @param amount         value moved, in token base units; never negative
 * @param payload        encoded call data handed to the signer untouched
 * @param gasLimit       optional gas limit, zero when not supplied
 */
public record ProposedAction(
    String targetContract,
    String methodName,
    BigInteger amount,
    byte[] payload,
    BigInteger gasLimit) {

  public ProposedAction {
    Objects.requireNonNull(targetContract, "targetContract");
    Objects.requireNonNull(methodName, "methodName");
    Objects.requireNonNull(amount, "amount");
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("amount must not be negative");
    }
    payload = payload == null ? new byte[0] : payload.clone();
    gasLimit = gasLimit == null ? BigInteger.ZERO : gasLimit;
  }

  /**
   * Action without payload or gas limit, enough for a limit check.
   *
   * @param targetContract the target contract
   * @param methodName     the method name
   * @param amount         the amount
   * @return the proposed action
   */
  public static ProposedAction of(String targetContract, String methodName, BigInteger amount) {
    return new ProposedAction(targetContract, methodName, amount, null, null);
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }
}
