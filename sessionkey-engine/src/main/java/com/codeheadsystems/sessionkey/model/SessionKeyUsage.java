package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One entry of the usage ledger: an action that was successfully submitted with a session key.
 * Entries are never edited or removed once appended.
 *
 * @param transactionReference transaction identifier returned by the signer
 * @param amount               amount moved, in token base units
 * @param timestamp            decision instant; determines the calendar day the entry counts against
 * @param contractAddress      normalized target contract
 * @param methodName           invoked method
 * @param gasLimit             gas limit supplied with the action, zero when none was given
 */
public record SessionKeyUsage(
    String transactionReference,
    BigInteger amount,
    Instant timestamp,
    String contractAddress,
    String methodName,
    BigInteger gasLimit) {
}
