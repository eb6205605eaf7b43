package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Quota held for an admitted action while it is out with the signer. Counts toward the
 * daily totals until it is settled into a ledger entry or released.
 *
 * @param reservationId unique id of the reservation
 * @param amount        reserved amount
 * @param reservedAt    decision instant
 */
public record QuotaReservation(String reservationId, BigInteger amount, Instant reservedAt) {
}
