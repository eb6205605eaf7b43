package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;

/**
 * Amount and action count consumed on one calendar day.
 *
 * @param amount summed amount
 * @param count  number of actions
 */
public record DailyTotals(BigInteger amount, int count) {

  public static final DailyTotals ZERO = new DailyTotals(BigInteger.ZERO, 0);

  /**
   * Tallies ledger entries whose timestamp falls on {@code day} in {@code zone}.
   *
   * @param usage the ledger
   * @param day   the calendar day
   * @param zone  the zone that defines day boundaries
   * @return the daily totals
   */
  public static DailyTotals ofUsage(Collection<SessionKeyUsage> usage, LocalDate day, ZoneId zone) {
    BigInteger amount = BigInteger.ZERO;
    int count = 0;
    for (SessionKeyUsage entry : usage) {
      if (sameDay(entry.timestamp(), day, zone)) {
        amount = amount.add(entry.amount());
        count++;
      }
    }
    return new DailyTotals(amount, count);
  }

  /**
   * Tallies in-flight reservations made on {@code day} in {@code zone}.
   *
   * @param reservations the reservations
   * @param day          the calendar day
   * @param zone         the zone that defines day boundaries
   * @return the daily totals
   */
  public static DailyTotals ofReservations(Collection<QuotaReservation> reservations,
                                           LocalDate day, ZoneId zone) {
    BigInteger amount = BigInteger.ZERO;
    int count = 0;
    for (QuotaReservation reservation : reservations) {
      if (sameDay(reservation.reservedAt(), day, zone)) {
        amount = amount.add(reservation.amount());
        count++;
      }
    }
    return new DailyTotals(amount, count);
  }

  private static boolean sameDay(Instant instant, LocalDate day, ZoneId zone) {
    return LocalDate.ofInstant(instant, zone).equals(day);
  }

  /**
   * Plus.
   *
   * @param other the other
   * @return the sum of both totals
   */
  public DailyTotals plus(DailyTotals other) {
    return new DailyTotals(amount.add(other.amount), count + other.count);
  }
}
