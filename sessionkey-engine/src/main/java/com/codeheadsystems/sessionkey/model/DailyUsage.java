package com.codeheadsystems.sessionkey.model;

import java.math.BigInteger;
import java.time.LocalDate;

/**
 * One row of the per-day usage breakdown.
 *
 * @param date         calendar day
 * @param transactions actions on that day
 * @param amount       amount moved on that day
 */
public record DailyUsage(LocalDate date, int transactions, BigInteger amount) {
}
