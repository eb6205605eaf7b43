package com.codeheadsystems.sessionkey.ledger;

import com.codeheadsystems.sessionkey.model.DailyTotals;
import com.codeheadsystems.sessionkey.model.DailyUsage;
import com.codeheadsystems.sessionkey.model.SessionKeyNotFoundException;
import com.codeheadsystems.sessionkey.model.SessionKeyState;
import com.codeheadsystems.sessionkey.model.SessionKeyUsage;
import com.codeheadsystems.sessionkey.model.UsageStatistics;
import com.codeheadsystems.sessionkey.store.SessionKeyStore;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only record of what each session key has spent.
 * <p>
 * Entries are never edited or removed. Daily totals are computed against the calendar day of
 * the configured zone, so the same ledger read with another zone rolls over at another instant.
 */
@Singleton
public class UsageLedger {

  private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

  private final SessionKeyStore store;
  private final ZoneId zone;

  /**
   * Instantiates a new Usage ledger.
   *
   * @param store the store
   * @param zone  zone that defines the calendar day
   */
  @Inject
  public UsageLedger(SessionKeyStore store, ZoneId zone) {
    this.store = store;
    this.zone = zone;
  }

  /**
   * Appends an entry with no reservation attached.
   *
   * @param id    the session key id
   * @param entry the entry
   * @throws SessionKeyNotFoundException if the key does not exist
   */
  public void append(String id, SessionKeyUsage entry) {
    store.update(id, state -> state.withUsage(entry))
        .orElseThrow(() -> new SessionKeyNotFoundException(id));
    log.debug("append({}, {})", id, entry.transactionReference());
  }

  /**
   * Converts a reservation into a ledger entry in one step, so the quota is never counted twice
   * or dropped in between.
   *
   * @param id            the session key id
   * @param reservationId the reservation to settle
   * @param entry         the entry
   * @throws SessionKeyNotFoundException if the key does not exist
   */
  public void settle(String id, String reservationId, SessionKeyUsage entry) {
    store.update(id, state -> state.withoutReservation(reservationId).withUsage(entry))
        .orElseThrow(() -> new SessionKeyNotFoundException(id));
    log.debug("settle({}, {}, {})", id, reservationId, entry.transactionReference());
  }

  /**
   * Drops a reservation without recording usage. Unknown keys or reservations are ignored.
   *
   * @param id            the session key id
   * @param reservationId the reservation id
   */
  public void release(String id, String reservationId) {
    store.update(id, state -> state.withoutReservation(reservationId));
    log.debug("release({}, {})", id, reservationId);
  }

  /**
   * Settled totals for one calendar day; reservations are not included.
   *
   * @param id  the session key id
   * @param day the day
   * @return the daily totals, zero for unknown keys
   */
  public DailyTotals dailyTotals(String id, LocalDate day) {
    return store.load(id)
        .map(state -> DailyTotals.ofUsage(state.usage(), day, zone))
        .orElse(DailyTotals.ZERO);
  }

  /**
   * The ledger entries of a key, oldest first.
   *
   * @param id the session key id
   * @return the entries, empty for unknown keys
   */
  public List<SessionKeyUsage> history(String id) {
    return store.load(id).map(SessionKeyState::usage).orElse(List.of());
  }

  /**
   * Lifetime statistics for a key.
   *
   * @param id the session key id
   * @return the statistics, or empty if the key does not exist
   */
  public Optional<UsageStatistics> statistics(String id) {
    return store.load(id).map(state -> statisticsOf(state.usage()));
  }

  /**
   * Statistics of.
   *
   * @param usage the usage
   * @return the usage statistics
   */
  public UsageStatistics statisticsOf(List<SessionKeyUsage> usage) {
    BigInteger total = BigInteger.ZERO;
    Instant lastUsed = null;
    Map<LocalDate, DailyUsage> perDay = new TreeMap<>();
    for (SessionKeyUsage entry : usage) {
      total = total.add(entry.amount());
      if (lastUsed == null || entry.timestamp().isAfter(lastUsed)) {
        lastUsed = entry.timestamp();
      }
      perDay.merge(dayOf(entry.timestamp()),
          new DailyUsage(dayOf(entry.timestamp()), 1, entry.amount()),
          (a, b) -> new DailyUsage(a.date(), a.transactions() + b.transactions(),
              a.amount().add(b.amount())));
    }
    // BigInteger division truncates; amounts are never negative so this is a floor.
    BigInteger average = usage.isEmpty()
        ? BigInteger.ZERO
        : total.divide(BigInteger.valueOf(usage.size()));
    return new UsageStatistics(usage.size(), total, average, lastUsed, List.copyOf(perDay.values()));
  }

  /**
   * The calendar day an instant falls on.
   *
   * @param instant the instant
   * @return the local date
   */
  public LocalDate dayOf(Instant instant) {
    return LocalDate.ofInstant(instant, zone);
  }

  /**
   * Zone.
   *
   * @return the zone id
   */
  public ZoneId zone() {
    return zone;
  }
}
