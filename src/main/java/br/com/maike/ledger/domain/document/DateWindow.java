package br.com.maike.ledger.domain.document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open historical window {@code [from, to)} used by backfill enumeration.
 *
 * @param from first day included
 * @param to first day excluded
 * @since 0.1.0
 */
public record DateWindow(LocalDate from, LocalDate to) {

  public DateWindow {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (!from.isBefore(to)) {
      throw new IllegalArgumentException("window start " + from + " must be before end " + to);
    }
  }

  /**
   * Creates the window covering one calendar year.
   *
   * @param year calendar year
   * @return window from January 1st of {@code year} to January 1st of the next year
   */
  public static DateWindow ofYear(int year) {
    LocalDate start = LocalDate.of(year, 1, 1);
    return new DateWindow(start, start.plusYears(1));
  }

  /**
   * Returns the inclusive lower bound as a timestamp.
   *
   * @return start of {@code from}
   */
  public LocalDateTime startInclusive() {
    return from.atStartOfDay();
  }

  /**
   * Returns the exclusive upper bound as a timestamp.
   *
   * @return start of {@code to}
   */
  public LocalDateTime endExclusive() {
    return to.atStartOfDay();
  }

  /**
   * Returns the calendar year when the window covers exactly one year.
   *
   * @return year, or {@code -1} for arbitrary windows
   */
  public int singleYear() {
    if (from.getDayOfYear() == 1 && from.plusYears(1).equals(to)) {
      return from.getYear();
    }
    return -1;
  }

  @Override
  public String toString() {
    int year = singleYear();
    return year > 0 ? Integer.toString(year) : from + ".." + to;
  }
}
