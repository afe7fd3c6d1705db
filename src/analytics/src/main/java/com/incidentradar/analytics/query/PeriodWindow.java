package com.incidentradar.analytics.query;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Half-open date range derived from inclusive month bounds.
 *
 * @param startInclusive first day of the start month, or {@code null} when unbounded
 * @param endExclusive first day after the end month, or {@code null} when unbounded
 */
public record PeriodWindow(LocalDate startInclusive, LocalDate endExclusive) {

  /**
   * Expands inclusive month bounds to a date range covering whole months.
   *
   * @param start start month, nullable
   * @param end end month, nullable
   * @return window, or {@code null} when both bounds are absent
   */
  public static PeriodWindow of(YearMonth start, YearMonth end) {
    if (start == null && end == null) {
      return null;
    }
    return new PeriodWindow(
        start == null ? null : start.atDay(1),
        end == null ? null : end.plusMonths(1).atDay(1));
  }
}
