package com.incidentradar.analytics.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Calendar granularity used to bucket incident dates.
 */
public enum PeriodGranularity {
  YEAR,
  MONTH;

  /**
   * Parses the wire value ({@code year} or {@code month}).
   *
   * @param raw raw parameter value
   * @return matching granularity, empty when unknown
   */
  public static Optional<PeriodGranularity> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "year" -> Optional.of(YEAR);
      case "month" -> Optional.of(MONTH);
      default -> Optional.empty();
    };
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
