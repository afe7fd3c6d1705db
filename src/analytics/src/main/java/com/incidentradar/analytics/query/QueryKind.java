package com.incidentradar.analytics.query;

import java.util.Locale;

/**
 * Result shapes the plan builder knows how to produce.
 */
public enum QueryKind {
  OVER_TIME,
  TOP_N,
  HEATMAP,
  HIERARCHY,
  STATISTICS,
  GEOLOCATION,
  /** Matching identifiers, newest first. */
  IDENTIFIERS;

  /**
   * Metric tag value, for example {@code top_n}.
   *
   * @return lower-case kind name
   */
  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
