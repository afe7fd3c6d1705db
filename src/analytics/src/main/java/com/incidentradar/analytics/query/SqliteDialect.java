package com.incidentradar.analytics.query;

import java.time.LocalDate;

/**
 * SQLite dialect; cleaned period dates are ISO-8601 text, so bounds compare as text.
 */
public class SqliteDialect implements SqlDialect {

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public String periodBucket(String quotedColumn, PeriodGranularity granularity) {
    return switch (granularity) {
      case YEAR -> "strftime('%Y', " + quotedColumn + ")";
      case MONTH -> "strftime('%Y-%m', " + quotedColumn + ")";
    };
  }

  @Override
  public Object dateValue(LocalDate date) {
    return date.toString();
  }
}
