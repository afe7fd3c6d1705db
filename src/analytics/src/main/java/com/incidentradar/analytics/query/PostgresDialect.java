package com.incidentradar.analytics.query;

import java.time.LocalDate;

/**
 * PostgreSQL dialect; cleaned period dates are {@code DATE} or {@code TIMESTAMP} columns.
 */
public class PostgresDialect implements SqlDialect {

  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public String periodBucket(String quotedColumn, PeriodGranularity granularity) {
    return switch (granularity) {
      case YEAR -> "to_char(" + quotedColumn + ", 'YYYY')";
      case MONTH -> "to_char(" + quotedColumn + ", 'YYYY-MM')";
    };
  }

  @Override
  public Object dateValue(LocalDate date) {
    return date;
  }
}
