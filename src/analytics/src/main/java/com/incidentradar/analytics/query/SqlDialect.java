package com.incidentradar.analytics.query;

import java.time.LocalDate;

/**
 * Database-specific fragments used when rendering query plans.
 */
public interface SqlDialect {

  /**
   * Short name used in configuration and logs.
   *
   * @return dialect name
   */
  String name();

  /**
   * Expression truncating a date column to a period label ({@code YYYY} or {@code YYYY-MM}).
   *
   * @param quotedColumn already quoted column reference
   * @param granularity bucket size
   * @return SQL expression yielding text
   */
  String periodBucket(String quotedColumn, PeriodGranularity granularity);

  /**
   * Converts a date bound to the value bound for comparison with date columns.
   *
   * @param date date bound
   * @return JDBC bind value
   */
  Object dateValue(LocalDate date);

  /**
   * Quotes an identifier taken from the fixed source and field tables.
   *
   * @param identifier unquoted identifier
   * @return quoted identifier
   */
  default String quote(String identifier) {
    return '"' + identifier + '"';
  }
}
