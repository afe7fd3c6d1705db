package com.incidentradar.analytics.source;

import java.util.List;
import java.util.stream.Stream;

/**
 * Source-independent field names every record variant is mapped onto.
 *
 * <p>{@link #DATE} is the incident date as the source stored it, in whatever format. Period
 * filtering and bucketing read {@link #PERIOD_DATE}, the cleaned calendar date, instead.
 */
public enum CanonicalField {
  UID("uid"),
  DATE("date"),
  PHASE("phase"),
  AIRCRAFT_TYPE("aircraft_type"),
  LOCATION("location"),
  OPERATOR("operator"),
  NARRATIVE("narrative"),
  PERIOD_DATE("period_date");

  private static final List<CanonicalField> RECORD_FIELDS = Stream.of(values())
      .filter(field -> field != PERIOD_DATE)
      .toList();

  private final String columnName;

  CanonicalField(String columnName) {
    this.columnName = columnName;
  }

  /**
   * Column alias used for this field once a source row has been renamed.
   *
   * @return canonical column alias
   */
  public String columnName() {
    return columnName;
  }

  /**
   * Fields exposed on a fetched record.
   *
   * @return every field except {@link #PERIOD_DATE}
   */
  public static List<CanonicalField> recordFields() {
    return RECORD_FIELDS;
  }
}
