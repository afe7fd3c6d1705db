package com.incidentradar.analytics.source;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of incident record schemas, tagged by identifier prefix.
 *
 * <p>Each kind carries its table and the rename table from native columns to {@link
 * CanonicalField}s. A canonical field missing from the map has no native counterpart and is read as
 * {@code NULL}. Every source carries a cleaned {@value #PERIOD_DATE_COLUMN} column next to its raw
 * date column.
 */
public enum SourceKind {
  ASN(
      "asn",
      "asn_scraped_accidents",
      columns("uid", "date", "phase", "aircraft_type", "location", "operator", "narrative")),
  ASRS(
      "asrs",
      "asrs_records",
      columns("uid", "time", "phase", "aircraft_type", "place", "operator", "synopsis")),
  PCI(
      "pci",
      "pci_scraped_accidents",
      columns("uid", "date", null, "aircraft_type", "location", "operator", "summary"));

  public static final String PERIOD_DATE_COLUMN = "sanitized_date";

  private final String prefix;
  private final String table;
  private final Map<CanonicalField, String> columnMap;

  SourceKind(String prefix, String table, Map<CanonicalField, String> columnMap) {
    this.prefix = prefix;
    this.table = table;
    this.columnMap = columnMap;
  }

  public String prefix() {
    return prefix;
  }

  public String table() {
    return table;
  }

  /**
   * Canonical-to-native column mapping for this source.
   *
   * @return unmodifiable mapping, without entries for unmapped fields
   */
  public Map<CanonicalField, String> columnMap() {
    return columnMap;
  }

  /**
   * Returns the native column backing a canonical field.
   *
   * @param field canonical field
   * @return native column name, empty when the source does not record the field
   */
  public Optional<String> nativeColumn(CanonicalField field) {
    return Optional.ofNullable(columnMap.get(field));
  }

  public boolean records(CanonicalField field) {
    return columnMap.containsKey(field);
  }

  private static Map<CanonicalField, String> columns(
      String uid,
      String date,
      String phase,
      String aircraftType,
      String location,
      String operator,
      String narrative) {
    Map<CanonicalField, String> map = new EnumMap<>(CanonicalField.class);
    putIfPresent(map, CanonicalField.UID, uid);
    putIfPresent(map, CanonicalField.DATE, date);
    putIfPresent(map, CanonicalField.PHASE, phase);
    putIfPresent(map, CanonicalField.AIRCRAFT_TYPE, aircraftType);
    putIfPresent(map, CanonicalField.LOCATION, location);
    putIfPresent(map, CanonicalField.OPERATOR, operator);
    putIfPresent(map, CanonicalField.NARRATIVE, narrative);
    map.put(CanonicalField.PERIOD_DATE, PERIOD_DATE_COLUMN);
    return Collections.unmodifiableMap(map);
  }

  private static void putIfPresent(Map<CanonicalField, String> map, CanonicalField field, String column) {
    if (column != null) {
      map.put(field, column);
    }
  }
}
