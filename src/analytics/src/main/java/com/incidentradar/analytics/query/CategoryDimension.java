package com.incidentradar.analytics.query;

import com.incidentradar.analytics.source.CanonicalField;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Canonical fields that can be counted by, filtered on and cross-tabulated.
 */
public enum CategoryDimension {
  OPERATOR(CanonicalField.OPERATOR),
  PHASE(CanonicalField.PHASE),
  AIRCRAFT_TYPE(CanonicalField.AIRCRAFT_TYPE),
  LOCATION(CanonicalField.LOCATION);

  private final CanonicalField field;

  CategoryDimension(CanonicalField field) {
    this.field = field;
  }

  public CanonicalField field() {
    return field;
  }

  public String wireValue() {
    return field.columnName();
  }

  /**
   * Parses a wire value such as {@code aircraft_type}.
   *
   * @param raw raw parameter value
   * @return matching dimension, empty when unknown
   */
  public static Optional<CategoryDimension> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String value = raw.trim();
    return Arrays.stream(values()).filter(d -> d.wireValue().equals(value)).findFirst();
  }

  /**
   * Comma-separated list of accepted wire values, for error messages.
   *
   * @return accepted values
   */
  public static String allowedValues() {
    return Arrays.stream(values()).map(CategoryDimension::wireValue).collect(Collectors.joining(","));
  }
}
