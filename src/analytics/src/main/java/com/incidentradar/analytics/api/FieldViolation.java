package com.incidentradar.analytics.api;

/**
 * One rejected request field.
 *
 * @param field wire name of the parameter
 * @param reason client-facing reason
 */
public record FieldViolation(String field, String reason) {

  @Override
  public String toString() {
    return field + ": " + reason;
  }
}
