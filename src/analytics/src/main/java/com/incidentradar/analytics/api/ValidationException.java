package com.incidentradar.analytics.api;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Request validation failure carrying every field-level violation found.
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}. Thrown before any query executes.
 */
public class ValidationException extends RuntimeException {
  private final List<FieldViolation> violations;

  /**
   * Creates a validation exception for a single field.
   *
   * @param field offending parameter
   * @param reason client-facing reason
   */
  public ValidationException(String field, String reason) {
    this(List.of(new FieldViolation(field, reason)));
  }

  /**
   * Creates a validation exception from collected violations.
   *
   * @param violations non-empty list of violations
   */
  public ValidationException(List<FieldViolation> violations) {
    super(violations.stream().map(FieldViolation::toString).collect(Collectors.joining("; ")));
    this.violations = List.copyOf(violations);
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }
}
