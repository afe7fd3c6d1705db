package com.incidentradar.analytics.api;

import java.util.List;

/**
 * Raised when an identifier prefix does not name a registered record source.
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}. Bulk operations report such identifiers per
 * item instead of throwing.
 */
public class UnknownSourceKindException extends RuntimeException {
  private final String identifier;

  /**
   * Creates the exception for one identifier.
   *
   * @param identifier offending identifier
   * @param knownPrefixes prefixes the registry accepts
   */
  public UnknownSourceKindException(String identifier, List<String> knownPrefixes) {
    super("unsupported identifier prefix for '" + identifier + "', expected one of: "
        + String.join(",", knownPrefixes));
    this.identifier = identifier;
  }

  public String getIdentifier() {
    return identifier;
  }
}
