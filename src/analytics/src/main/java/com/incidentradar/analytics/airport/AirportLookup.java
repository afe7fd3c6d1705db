package com.incidentradar.analytics.airport;

import java.util.Collection;
import java.util.Map;

/**
 * Read-only lookup contract for the static airport reference table.
 */
public interface AirportLookup {
  /**
   * Resolves ICAO or IATA codes.
   *
   * @param codes requested codes, any case
   * @return details keyed by lower-cased requested code; unknown codes are absent
   */
  Map<String, AirportDetails> lookupAirports(Collection<String> codes);
}
