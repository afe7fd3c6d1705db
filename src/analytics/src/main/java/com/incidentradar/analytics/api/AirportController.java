package com.incidentradar.analytics.api;

import com.incidentradar.analytics.airport.AirportDetails;
import com.incidentradar.analytics.airport.AirportLookup;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing airport reference lookups.
 */
@RestController
@RequestMapping("/api/airports")
public class AirportController {
  private final AirportLookup airportLookup;

  public AirportController(AirportLookup airportLookup) {
    this.airportLookup = airportLookup;
  }

  /**
   * Looks up airports by ICAO or IATA code.
   *
   * @param codes repeatable code parameter, may be absent
   * @return found airports keyed by lower-cased requested code; unknown codes are omitted
   */
  @GetMapping
  public Map<String, AirportDetails> airports(
      @RequestParam(value = "codes", required = false) List<String> codes) {
    if (codes == null || codes.isEmpty()) {
      return Map.of();
    }
    return airportLookup.lookupAirports(codes);
  }
}
