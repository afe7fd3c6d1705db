package com.incidentradar.analytics.airport;

/**
 * Immutable reference view of one airport.
 *
 * @param icaoCode ICAO code as stored
 * @param iataCode IATA code, nullable
 * @param name airport name
 * @param city city served
 * @param country country
 * @param latitude latitude in degrees, nullable
 * @param longitude longitude in degrees, nullable
 */
public record AirportDetails(
    String icaoCode,
    String iataCode,
    String name,
    String city,
    String country,
    Double latitude,
    Double longitude) {

  /**
   * Whether the airport can be placed on a map.
   *
   * @return true when both coordinates are known
   */
  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }
}
