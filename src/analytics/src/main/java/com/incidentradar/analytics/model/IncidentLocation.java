package com.incidentradar.analytics.model;

import java.time.LocalDate;

/**
 * One incident placed on the map through its airport code.
 *
 * @param uid incident identifier
 * @param date incident date
 * @param location location code as recorded
 * @param operator operator
 * @param phase flight phase
 * @param aircraftType aircraft type
 * @param latitude airport latitude
 * @param longitude airport longitude
 * @param airportName airport name
 * @param city airport city
 * @param country airport country
 */
public record IncidentLocation(
    String uid,
    LocalDate date,
    String location,
    String operator,
    String phase,
    String aircraftType,
    double latitude,
    double longitude,
    String airportName,
    String city,
    String country) {}
