package com.incidentradar.analytics.model;

/**
 * Incident record in canonical field names, whatever source it came from.
 *
 * @param uid globally unique identifier
 * @param date incident date exactly as the source stored it
 * @param phase flight phase, {@code null} for sources that do not record it
 * @param aircraftType aircraft type
 * @param location airport-code-like location token
 * @param operator operator
 * @param narrative free-text narrative
 */
public record SourceRecord(
    String uid,
    String date,
    String phase,
    String aircraftType,
    String location,
    String operator,
    String narrative) {}
