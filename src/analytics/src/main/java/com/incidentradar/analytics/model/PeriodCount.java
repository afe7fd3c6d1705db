package com.incidentradar.analytics.model;

/**
 * Incident count for one calendar period.
 *
 * @param period {@code YYYY} or {@code YYYY-MM}
 * @param incidentCount matching incidents in the period
 */
public record PeriodCount(String period, long incidentCount) {}
