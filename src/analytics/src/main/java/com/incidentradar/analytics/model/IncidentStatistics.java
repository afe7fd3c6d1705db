package com.incidentradar.analytics.model;

/**
 * Summary row of the statistics pipeline.
 *
 * @param totalIncidents incidents matching the filter
 */
public record IncidentStatistics(long totalIncidents) {}
