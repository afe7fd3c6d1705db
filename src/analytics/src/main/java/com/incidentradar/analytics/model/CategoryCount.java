package com.incidentradar.analytics.model;

/**
 * Incident count for one value of the requested category.
 *
 * @param category category value
 * @param incidentCount matching incidents with that value
 */
public record CategoryCount(String category, long incidentCount) {}
