package com.incidentradar.analytics.model;

/**
 * One observed cell of a two-dimensional cross-tabulation.
 *
 * @param x value of the first dimension
 * @param y value of the second dimension
 * @param incidentCount incidents with both values
 */
public record HeatmapCell(String x, String y, long incidentCount) {}
