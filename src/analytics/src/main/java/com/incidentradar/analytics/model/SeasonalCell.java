package com.incidentradar.analytics.model;

/**
 * Cell of the year by month seasonal matrix.
 *
 * @param month three-letter month abbreviation
 * @param year calendar year
 * @param incidentCount incidents in that month, {@code 0} when none
 */
public record SeasonalCell(String month, int year, long incidentCount) {}
