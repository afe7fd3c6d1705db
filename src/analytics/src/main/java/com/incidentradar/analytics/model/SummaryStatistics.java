package com.incidentradar.analytics.model;

import java.util.Map;

/**
 * Aggregates computed over a bulk-retrieved incident set.
 *
 * @param totalIncidents merged records
 * @param uniqueOperators distinct non-null operators
 * @param uniqueAircraftTypes distinct non-null aircraft types
 * @param phaseCounts occurrences per non-null phase
 * @param operatorCounts occurrences per non-null operator
 */
public record SummaryStatistics(
    long totalIncidents,
    int uniqueOperators,
    int uniqueAircraftTypes,
    Map<String, Long> phaseCounts,
    Map<String, Long> operatorCounts) {

  public static SummaryStatistics empty() {
    return new SummaryStatistics(0, 0, 0, Map.of(), Map.of());
  }
}
