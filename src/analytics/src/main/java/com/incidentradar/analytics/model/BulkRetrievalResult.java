package com.incidentradar.analytics.model;

import java.util.List;
import java.util.Map;

/**
 * Response of a bulk join retrieval.
 *
 * @param results merged incidents keyed by identifier
 * @param aggregates statistics over {@code results}
 * @param unresolved requested identifiers whose prefix names no known source
 */
public record BulkRetrievalResult(
    Map<String, MergedIncident> results, SummaryStatistics aggregates, List<String> unresolved) {}
