package com.incidentradar.analytics.model;

import java.util.List;

/**
 * Envelope returned by the aggregation endpoints.
 *
 * @param kind aggregation kind tag, for example {@code top_n}
 * @param rows result rows in pipeline order
 * @param count number of rows
 * @param timestamp response generation timestamp
 * @param <T> row type
 */
public record AggregationResponse<T>(String kind, List<T> rows, int count, String timestamp) {}
