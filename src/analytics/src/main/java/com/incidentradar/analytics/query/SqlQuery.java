package com.incidentradar.analytics.query;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Rendered statement with named bind parameters.
 *
 * @param sql SQL text containing only {@code :name} placeholders for values
 * @param parameters bind values
 */
public record SqlQuery(String sql, MapSqlParameterSource parameters) {}
