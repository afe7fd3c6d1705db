package com.incidentradar.analytics.source;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identifiers grouped by source kind.
 *
 * @param partitions identifiers per source kind, in first-seen order
 * @param unresolved identifiers whose prefix is missing or not registered
 */
public record BatchResolution(Map<SourceKind, Set<String>> partitions, List<String> unresolved) {}
