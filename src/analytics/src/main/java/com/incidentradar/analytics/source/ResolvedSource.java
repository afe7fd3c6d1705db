package com.incidentradar.analytics.source;

import java.util.Map;

/**
 * Result of resolving one identifier against the registry.
 *
 * @param kind source kind selected by the identifier prefix
 * @param columnMap canonical-to-native column mapping of that kind
 */
public record ResolvedSource(SourceKind kind, Map<CanonicalField, String> columnMap) {}
