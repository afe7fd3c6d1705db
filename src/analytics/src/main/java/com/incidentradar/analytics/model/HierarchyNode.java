package com.incidentradar.analytics.model;

/**
 * Leaf of the operator / aircraft type / phase hierarchy.
 *
 * @param operator operator
 * @param aircraftType aircraft type
 * @param phase flight phase
 * @param incidentCount incidents in the leaf
 */
public record HierarchyNode(String operator, String aircraftType, String phase, long incidentCount) {}
