package com.incidentradar.analytics.model;

/**
 * Next pending human-evaluation assignment for an evaluator.
 *
 * @param assignmentId assignment id
 * @param classificationResultId classification under review
 * @param sourceUid identifier of the classified incident
 * @param evaluatorId assigned evaluator
 */
public record EvaluationTask(
    long assignmentId, long classificationResultId, String sourceUid, String evaluatorId) {}
