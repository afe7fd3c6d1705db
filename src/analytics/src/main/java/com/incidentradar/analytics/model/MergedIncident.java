package com.incidentradar.analytics.model;

/**
 * Classification joined with its origin record, in canonical field names.
 *
 * @param id classification id
 * @param sourceUid incident identifier
 * @param modelVersion classifier version
 * @param predictedCategory predicted category code
 * @param predictedConfidence prediction confidence
 * @param finalCategory category after review
 * @param complete whether human evaluation is complete
 * @param evaluatorId evaluator who completed it
 * @param processedAt classification timestamp as stored
 * @param originDate incident date as stored
 * @param originPhase flight phase
 * @param originAircraftType aircraft type
 * @param originLocation location code
 * @param originOperator operator
 * @param originNarrative narrative
 */
public record MergedIncident(
    long id,
    String sourceUid,
    String modelVersion,
    String predictedCategory,
    Double predictedConfidence,
    String finalCategory,
    boolean complete,
    String evaluatorId,
    String processedAt,
    String originDate,
    String originPhase,
    String originAircraftType,
    String originLocation,
    String originOperator,
    String originNarrative) {}
