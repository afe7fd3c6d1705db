package com.incidentradar.analytics.model;

/**
 * Machine classification of one incident record.
 *
 * @param id primary key
 * @param sourceUid identifier of the classified record
 * @param modelVersion classifier version
 * @param predictedCategory predicted category code
 * @param predictedConfidence prediction confidence (0.0-1.0)
 * @param finalCategory category after review, nullable
 * @param complete whether human evaluation is complete
 * @param evaluatorId evaluator who completed it, nullable
 * @param processedAt classification timestamp as stored
 */
public record ClassificationResult(
    long id,
    String sourceUid,
    String modelVersion,
    String predictedCategory,
    Double predictedConfidence,
    String finalCategory,
    boolean complete,
    String evaluatorId,
    String processedAt) {}
