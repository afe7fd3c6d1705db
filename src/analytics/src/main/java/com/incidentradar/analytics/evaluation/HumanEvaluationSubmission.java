package com.incidentradar.analytics.evaluation;

import com.incidentradar.analytics.api.FieldViolation;
import com.incidentradar.analytics.api.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Human verdict on one classification result.
 *
 * @param classificationResultId classification under review
 * @param evaluatorId evaluator submitting the verdict
 * @param humanCategory category chosen by the evaluator
 * @param humanConfidence evaluator confidence (0.0-1.0)
 * @param humanReasoning free-text reasoning, nullable
 */
public record HumanEvaluationSubmission(
    Long classificationResultId,
    String evaluatorId,
    String humanCategory,
    Double humanConfidence,
    String humanReasoning) {

  /**
   * Checks the submission before anything is written.
   *
   * @throws ValidationException listing every invalid field
   */
  public void validate() {
    List<FieldViolation> violations = new ArrayList<>();
    if (classificationResultId == null) {
      violations.add(new FieldViolation("classificationResultId", "classificationResultId is required"));
    }
    if (evaluatorId == null || evaluatorId.isBlank()) {
      violations.add(new FieldViolation("evaluatorId", "evaluatorId is required"));
    }
    if (humanCategory == null || humanCategory.isBlank()) {
      violations.add(new FieldViolation("humanCategory", "humanCategory is required"));
    }
    if (humanConfidence == null) {
      violations.add(new FieldViolation("humanConfidence", "humanConfidence is required"));
    } else if (humanConfidence.isNaN() || humanConfidence < 0.0 || humanConfidence > 1.0) {
      violations.add(new FieldViolation("humanConfidence", "humanConfidence must be within 0.0-1.0"));
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }
}
