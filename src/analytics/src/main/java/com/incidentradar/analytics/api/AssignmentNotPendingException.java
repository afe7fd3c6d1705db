package com.incidentradar.analytics.api;

/**
 * Raised by the evaluation endpoint when no pending assignment matched the submission.
 *
 * <p>Mapped to HTTP 404 with code {@code not_found_or_already_complete}.
 */
public class AssignmentNotPendingException extends RuntimeException {
  public AssignmentNotPendingException(long classificationResultId, String evaluatorId) {
    super("no pending assignment for classification " + classificationResultId
        + " and evaluator " + evaluatorId);
  }
}
