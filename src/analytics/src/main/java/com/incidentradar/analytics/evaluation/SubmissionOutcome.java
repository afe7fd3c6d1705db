package com.incidentradar.analytics.evaluation;

/**
 * Result of an evaluation submission.
 */
public enum SubmissionOutcome {
  SUBMITTED,
  /** No pending assignment matched; nothing was written. */
  NOT_FOUND_OR_ALREADY_COMPLETE
}
