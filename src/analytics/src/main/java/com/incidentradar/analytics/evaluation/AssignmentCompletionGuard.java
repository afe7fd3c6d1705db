package com.incidentradar.analytics.evaluation;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Completes a pending evaluation assignment exactly once.
 *
 * <p>The state check and the transition are one conditional {@code UPDATE}, so two concurrent
 * submissions for the same assignment cannot both observe {@code pending}: the database serializes
 * them on the row and the loser updates nothing. The evaluation row and the classification flag are
 * written in the same transaction as the transition.
 */
@Service
public class AssignmentCompletionGuard {
  private static final Logger log = LoggerFactory.getLogger(AssignmentCompletionGuard.class);

  static final String COMPLETE_ASSIGNMENT_SQL =
      "UPDATE evaluation_assignments SET status = 'complete', completed_at = CURRENT_TIMESTAMP"
          + " WHERE classification_result_id = :classificationResultId"
          + " AND evaluator_id = :evaluatorId AND status = 'pending'";
  static final String INSERT_EVALUATION_SQL =
      "INSERT INTO human_evaluation (classification_result_id, evaluator_id, human_category,"
          + " human_confidence, human_reasoning, created_at)"
          + " VALUES (:classificationResultId, :evaluatorId, :humanCategory, :humanConfidence,"
          + " :humanReasoning, CURRENT_TIMESTAMP)";
  static final String MARK_CLASSIFIED_SQL =
      "UPDATE classification_results SET is_complete = TRUE, evaluator_id = :evaluatorId"
          + " WHERE id = :classificationResultId";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final Counter submittedCounter;
  private final Counter rejectedCounter;

  public AssignmentCompletionGuard(
      NamedParameterJdbcTemplate jdbcTemplate,
      TransactionTemplate transactionTemplate,
      MeterRegistry meterRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    this.submittedCounter = Counter.builder("analytics.evaluations.submitted")
        .description("Human evaluations accepted")
        .register(meterRegistry);
    this.rejectedCounter = Counter.builder("analytics.evaluations.rejected")
        .description("Submissions without a pending assignment")
        .register(meterRegistry);
  }

  /**
   * Records a human evaluation and completes its assignment.
   *
   * @param submission evaluation to record
   * @return {@link SubmissionOutcome#SUBMITTED}, or {@link
   *     SubmissionOutcome#NOT_FOUND_OR_ALREADY_COMPLETE} with no side effects
   * @throws com.incidentradar.analytics.api.ValidationException when the submission is invalid
   */
  public SubmissionOutcome submit(HumanEvaluationSubmission submission) {
    submission.validate();
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("classificationResultId", submission.classificationResultId())
        .addValue("evaluatorId", submission.evaluatorId().trim())
        .addValue("humanCategory", submission.humanCategory().trim())
        .addValue("humanConfidence", submission.humanConfidence())
        .addValue("humanReasoning", submission.humanReasoning());

    SubmissionOutcome outcome = transactionTemplate.execute(status -> {
      int updated = jdbcTemplate.update(COMPLETE_ASSIGNMENT_SQL, params);
      if (updated != 1) {
        status.setRollbackOnly();
        return SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE;
      }
      jdbcTemplate.update(INSERT_EVALUATION_SQL, params);
      jdbcTemplate.update(MARK_CLASSIFIED_SQL, params);
      return SubmissionOutcome.SUBMITTED;
    });

    if (outcome == SubmissionOutcome.SUBMITTED) {
      submittedCounter.increment();
      log.info("Evaluation submitted: classificationResultId={} evaluator={}",
          submission.classificationResultId(), submission.evaluatorId());
    } else {
      rejectedCounter.increment();
      log.debug("No pending assignment: classificationResultId={} evaluator={}",
          submission.classificationResultId(), submission.evaluatorId());
    }
    return outcome;
  }
}
