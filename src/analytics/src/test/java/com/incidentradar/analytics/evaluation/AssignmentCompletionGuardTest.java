package com.incidentradar.analytics.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.support.SqliteIncidentDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class AssignmentCompletionGuardTest {

  @TempDir Path tempDir;

  private NamedParameterJdbcTemplate jdbcTemplate;
  private SimpleMeterRegistry meterRegistry;
  private AssignmentCompletionGuard guard;

  @BeforeEach
  void setUp() {
    DataSource dataSource = SqliteIncidentDatabase.create(tempDir);
    jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
    meterRegistry = new SimpleMeterRegistry();
    guard = new AssignmentCompletionGuard(
        jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)), meterRegistry);
  }

  @Test
  void submit_completesPendingAssignmentAndRecordsEvaluation() {
    SubmissionOutcome outcome = guard.submit(submission(101L, "eval_a", 0.99));

    assertEquals(SubmissionOutcome.SUBMITTED, outcome);
    Map<String, Object> evaluation = jdbcTemplate.queryForMap(
        "SELECT human_category, human_confidence, human_reasoning, created_at FROM human_evaluation"
            + " WHERE classification_result_id = 101 AND evaluator_id = 'eval_a'",
        Map.of());
    assertEquals("Runway incursion", evaluation.get("human_category"));
    assertEquals(0.99, ((Number) evaluation.get("human_confidence")).doubleValue(), 1e-9);
    assertNotNull(evaluation.get("created_at"));

    Map<String, Object> assignment = jdbcTemplate.queryForMap(
        "SELECT status, completed_at FROM evaluation_assignments WHERE id = 1", Map.of());
    assertEquals("complete", assignment.get("status"));
    assertNotNull(assignment.get("completed_at"));

    Map<String, Object> classification = jdbcTemplate.queryForMap(
        "SELECT is_complete, evaluator_id FROM classification_results WHERE id = 101", Map.of());
    assertEquals(1, ((Number) classification.get("is_complete")).intValue());
    assertEquals("eval_a", classification.get("evaluator_id"));
    assertEquals(1.0, meterRegistry.counter("analytics.evaluations.submitted").count());
  }

  @Test
  void submit_secondAttemptLeavesNoTrace() {
    assertEquals(SubmissionOutcome.SUBMITTED, guard.submit(submission(101L, "eval_a", 0.9)));

    assertEquals(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE, guard.submit(submission(101L, "eval_a", 0.1)));
    assertEquals(1, evaluationCount(101L));
  }

  @Test
  void submit_rejectsUnknownWrongEvaluatorAndCompletedAssignments() {
    assertEquals(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE, guard.submit(submission(999L, "eval_a", 0.5)));
    assertEquals(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE, guard.submit(submission(101L, "eval_b", 0.5)));
    assertEquals(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE, guard.submit(submission(3L, "eval_b", 0.5)));

    assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM human_evaluation", Map.of(), Integer.class));
    assertEquals("pending", jdbcTemplate.queryForObject(
        "SELECT status FROM evaluation_assignments WHERE id = 1", Map.of(), String.class));
    assertEquals(3.0, meterRegistry.counter("analytics.evaluations.rejected").count());
  }

  @Test
  void submit_validatesBeforeTouchingTheDatabase() {
    ValidationException ex = assertThrows(
        ValidationException.class,
        () -> guard.submit(new HumanEvaluationSubmission(101L, " ", "", 1.5, null)));

    assertEquals(3, ex.getViolations().size());
    assertEquals("pending", jdbcTemplate.queryForObject(
        "SELECT status FROM evaluation_assignments WHERE id = 1", Map.of(), String.class));
  }

  @Test
  void concurrentSubmissionsCompleteTheAssignmentExactlyOnce() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<SubmissionOutcome>> futures = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        double confidence = 0.5 + i / 10.0;
        futures.add(executor.submit(() -> {
          start.await();
          return guard.submit(submission(101L, "eval_a", confidence));
        }));
      }
      start.countDown();

      List<SubmissionOutcome> outcomes = new ArrayList<>();
      for (Future<SubmissionOutcome> future : futures) {
        outcomes.add(future.get(30, TimeUnit.SECONDS));
      }

      assertEquals(1, outcomes.stream().filter(SubmissionOutcome.SUBMITTED::equals).count());
      assertTrue(outcomes.contains(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE));
      assertEquals(1, evaluationCount(101L));
    } finally {
      executor.shutdownNow();
    }
  }

  private int evaluationCount(long classificationResultId) {
    return jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM human_evaluation WHERE classification_result_id = :id",
        new MapSqlParameterSource("id", classificationResultId),
        Integer.class);
  }

  private static HumanEvaluationSubmission submission(long id, String evaluatorId, double confidence) {
    return new HumanEvaluationSubmission(id, evaluatorId, "Runway incursion", confidence, "Checked narrative");
  }
}
