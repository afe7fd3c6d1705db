package com.incidentradar.analytics.evaluation;

import com.incidentradar.analytics.model.EvaluationTask;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Hands out the next pending assignment for an evaluator.
 */
@Service
public class EvaluationTaskService {
  private static final String NEXT_TASK_SQL =
      "SELECT a.id, a.classification_result_id, c.source_uid, a.evaluator_id"
          + " FROM evaluation_assignments a"
          + " JOIN classification_results c ON c.id = a.classification_result_id"
          + " WHERE a.evaluator_id = :evaluatorId AND a.status = 'pending'"
          + " ORDER BY a.id LIMIT 1";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public EvaluationTaskService(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Finds the lowest-id pending assignment.
   *
   * @param evaluatorId evaluator
   * @return next task, empty when the evaluator has nothing pending
   */
  public Optional<EvaluationTask> nextTask(String evaluatorId) {
    List<EvaluationTask> rows = jdbcTemplate.query(
        NEXT_TASK_SQL,
        new MapSqlParameterSource("evaluatorId", evaluatorId),
        (rs, rowNum) -> new EvaluationTask(
            rs.getLong("id"),
            rs.getLong("classification_result_id"),
            rs.getString("source_uid"),
            rs.getString("evaluator_id")));
    return rows.stream().findFirst();
  }
}
