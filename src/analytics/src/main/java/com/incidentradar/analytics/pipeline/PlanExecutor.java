package com.incidentradar.analytics.pipeline;

import com.incidentradar.analytics.query.QueryPlan;
import com.incidentradar.analytics.query.QueryRenderer;
import com.incidentradar.analytics.query.SqlQuery;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Renders a plan, runs it on a pooled connection and maps the rows.
 *
 * <p>The connection is borrowed for the duration of one statement and returned on every exit path
 * by {@link NamedParameterJdbcTemplate}. Database errors propagate unchanged.
 */
@Component
public class PlanExecutor {
  private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final QueryRenderer renderer;
  private final MeterRegistry meterRegistry;

  public PlanExecutor(
      NamedParameterJdbcTemplate jdbcTemplate, QueryRenderer renderer, MeterRegistry meterRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.renderer = renderer;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes a plan.
   *
   * @param plan plan to execute
   * @param rowMapper maps one result row
   * @param <T> row type
   * @return mapped rows in database order; empty when the plan has no sources
   */
  public <T> List<T> execute(QueryPlan plan, RowMapper<T> rowMapper) {
    if (plan.matchesNothing()) {
      log.debug("Query {} skipped: no source records every constrained field", plan.kind().tagValue());
      return List.of();
    }
    SqlQuery query = renderer.render(plan);
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<T> rows = jdbcTemplate.query(query.sql(), query.parameters(), rowMapper);
      log.debug("Query {} over {} returned {} rows", plan.kind().tagValue(), plan.sources(), rows.size());
      return rows;
    } finally {
      sample.stop(Timer.builder("analytics.query.duration")
          .description("Time spent executing incident aggregation queries")
          .tag("kind", plan.kind().tagValue())
          .register(meterRegistry));
    }
  }
}
