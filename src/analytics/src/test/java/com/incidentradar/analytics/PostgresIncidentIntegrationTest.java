package com.incidentradar.analytics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.incidentradar.analytics.airport.JdbcAirportLookup;
import com.incidentradar.analytics.config.AnalyticsProperties;
import com.incidentradar.analytics.evaluation.AssignmentCompletionGuard;
import com.incidentradar.analytics.evaluation.HumanEvaluationSubmission;
import com.incidentradar.analytics.evaluation.SubmissionOutcome;
import com.incidentradar.analytics.incident.BulkJoinRetriever;
import com.incidentradar.analytics.incident.IncidentRepository;
import com.incidentradar.analytics.model.BulkRetrievalResult;
import com.incidentradar.analytics.model.CategoryCount;
import com.incidentradar.analytics.model.IncidentLocation;
import com.incidentradar.analytics.model.PeriodCount;
import com.incidentradar.analytics.pipeline.IncidentAggregationService;
import com.incidentradar.analytics.pipeline.PlanExecutor;
import com.incidentradar.analytics.query.FilterParser;
import com.incidentradar.analytics.query.FilterSpecification;
import com.incidentradar.analytics.query.PostgresDialect;
import com.incidentradar.analytics.query.QueryPlanBuilder;
import com.incidentradar.analytics.query.QueryRenderer;
import com.incidentradar.analytics.source.SourceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class PostgresIncidentIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  private static DriverManagerDataSource dataSource;
  private static NamedParameterJdbcTemplate jdbcTemplate;
  private static IncidentAggregationService aggregationService;
  private static BulkJoinRetriever bulkJoinRetriever;
  private static AssignmentCompletionGuard guard;

  @BeforeAll
  static void setupDatabase() {
    dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    DatabasePopulatorUtils.execute(new ResourceDatabasePopulator(
        new ClassPathResource("db/postgres-schema.sql"),
        new ClassPathResource("db/seed.sql")), dataSource);

    jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
    PostgresDialect dialect = new PostgresDialect();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    AnalyticsProperties properties = new AnalyticsProperties();
    aggregationService = new IncidentAggregationService(
        new QueryPlanBuilder(),
        new PlanExecutor(jdbcTemplate, new QueryRenderer(dialect), meterRegistry),
        new JdbcAirportLookup(jdbcTemplate, properties));
    bulkJoinRetriever = new BulkJoinRetriever(
        new SourceRegistry(), new IncidentRepository(jdbcTemplate, dialect), properties, meterRegistry);
    guard = new AssignmentCompletionGuard(
        jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)), meterRegistry);
  }

  @Test
  void aggregationsMatchOnPostgres() {
    FilterSpecification all = FilterSpecification.unrestricted();

    List<PeriodCount> overTime = aggregationService.overTime(all);
    assertEquals(new PeriodCount("2023-01", 4), overTime.get(0));
    assertEquals(12L, overTime.stream().mapToLong(PeriodCount::incidentCount).sum());
    assertEquals(12L, aggregationService.statistics(all).totalIncidents());

    assertEquals(List.of(
        new CategoryCount("CRUISE", 3),
        new CategoryCount("APPROACH", 2),
        new CategoryCount("LANDING", 2)), aggregationService.topN(all, "phase", "3"));

    FilterSpecification window = FilterParser.parse(Map.of(
        FilterParser.LOCATIONS, List.of("kjfk"),
        FilterParser.START_PERIOD, List.of("2023-01"),
        FilterParser.END_PERIOD, List.of("2023-01")));
    assertEquals(3L, aggregationService.statistics(window).totalIncidents());

    List<IncidentLocation> located = aggregationService.locations(all);
    assertEquals(9, located.size());
  }

  @Test
  void bulkJoinOnPostgres() {
    BulkRetrievalResult result = bulkJoinRetriever.retrieve(List.of("asn_1", "asrs_1", "pci_1", "foo_1"));

    assertEquals(3, result.results().size());
    assertEquals("v2", result.results().get("asn_1").modelVersion());
    assertEquals(List.of("foo_1"), result.unresolved());
    assertEquals(Map.of("DELTA", 2L, "UNITED", 1L), result.aggregates().operatorCounts());
  }

  @Test
  void concurrentSubmissionsOnPostgres() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<SubmissionOutcome>> futures = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        futures.add(executor.submit(() -> {
          start.await();
          return guard.submit(new HumanEvaluationSubmission(2L, "eval_a", "ALT-DEV", 0.7, null));
        }));
      }
      start.countDown();

      List<SubmissionOutcome> outcomes = new ArrayList<>();
      for (Future<SubmissionOutcome> future : futures) {
        outcomes.add(future.get(30, TimeUnit.SECONDS));
      }
      assertEquals(1, outcomes.stream().filter(SubmissionOutcome.SUBMITTED::equals).count());
      assertTrue(outcomes.contains(SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE));
      assertEquals(1, jdbcTemplate.queryForObject(
          "SELECT COUNT(*) FROM human_evaluation WHERE classification_result_id = 2", Map.of(), Integer.class));
    } finally {
      executor.shutdownNow();
    }
  }
}
