package com.incidentradar.analytics.incident;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.incidentradar.analytics.api.NotFoundException;
import com.incidentradar.analytics.api.UnknownSourceKindException;
import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.config.AnalyticsProperties;
import com.incidentradar.analytics.model.BulkRetrievalResult;
import com.incidentradar.analytics.model.MergedIncident;
import com.incidentradar.analytics.model.SummaryStatistics;
import com.incidentradar.analytics.query.SqliteDialect;
import com.incidentradar.analytics.source.SourceRegistry;
import com.incidentradar.analytics.support.SqliteIncidentDatabase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BulkJoinRetrieverTest {

  @TempDir Path tempDir;

  private AnalyticsProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private BulkJoinRetriever retriever;

  @BeforeEach
  void setUp() {
    properties = new AnalyticsProperties();
    properties.getBulk().setChunkSize(2);
    meterRegistry = new SimpleMeterRegistry();
    IncidentRepository repository =
        new IncidentRepository(SqliteIncidentDatabase.template(tempDir), new SqliteDialect());
    retriever = new BulkJoinRetriever(new SourceRegistry(), repository, properties, meterRegistry);
  }

  @Test
  void retrieve_joinsAcrossSourceKindsWithCanonicalFields() {
    BulkRetrievalResult result = retriever.retrieve(
        List.of("asn_1", "asrs_1", "pci_1", "asn_99", "foo_1", "noprefix", "asn_1"));

    assertEquals(List.of("asn_1", "asrs_1", "pci_1"), List.copyOf(result.results().keySet()));
    assertEquals(List.of("foo_1", "noprefix"), result.unresolved());

    MergedIncident asrs = result.results().get("asrs_1");
    assertEquals("Altitude deviation", asrs.originNarrative());
    assertEquals("KJFK", asrs.originLocation());
    assertEquals("01/15/2023", asrs.originDate());

    MergedIncident pci = result.results().get("pci_1");
    assertNull(pci.originPhase());
    assertTrue(pci.complete());
    assertEquals("eval_b", pci.evaluatorId());
    assertEquals(2.0, meterRegistry.counter("analytics.bulk.unresolved").count());
  }

  @Test
  void retrieve_newestClassificationWins() {
    MergedIncident incident = retriever.retrieve(List.of("asn_1")).results().get("asn_1");

    assertEquals(4L, incident.id());
    assertEquals("v2", incident.modelVersion());
    assertEquals(0.95, incident.predictedConfidence(), 1e-9);
  }

  @Test
  void retrieve_aggregatesMergedRows() {
    SummaryStatistics aggregates = retriever.retrieve(List.of("asn_1", "asrs_1", "pci_1")).aggregates();

    assertEquals(3L, aggregates.totalIncidents());
    assertEquals(Map.of("CRUISE", 2L), aggregates.phaseCounts());
    assertEquals(Map.of("DELTA", 2L, "UNITED", 1L), aggregates.operatorCounts());
    assertEquals(2, aggregates.uniqueOperators());
    assertEquals(1, aggregates.uniqueAircraftTypes());
  }

  @Test
  void retrieve_includesUndatedRecords() {
    BulkRetrievalResult result = retriever.retrieve(List.of("asn_5"));

    assertNull(result.results().get("asn_5").originDate());
    assertEquals(1L, result.aggregates().totalIncidents());
  }

  @Test
  void retrieve_emptyRequest() {
    BulkRetrievalResult result = retriever.retrieve(List.of());

    assertTrue(result.results().isEmpty());
    assertEquals(SummaryStatistics.empty(), result.aggregates());
    assertTrue(result.unresolved().isEmpty());
  }

  @Test
  void retrieve_onlyUnknownIdentifiers() {
    BulkRetrievalResult result = retriever.retrieve(List.of("foo_1", "bar_2"));

    assertTrue(result.results().isEmpty());
    assertEquals(0L, result.aggregates().totalIncidents());
    assertEquals(List.of("foo_1", "bar_2"), result.unresolved());
  }

  @Test
  void retrieve_rejectsOversizedBatch() {
    properties.getBulk().setMaxIdentifiers(3);

    assertThrows(ValidationException.class, () -> retriever.retrieve(
        IntStream.rangeClosed(1, 4).mapToObj(i -> "asn_" + i).toList()));
    assertFalse(retriever.retrieve(Collections.nCopies(10, "asn_1")).results().isEmpty());
  }

  @Test
  void fetchMergedIncident_singleIdentifier() {
    assertEquals(4L, retriever.fetchMergedIncident("asn_1").id());
    assertThrows(NotFoundException.class, () -> retriever.fetchMergedIncident("asn_99"));
    assertThrows(NotFoundException.class, () -> retriever.fetchMergedIncident("asn_2"));
    assertThrows(UnknownSourceKindException.class, () -> retriever.fetchMergedIncident("foo_1"));
  }

  @Test
  void summarize_countsNullsTowardTotalOnly() {
    MergedIncident withNulls = new MergedIncident(
        1, "pci_9", "v1", "X", 0.5, null, false, null, null, null, null, null, null, null, null);
    MergedIncident full = new MergedIncident(
        2, "asn_9", "v1", "X", 0.5, null, false, null, null,
        "2024-01-01", "CRUISE", "A320", "KJFK", "DELTA", "text");

    SummaryStatistics stats = BulkJoinRetriever.summarize(List.of(withNulls, full));

    assertEquals(2L, stats.totalIncidents());
    assertEquals(1, stats.uniqueOperators());
    assertEquals(1, stats.uniqueAircraftTypes());
    assertEquals(Map.of("CRUISE", 1L), stats.phaseCounts());
  }
}
