package com.incidentradar.analytics.incident;

import com.incidentradar.analytics.api.NotFoundException;
import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.config.AnalyticsProperties;
import com.incidentradar.analytics.model.BulkRetrievalResult;
import com.incidentradar.analytics.model.MergedIncident;
import com.incidentradar.analytics.model.SummaryStatistics;
import com.incidentradar.analytics.source.BatchResolution;
import com.incidentradar.analytics.source.ResolvedSource;
import com.incidentradar.analytics.source.SourceKind;
import com.incidentradar.analytics.source.SourceRegistry;
import com.incidentradar.analytics.support.Partitions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Joins a batch of identifiers with their classifications across all source kinds.
 *
 * <p>One query per source kind (and per chunk of identifiers), never one per identifier.
 * Identifiers with an unknown prefix are reported back instead of failing the batch; identifiers
 * without a classification or origin row are simply absent from the results.
 */
@Service
public class BulkJoinRetriever {
  private static final Logger log = LoggerFactory.getLogger(BulkJoinRetriever.class);

  private final SourceRegistry registry;
  private final IncidentRepository repository;
  private final AnalyticsProperties.Bulk limits;
  private final Counter unresolvedCounter;

  public BulkJoinRetriever(
      SourceRegistry registry,
      IncidentRepository repository,
      AnalyticsProperties properties,
      MeterRegistry meterRegistry) {
    this.registry = registry;
    this.repository = repository;
    this.limits = properties.getBulk();
    this.unresolvedCounter = Counter.builder("analytics.bulk.unresolved")
        .description("Identifiers rejected by bulk retrieval because of an unknown prefix")
        .register(meterRegistry);
  }

  /**
   * Retrieves merged incidents for a batch of identifiers.
   *
   * @param identifiers requested identifiers, duplicates allowed
   * @return merged incidents in request order, their aggregates and the unresolved identifiers
   * @throws ValidationException when the batch exceeds {@code analytics.bulk.max-identifiers}
   */
  public BulkRetrievalResult retrieve(Collection<String> identifiers) {
    if (identifiers == null || identifiers.isEmpty()) {
      return new BulkRetrievalResult(Map.of(), SummaryStatistics.empty(), List.of());
    }
    Set<String> requested = new LinkedHashSet<>(identifiers);
    requested.remove(null);
    if (requested.size() > limits.getMaxIdentifiers()) {
      throw new ValidationException("identifiers",
          "at most " + limits.getMaxIdentifiers() + " identifiers per request, got " + requested.size());
    }

    BatchResolution resolution = registry.resolveBatch(requested);
    Map<String, MergedIncident> found = new HashMap<>();
    for (Map.Entry<SourceKind, Set<String>> partition : resolution.partitions().entrySet()) {
      for (List<String> chunk : Partitions.of(partition.getValue(), limits.getChunkSize())) {
        // ordered by id: later rows overwrite, the newest classification wins
        repository.findMerged(partition.getKey(), chunk)
            .forEach(incident -> found.put(incident.sourceUid(), incident));
      }
    }

    Map<String, MergedIncident> results = new LinkedHashMap<>();
    for (String identifier : requested) {
      MergedIncident incident = found.get(identifier);
      if (incident != null) {
        results.put(identifier, incident);
      }
    }
    if (!resolution.unresolved().isEmpty()) {
      unresolvedCounter.increment(resolution.unresolved().size());
      log.debug("Bulk retrieval skipped {} identifiers with unknown prefix", resolution.unresolved().size());
    }
    log.debug("Bulk retrieval: requested={} found={}", requested.size(), results.size());
    return new BulkRetrievalResult(results, summarize(results.values()), resolution.unresolved());
  }

  /**
   * Single-identifier view of the bulk join.
   *
   * @param identifier record identifier
   * @return newest classification merged with its origin record
   * @throws NotFoundException when no classified record exists for the identifier
   */
  public MergedIncident fetchMergedIncident(String identifier) {
    ResolvedSource source = registry.resolve(identifier);
    List<MergedIncident> rows = repository.findMerged(source.kind(), List.of(identifier));
    if (rows.isEmpty()) {
      throw new NotFoundException("No classified record for uid " + identifier);
    }
    return rows.get(rows.size() - 1);
  }

  /**
   * Computes batch statistics in a single pass.
   *
   * <p>Null operator, aircraft type or phase values count toward the total only.
   *
   * @param incidents merged incidents
   * @return statistics, all zero for an empty input
   */
  public static SummaryStatistics summarize(Collection<MergedIncident> incidents) {
    if (incidents.isEmpty()) {
      return SummaryStatistics.empty();
    }
    Map<String, Long> phaseCounts = new TreeMap<>();
    Map<String, Long> operatorCounts = new TreeMap<>();
    Set<String> aircraftTypes = new HashSet<>();
    for (MergedIncident incident : incidents) {
      if (incident.originPhase() != null) {
        phaseCounts.merge(incident.originPhase(), 1L, Long::sum);
      }
      if (incident.originOperator() != null) {
        operatorCounts.merge(incident.originOperator(), 1L, Long::sum);
      }
      if (incident.originAircraftType() != null) {
        aircraftTypes.add(incident.originAircraftType());
      }
    }
    return new SummaryStatistics(
        incidents.size(),
        operatorCounts.size(),
        aircraftTypes.size(),
        phaseCounts,
        operatorCounts);
  }
}
