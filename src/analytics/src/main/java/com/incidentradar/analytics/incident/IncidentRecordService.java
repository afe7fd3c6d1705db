package com.incidentradar.analytics.incident;

import com.incidentradar.analytics.api.NotFoundException;
import com.incidentradar.analytics.config.AnalyticsProperties;
import com.incidentradar.analytics.model.ClassificationResult;
import com.incidentradar.analytics.model.SourceRecord;
import com.incidentradar.analytics.query.FilterParser;
import com.incidentradar.analytics.source.ResolvedSource;
import com.incidentradar.analytics.source.SourceRegistry;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Single-record access by identifier and paging over classification results.
 */
@Service
public class IncidentRecordService {
  private final SourceRegistry registry;
  private final IncidentRepository repository;
  private final AnalyticsProperties.Api apiLimits;

  public IncidentRecordService(
      SourceRegistry registry, IncidentRepository repository, AnalyticsProperties properties) {
    this.registry = registry;
    this.repository = repository;
    this.apiLimits = properties.getApi();
  }

  /**
   * Resolves the identifier's source and loads the record in canonical form.
   *
   * @param identifier record identifier such as {@code asrs_1234}
   * @return canonical record
   * @throws com.incidentradar.analytics.api.UnknownSourceKindException for unknown prefixes
   * @throws NotFoundException when the source has no such record
   */
  public SourceRecord resolveAndFetchRecord(String identifier) {
    ResolvedSource source = registry.resolve(identifier);
    return repository.findRecord(source.kind(), identifier)
        .orElseThrow(() -> new NotFoundException("Record not found: " + identifier));
  }

  /**
   * Lists classification results ordered by id.
   *
   * @param rawSkip raw offset, defaults to 0
   * @param rawLimit raw page size, defaults to {@code analytics.api.default-limit}
   * @param evaluatorId optional evaluator filter, blank means any
   * @return one page of classification results
   */
  public List<ClassificationResult> listClassificationResults(
      String rawSkip, String rawLimit, String evaluatorId) {
    int skip = FilterParser.parseSkip(rawSkip);
    int limit = FilterParser.parseLimit(rawLimit, apiLimits.getDefaultLimit(), apiLimits.getMaxLimit());
    String evaluator = evaluatorId == null || evaluatorId.isBlank() ? null : evaluatorId.trim();
    return repository.findClassificationResults(skip, limit, evaluator);
  }
}
