package com.incidentradar.analytics.api;

import com.incidentradar.analytics.incident.BulkJoinRetriever;
import com.incidentradar.analytics.incident.IncidentRecordService;
import com.incidentradar.analytics.model.BulkRetrievalResult;
import com.incidentradar.analytics.model.ClassificationResult;
import com.incidentradar.analytics.model.MergedIncident;
import com.incidentradar.analytics.model.SourceRecord;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for record-level access.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/records/{uid}}: origin record in canonical fields</li>
 *   <li>{@code GET /api/classification-results}: paged classification list</li>
 *   <li>{@code GET /api/incidents/{uid}}: newest classification merged with its origin</li>
 *   <li>{@code POST /api/incidents/bulk}: merged view for a batch of identifiers</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class IncidentController {
  private final IncidentRecordService recordService;
  private final BulkJoinRetriever bulkJoinRetriever;

  /**
   * Creates the controller.
   *
   * @param recordService single-record and paging service
   * @param bulkJoinRetriever classification join service
   */
  public IncidentController(IncidentRecordService recordService, BulkJoinRetriever bulkJoinRetriever) {
    this.recordService = recordService;
    this.bulkJoinRetriever = bulkJoinRetriever;
  }

  @GetMapping("/records/{uid}")
  public SourceRecord record(@PathVariable("uid") String uid) {
    return recordService.resolveAndFetchRecord(uid);
  }

  /**
   * Pages through classification results.
   *
   * @param skip optional offset
   * @param limit optional page size, clamped to the configured maximum
   * @param evaluatorId optional evaluator filter
   * @return classification page ordered by id
   */
  @GetMapping("/classification-results")
  public List<ClassificationResult> classificationResults(
      @RequestParam(value = "skip", required = false) String skip,
      @RequestParam(value = "limit", required = false) String limit,
      @RequestParam(value = "evaluatorId", required = false) String evaluatorId) {
    return recordService.listClassificationResults(skip, limit, evaluatorId);
  }

  @GetMapping("/incidents/{uid}")
  public MergedIncident incident(@PathVariable("uid") String uid) {
    return bulkJoinRetriever.fetchMergedIncident(uid);
  }

  /**
   * Retrieves merged incidents for a batch of identifiers.
   *
   * @param identifiers JSON array of identifiers
   * @return results keyed by identifier, aggregates and unresolved identifiers
   */
  @PostMapping("/incidents/bulk")
  public BulkRetrievalResult bulk(@RequestBody List<String> identifiers) {
    return bulkJoinRetriever.retrieve(identifiers);
  }
}
