package com.incidentradar.analytics.api;

import com.incidentradar.analytics.model.AggregationResponse;
import com.incidentradar.analytics.model.CategoryCount;
import com.incidentradar.analytics.model.HeatmapCell;
import com.incidentradar.analytics.model.HierarchyNode;
import com.incidentradar.analytics.model.IncidentLocation;
import com.incidentradar.analytics.model.IncidentStatistics;
import com.incidentradar.analytics.model.PeriodCount;
import com.incidentradar.analytics.model.SeasonalCell;
import com.incidentradar.analytics.pipeline.IncidentAggregationService;
import java.util.List;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the incident aggregation pipelines.
 *
 * <p>Every route accepts the common filter parameters ({@code operators}, {@code phases},
 * {@code aircraftTypes}, {@code locations}, {@code startPeriod}, {@code endPeriod},
 * {@code granularity}) plus its own kind parameters:
 * <ul>
 *   <li>{@code GET /api/aggregates/over-time}</li>
 *   <li>{@code GET /api/aggregates/top-n}: {@code category}, optional {@code n}</li>
 *   <li>{@code GET /api/aggregates/heatmap}: {@code dimension1}, {@code dimension2}</li>
 *   <li>{@code GET /api/aggregates/hierarchy}</li>
 *   <li>{@code GET /api/aggregates/statistics}</li>
 *   <li>{@code GET /api/aggregates/locations}</li>
 *   <li>{@code GET /api/aggregates/seasonal}</li>
 *   <li>{@code GET /api/reports/uids}</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class AggregationController {
  private final IncidentAggregationService aggregationService;

  public AggregationController(IncidentAggregationService aggregationService) {
    this.aggregationService = aggregationService;
  }

  @GetMapping("/aggregates/over-time")
  public AggregationResponse<PeriodCount> overTime(@RequestParam MultiValueMap<String, String> params) {
    return aggregationService.overTime(params);
  }

  @GetMapping("/aggregates/top-n")
  public AggregationResponse<CategoryCount> topN(@RequestParam MultiValueMap<String, String> params) {
    return aggregationService.topN(params);
  }

  @GetMapping("/aggregates/heatmap")
  public AggregationResponse<HeatmapCell> heatmap(@RequestParam MultiValueMap<String, String> params) {
    return aggregationService.heatmap(params);
  }

  @GetMapping("/aggregates/hierarchy")
  public AggregationResponse<HierarchyNode> hierarchy(
      @RequestParam MultiValueMap<String, String> params) {
    return aggregationService.hierarchy(params);
  }

  @GetMapping("/aggregates/statistics")
  public IncidentStatistics statistics(@RequestParam MultiValueMap<String, String> params) {
    return aggregationService.statistics(params);
  }

  /**
   * Lists incidents placed on airport coordinates.
   *
   * @param params filter parameters
   * @return located incidents ordered by identifier
   */
  @GetMapping("/aggregates/locations")
  public AggregationResponse<IncidentLocation> locations(
      @RequestParam MultiValueMap<String, String> params) {
    return aggregationService.locations(params);
  }

  /**
   * Returns the zero-filled year by month matrix.
   *
   * @param params filter parameters; {@code granularity} is ignored
   * @return twelve cells per year
   */
  @GetMapping("/aggregates/seasonal")
  public AggregationResponse<SeasonalCell> seasonal(
      @RequestParam MultiValueMap<String, String> params) {
    return aggregationService.seasonal(params);
  }

  /**
   * Lists identifiers matching the filter, newest incident first.
   *
   * @param params filter parameters
   * @return matching identifiers
   */
  @GetMapping("/reports/uids")
  public List<String> identifiers(@RequestParam MultiValueMap<String, String> params) {
    return aggregationService.identifiers(params);
  }
}
