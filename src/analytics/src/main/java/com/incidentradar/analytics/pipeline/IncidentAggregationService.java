package com.incidentradar.analytics.pipeline;

import com.incidentradar.analytics.airport.AirportDetails;
import com.incidentradar.analytics.airport.AirportLookup;
import com.incidentradar.analytics.api.FieldViolation;
import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.model.AggregationResponse;
import com.incidentradar.analytics.model.CategoryCount;
import com.incidentradar.analytics.model.HeatmapCell;
import com.incidentradar.analytics.model.HierarchyNode;
import com.incidentradar.analytics.model.IncidentLocation;
import com.incidentradar.analytics.model.IncidentStatistics;
import com.incidentradar.analytics.model.PeriodCount;
import com.incidentradar.analytics.model.SeasonalCell;
import com.incidentradar.analytics.query.FilterParser;
import com.incidentradar.analytics.query.FilterSpecification;
import com.incidentradar.analytics.query.PeriodGranularity;
import com.incidentradar.analytics.query.QueryKind;
import com.incidentradar.analytics.query.QueryPlan;
import com.incidentradar.analytics.query.QueryPlanBuilder;
import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.support.JdbcValues;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregation pipelines over the canonical incident view.
 *
 * <p>Filtering, grouping, counting and ordering are pushed to the database, so results are bounded
 * by the number of groups rather than by the number of incidents. Each pipeline exists in a typed
 * form (validated filter in, rows out) and a raw form used by the HTTP layer.
 */
@Service
public class IncidentAggregationService {
  private static final Logger log = LoggerFactory.getLogger(IncidentAggregationService.class);
  private static final String COUNT = QueryPlan.COUNT_ALIAS;
  private static final String SEASONAL_KIND = "seasonal";
  private static final Pattern MONTH_BUCKET = Pattern.compile("\\d{4}-\\d{2}");

  private final QueryPlanBuilder planBuilder;
  private final PlanExecutor executor;
  private final AirportLookup airportLookup;

  /**
   * Creates the aggregation service.
   *
   * @param planBuilder plan builder
   * @param executor plan executor
   * @param airportLookup airport reference collaborator used by the geolocation listing
   */
  public IncidentAggregationService(
      QueryPlanBuilder planBuilder, PlanExecutor executor, AirportLookup airportLookup) {
    this.planBuilder = planBuilder;
    this.executor = executor;
    this.airportLookup = airportLookup;
  }

  /**
   * Incident counts per year or month, ascending; empty periods are omitted.
   *
   * @param filter validated filter; its granularity selects the bucket size
   * @return period rows
   */
  public List<PeriodCount> overTime(FilterSpecification filter) {
    QueryPlan plan = planBuilder.build(filter, QueryKind.OVER_TIME);
    return executor.execute(plan, (rs, rowNum) -> new PeriodCount(rs.getString("period"), rs.getLong(COUNT)));
  }

  /**
   * The {@code n} most frequent values of one category, ties broken by value ascending.
   *
   * @param filter validated filter
   * @param category category wire value
   * @param n raw row limit, defaults to {@value QueryPlanBuilder#DEFAULT_TOP_N}
   * @return at most {@code n} rows
   */
  public List<CategoryCount> topN(FilterSpecification filter, String category, String n) {
    Map<String, String> params = new HashMap<>();
    params.put(QueryPlanBuilder.CATEGORY, category);
    params.put(QueryPlanBuilder.LIMIT, n);
    QueryPlan plan = planBuilder.build(filter, QueryKind.TOP_N, params);
    return executor.execute(plan, (rs, rowNum) -> new CategoryCount(rs.getString("category"), rs.getLong(COUNT)));
  }

  /**
   * Observed cells of a two-dimensional cross-tabulation, most frequent first.
   *
   * @param filter validated filter
   * @param dimension1 first dimension wire value
   * @param dimension2 second dimension wire value, may equal the first
   * @return heatmap cells
   */
  public List<HeatmapCell> heatmap(FilterSpecification filter, String dimension1, String dimension2) {
    Map<String, String> params = new HashMap<>();
    params.put(QueryPlanBuilder.DIMENSION_1, dimension1);
    params.put(QueryPlanBuilder.DIMENSION_2, dimension2);
    QueryPlan plan = planBuilder.build(filter, QueryKind.HEATMAP, params);
    return executor.execute(plan, (rs, rowNum) ->
        new HeatmapCell(rs.getString("x"), rs.getString("y"), rs.getLong(COUNT)));
  }

  /**
   * Operator / aircraft type / phase leaves, most frequent first.
   *
   * @param filter validated filter
   * @return hierarchy leaves without null keys
   */
  public List<HierarchyNode> hierarchy(FilterSpecification filter) {
    QueryPlan plan = planBuilder.build(filter, QueryKind.HIERARCHY);
    return executor.execute(plan, (rs, rowNum) -> new HierarchyNode(
        rs.getString(CanonicalField.OPERATOR.columnName()),
        rs.getString(CanonicalField.AIRCRAFT_TYPE.columnName()),
        rs.getString(CanonicalField.PHASE.columnName()),
        rs.getLong(COUNT)));
  }

  /**
   * Total incident count for a filter.
   *
   * @param filter validated filter
   * @return single statistics row
   */
  public IncidentStatistics statistics(FilterSpecification filter) {
    QueryPlan plan = planBuilder.build(filter, QueryKind.STATISTICS);
    List<Long> totals = executor.execute(plan, (rs, rowNum) -> rs.getLong(COUNT));
    return new IncidentStatistics(totals.isEmpty() ? 0L : totals.get(0));
  }

  /**
   * Incidents whose location resolves to airport coordinates, ordered by identifier.
   *
   * @param filter validated filter
   * @return located incidents; incidents without resolvable coordinates are left out
   */
  public List<IncidentLocation> locations(FilterSpecification filter) {
    QueryPlan plan = planBuilder.build(filter, QueryKind.GEOLOCATION);
    List<LocatedRow> rows = executor.execute(plan, (rs, rowNum) -> new LocatedRow(
        rs.getString(CanonicalField.UID.columnName()),
        JdbcValues.readDate(rs, CanonicalField.PERIOD_DATE.columnName()),
        rs.getString(CanonicalField.LOCATION.columnName()),
        rs.getString(CanonicalField.OPERATOR.columnName()),
        rs.getString(CanonicalField.PHASE.columnName()),
        rs.getString(CanonicalField.AIRCRAFT_TYPE.columnName())));
    if (rows.isEmpty()) {
      return List.of();
    }

    Set<String> codes = new LinkedHashSet<>();
    rows.forEach(row -> codes.add(row.location()));
    Map<String, AirportDetails> airports = airportLookup.lookupAirports(codes);

    List<IncidentLocation> located = new ArrayList<>();
    for (LocatedRow row : rows) {
      AirportDetails airport = airports.get(row.location().trim().toLowerCase(Locale.ROOT));
      if (airport == null || !airport.hasCoordinates()) {
        continue;
      }
      located.add(new IncidentLocation(
          row.uid(),
          row.date(),
          row.location(),
          row.operator(),
          row.phase(),
          row.aircraftType(),
          airport.latitude(),
          airport.longitude(),
          airport.name(),
          airport.city(),
          airport.country()));
    }
    return located;
  }

  /**
   * Year by month matrix, zero-filled for every month of every year in range.
   *
   * <p>The year range comes from the filter bounds when present, otherwise from the data. Buckets
   * that are not a {@code YYYY-MM} month are skipped.
   *
   * @param filter validated filter; its granularity is ignored
   * @return twelve cells per year, oldest year first
   */
  public List<SeasonalCell> seasonal(FilterSpecification filter) {
    FilterSpecification monthly = new FilterSpecification(
        filter.operators(),
        filter.phases(),
        filter.aircraftTypes(),
        filter.locations(),
        filter.startPeriod(),
        filter.endPeriod(),
        PeriodGranularity.MONTH);
    Map<YearMonth, Long> counts = new HashMap<>();
    for (PeriodCount row : overTime(monthly)) {
      YearMonth month = parseMonth(row.period());
      if (month != null) {
        counts.put(month, row.incidentCount());
      }
    }

    Integer firstYear = filter.startPeriod() != null
        ? Integer.valueOf(filter.startPeriod().getYear())
        : counts.keySet().stream().map(YearMonth::getYear).min(Integer::compare).orElse(null);
    Integer lastYear = filter.endPeriod() != null
        ? Integer.valueOf(filter.endPeriod().getYear())
        : counts.keySet().stream().map(YearMonth::getYear).max(Integer::compare).orElse(null);
    if (firstYear == null || lastYear == null) {
      return List.of();
    }

    List<SeasonalCell> cells = new ArrayList<>();
    for (int year = firstYear; year <= lastYear; year++) {
      for (Month month : Month.values()) {
        long count = counts.getOrDefault(YearMonth.of(year, month), 0L);
        cells.add(new SeasonalCell(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH), year, count));
      }
    }
    return cells;
  }

  /**
   * Identifiers matching a filter, newest first.
   *
   * @param filter validated filter
   * @return matching identifiers
   */
  public List<String> identifiers(FilterSpecification filter) {
    QueryPlan plan = planBuilder.build(filter, QueryKind.IDENTIFIERS);
    return executor.execute(plan, (rs, rowNum) -> rs.getString(CanonicalField.UID.columnName()));
  }

  /**
   * Raw-parameter form of {@link #overTime(FilterSpecification)}.
   *
   * @param raw request parameters
   * @return over-time envelope
   */
  public AggregationResponse<PeriodCount> overTime(Map<String, List<String>> raw) {
    FilterSpecification filter = parse(raw, QueryKind.OVER_TIME);
    return respond(QueryKind.OVER_TIME.tagValue(), overTime(filter));
  }

  /**
   * Raw-parameter form of {@link #topN(FilterSpecification, String, String)}.
   *
   * @param raw request parameters, including {@code category} and optional {@code n}
   * @return top-n envelope
   */
  public AggregationResponse<CategoryCount> topN(Map<String, List<String>> raw) {
    FilterSpecification filter = parse(raw, QueryKind.TOP_N);
    return respond(QueryKind.TOP_N.tagValue(), topN(
        filter,
        FilterParser.single(raw.get(QueryPlanBuilder.CATEGORY)),
        FilterParser.single(raw.get(QueryPlanBuilder.LIMIT))));
  }

  /**
   * Raw-parameter form of {@link #heatmap(FilterSpecification, String, String)}.
   *
   * @param raw request parameters, including {@code dimension1} and {@code dimension2}
   * @return heatmap envelope
   */
  public AggregationResponse<HeatmapCell> heatmap(Map<String, List<String>> raw) {
    FilterSpecification filter = parse(raw, QueryKind.HEATMAP);
    return respond(QueryKind.HEATMAP.tagValue(), heatmap(
        filter,
        FilterParser.single(raw.get(QueryPlanBuilder.DIMENSION_1)),
        FilterParser.single(raw.get(QueryPlanBuilder.DIMENSION_2))));
  }

  public AggregationResponse<HierarchyNode> hierarchy(Map<String, List<String>> raw) {
    return respond(QueryKind.HIERARCHY.tagValue(), hierarchy(parse(raw, QueryKind.HIERARCHY)));
  }

  public IncidentStatistics statistics(Map<String, List<String>> raw) {
    return statistics(parse(raw, QueryKind.STATISTICS));
  }

  public AggregationResponse<IncidentLocation> locations(Map<String, List<String>> raw) {
    return respond(QueryKind.GEOLOCATION.tagValue(), locations(parse(raw, QueryKind.GEOLOCATION)));
  }

  public AggregationResponse<SeasonalCell> seasonal(Map<String, List<String>> raw) {
    return respond(SEASONAL_KIND, seasonal(parse(raw, QueryKind.OVER_TIME)));
  }

  public List<String> identifiers(Map<String, List<String>> raw) {
    return identifiers(parse(raw, QueryKind.IDENTIFIERS));
  }

  /**
   * Parses the filter and pre-validates kind parameters so that every violation in the request is
   * reported together.
   */
  private FilterSpecification parse(Map<String, List<String>> raw, QueryKind kind) {
    Map<String, List<String>> params = raw == null ? Map.of() : raw;
    List<FieldViolation> violations = new ArrayList<>();
    FilterSpecification filter = null;
    try {
      filter = FilterParser.parse(params);
    } catch (ValidationException ex) {
      violations.addAll(ex.getViolations());
    }
    try {
      planBuilder.build(
          Objects.requireNonNullElseGet(filter, FilterSpecification::unrestricted),
          kind,
          kindParams(params));
    } catch (ValidationException ex) {
      violations.addAll(ex.getViolations());
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
    return filter;
  }

  private static Map<String, String> kindParams(Map<String, List<String>> raw) {
    Map<String, String> params = new HashMap<>();
    for (String name : List.of(
        QueryPlanBuilder.CATEGORY,
        QueryPlanBuilder.LIMIT,
        QueryPlanBuilder.DIMENSION_1,
        QueryPlanBuilder.DIMENSION_2)) {
      params.put(name, FilterParser.single(raw.get(name)));
    }
    return params;
  }

  private static YearMonth parseMonth(String period) {
    if (period == null || !MONTH_BUCKET.matcher(period).matches()) {
      log.warn("Skipping period bucket '{}' in seasonal matrix, not a YYYY-MM month", period);
      return null;
    }
    try {
      return YearMonth.parse(period);
    } catch (DateTimeParseException ex) {
      log.warn("Skipping period bucket '{}' in seasonal matrix: {}", period, ex.getMessage());
      return null;
    }
  }

  private static <T> AggregationResponse<T> respond(String kind, List<T> rows) {
    return new AggregationResponse<>(kind, rows, rows.size(), Instant.now().toString());
  }

  private record LocatedRow(
      String uid,
      LocalDate date,
      String location,
      String operator,
      String phase,
      String aircraftType) {}
}
