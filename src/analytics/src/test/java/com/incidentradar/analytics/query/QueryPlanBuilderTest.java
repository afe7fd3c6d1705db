package com.incidentradar.analytics.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.incidentradar.analytics.api.FieldViolation;
import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.query.QueryPlan.SortKey;
import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.source.SourceKind;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class QueryPlanBuilderTest {

  private final QueryPlanBuilder builder = new QueryPlanBuilder();

  @Test
  void overTimeReadsEverySourceAndBucketsByGranularity() {
    FilterSpecification filter = FilterParser.parse(Map.of(FilterParser.GRANULARITY, List.of("year")));

    QueryPlan plan = builder.build(filter, QueryKind.OVER_TIME);

    assertEquals(List.of(SourceKind.ASN, SourceKind.ASRS, SourceKind.PCI), plan.sources());
    assertEquals(PeriodGranularity.YEAR, plan.groupKeys().get(0).bucket());
    assertEquals(List.of(SortKey.asc("period")), plan.ordering());
    assertEquals(List.of(CanonicalField.UID, CanonicalField.PERIOD_DATE), plan.requiredFields());
    assertEquals(CanonicalField.PERIOD_DATE, plan.groupKeys().get(0).field());
    assertNull(plan.limit());
  }

  @Test
  void phaseFilterPrunesSourceWithoutPhase() {
    FilterSpecification filter = FilterParser.parse(Map.of(FilterParser.PHASES, List.of("CRUISE")));

    QueryPlan plan = builder.build(filter, QueryKind.STATISTICS);

    assertEquals(List.of(SourceKind.ASN, SourceKind.ASRS), plan.sources());
  }

  @Test
  void phaseGroupingPrunesSourceWithoutPhase() {
    QueryPlan plan = builder.build(
        FilterSpecification.unrestricted(), QueryKind.TOP_N, Map.of(QueryPlanBuilder.CATEGORY, "phase"));

    assertEquals(List.of(SourceKind.ASN, SourceKind.ASRS), plan.sources());
    assertTrue(plan.requiredFields().contains(CanonicalField.PHASE));
  }

  @Test
  void topNDefaultsToTenAndBreaksTiesByValue() {
    QueryPlan plan = builder.build(
        FilterSpecification.unrestricted(), QueryKind.TOP_N, Map.of(QueryPlanBuilder.CATEGORY, "operator"));

    assertEquals(QueryPlanBuilder.DEFAULT_TOP_N, plan.limit());
    assertEquals(List.of(SortKey.desc(QueryPlan.COUNT_ALIAS), SortKey.asc("category")), plan.ordering());
  }

  @Test
  void topNRejectsMissingCategoryAndBadLimitTogether() {
    ValidationException ex = assertThrows(ValidationException.class, () -> builder.build(
        FilterSpecification.unrestricted(), QueryKind.TOP_N, Map.of(QueryPlanBuilder.LIMIT, "0")));

    assertEquals(
        List.of(QueryPlanBuilder.CATEGORY, QueryPlanBuilder.LIMIT),
        ex.getViolations().stream().map(FieldViolation::field).toList());
  }

  @Test
  void topNRejectsUnknownCategory() {
    assertThrows(ValidationException.class, () -> builder.build(
        FilterSpecification.unrestricted(), QueryKind.TOP_N, Map.of(QueryPlanBuilder.CATEGORY, "narrative")));
  }

  @Test
  void heatmapAcceptsEqualDimensions() {
    QueryPlan plan = builder.build(FilterSpecification.unrestricted(), QueryKind.HEATMAP, Map.of(
        QueryPlanBuilder.DIMENSION_1, "operator",
        QueryPlanBuilder.DIMENSION_2, "operator"));

    assertEquals(2, plan.groupKeys().size());
    assertEquals(
        List.of(CanonicalField.UID, CanonicalField.PERIOD_DATE, CanonicalField.OPERATOR),
        plan.requiredFields());
  }

  @Test
  void heatmapRequiresBothDimensions() {
    ValidationException ex = assertThrows(ValidationException.class, () -> builder.build(
        FilterSpecification.unrestricted(), QueryKind.HEATMAP, Map.of(QueryPlanBuilder.DIMENSION_1, "phase")));

    assertEquals(QueryPlanBuilder.DIMENSION_2, ex.getViolations().get(0).field());
  }

  @Test
  void hierarchyRequiresAllThreeKeys() {
    QueryPlan plan = builder.build(FilterSpecification.unrestricted(), QueryKind.HIERARCHY);

    assertEquals(
        Set.of(CanonicalField.OPERATOR, CanonicalField.AIRCRAFT_TYPE, CanonicalField.PHASE),
        Set.copyOf(plan.groupKeys().stream().map(QueryPlan.GroupKey::field).toList()));
    assertEquals(List.of(SourceKind.ASN, SourceKind.ASRS), plan.sources());
  }

  @Test
  void geolocationProjectsRowsOrderedByUid() {
    QueryPlan plan = builder.build(FilterSpecification.unrestricted(), QueryKind.GEOLOCATION);

    assertFalse(plan.isAggregate());
    assertTrue(plan.requiredFields().contains(CanonicalField.LOCATION));
    assertEquals(List.of(SortKey.asc("uid")), plan.ordering());
  }

  @Test
  void phaseFilterNeverReadsPci() {
    FilterSpecification filter = FilterParser.parse(Map.of(FilterParser.PHASES, List.of("CRUISE")));

    QueryPlan plan = builder.build(filter, QueryKind.TOP_N, Map.of(QueryPlanBuilder.CATEGORY, "phase"));

    assertTrue(plan.sources().stream().noneMatch(SourceKind.PCI::equals));
  }

  @Test
  void windowComesFromFilter() {
    FilterSpecification filter = FilterParser.parse(Map.of(FilterParser.START_PERIOD, List.of("2024-02")));

    QueryPlan plan = builder.build(filter, QueryKind.IDENTIFIERS);

    assertEquals(filter.periodWindow(), plan.window());
    assertEquals(List.of(SortKey.desc("period_date"), SortKey.asc("uid")), plan.ordering());
  }
}
