package com.incidentradar.analytics.query;

import com.incidentradar.analytics.api.FieldViolation;
import com.incidentradar.analytics.api.ValidationException;
import com.incidentradar.analytics.query.QueryPlan.GroupKey;
import com.incidentradar.analytics.query.QueryPlan.Predicate;
import com.incidentradar.analytics.query.QueryPlan.SortKey;
import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.source.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Turns a filter and an aggregation kind into a {@link QueryPlan}.
 *
 * <p>Within one dimension the supplied values are alternatives; across dimensions they are all
 * required. Incidents without a cleaned period date never enter a plan. Sources that do not record
 * a constrained field are pruned because none of their rows could match.
 */
@Component
public class QueryPlanBuilder {
  public static final String CATEGORY = "category";
  public static final String LIMIT = "n";
  public static final String DIMENSION_1 = "dimension1";
  public static final String DIMENSION_2 = "dimension2";
  public static final int DEFAULT_TOP_N = 10;

  static final String PERIOD_ALIAS = "period";
  static final String CATEGORY_ALIAS = "category";
  static final String X_ALIAS = "x";
  static final String Y_ALIAS = "y";

  /**
   * Builds a plan without kind-specific parameters.
   *
   * @param filter validated filter
   * @param kind result shape
   * @return immutable plan
   */
  public QueryPlan build(FilterSpecification filter, QueryKind kind) {
    return build(filter, kind, Map.of());
  }

  /**
   * Builds a plan.
   *
   * @param filter validated filter
   * @param kind result shape
   * @param kindParams raw kind-specific parameters ({@code category}, {@code n},
   *     {@code dimension1}, {@code dimension2})
   * @return immutable plan
   * @throws ValidationException when a kind parameter is missing, malformed or not allowed
   */
  public QueryPlan build(FilterSpecification filter, QueryKind kind, Map<String, String> kindParams) {
    Map<String, String> params = kindParams == null ? Map.of() : kindParams;
    List<Predicate> predicates = predicatesFor(filter);
    List<CanonicalField> required =
        new ArrayList<>(List.of(CanonicalField.UID, CanonicalField.PERIOD_DATE));
    List<GroupKey> groupKeys = new ArrayList<>();
    List<CanonicalField> projection = new ArrayList<>();
    List<SortKey> ordering = new ArrayList<>();
    Integer limit = null;

    switch (kind) {
      case OVER_TIME -> {
        groupKeys.add(new GroupKey(PERIOD_ALIAS, CanonicalField.PERIOD_DATE, filter.granularity()));
        ordering.add(SortKey.asc(PERIOD_ALIAS));
      }
      case TOP_N -> {
        List<FieldViolation> violations = new ArrayList<>();
        CategoryDimension category = dimension(params, CATEGORY, violations);
        Integer n = topN(params.get(LIMIT), violations);
        failOn(violations);
        required.add(category.field());
        groupKeys.add(new GroupKey(CATEGORY_ALIAS, category.field(), null));
        ordering.add(SortKey.desc(QueryPlan.COUNT_ALIAS));
        ordering.add(SortKey.asc(CATEGORY_ALIAS));
        limit = n;
      }
      case HEATMAP -> {
        List<FieldViolation> violations = new ArrayList<>();
        CategoryDimension first = dimension(params, DIMENSION_1, violations);
        CategoryDimension second = dimension(params, DIMENSION_2, violations);
        failOn(violations);
        required.add(first.field());
        required.add(second.field());
        groupKeys.add(new GroupKey(X_ALIAS, first.field(), null));
        groupKeys.add(new GroupKey(Y_ALIAS, second.field(), null));
        ordering.add(SortKey.desc(QueryPlan.COUNT_ALIAS));
        ordering.add(SortKey.asc(X_ALIAS));
        ordering.add(SortKey.asc(Y_ALIAS));
      }
      case HIERARCHY -> {
        for (CanonicalField field : List.of(
            CanonicalField.OPERATOR, CanonicalField.AIRCRAFT_TYPE, CanonicalField.PHASE)) {
          required.add(field);
          groupKeys.add(new GroupKey(field.columnName(), field, null));
        }
        ordering.add(SortKey.desc(QueryPlan.COUNT_ALIAS));
        groupKeys.forEach(key -> ordering.add(SortKey.asc(key.alias())));
      }
      case STATISTICS -> {
        // single COUNT(*) row
      }
      case GEOLOCATION -> {
        required.add(CanonicalField.LOCATION);
        projection.addAll(List.of(
            CanonicalField.UID,
            CanonicalField.PERIOD_DATE,
            CanonicalField.LOCATION,
            CanonicalField.OPERATOR,
            CanonicalField.PHASE,
            CanonicalField.AIRCRAFT_TYPE));
        ordering.add(SortKey.asc(CanonicalField.UID.columnName()));
      }
      case IDENTIFIERS -> {
        projection.addAll(List.of(CanonicalField.UID, CanonicalField.PERIOD_DATE));
        ordering.add(SortKey.desc(CanonicalField.PERIOD_DATE.columnName()));
        ordering.add(SortKey.asc(CanonicalField.UID.columnName()));
      }
      default -> throw new IllegalArgumentException("unsupported query kind " + kind);
    }

    List<CanonicalField> distinctRequired = List.copyOf(new LinkedHashSet<>(required));
    return new QueryPlan(
        kind,
        eligibleSources(predicates, distinctRequired),
        predicates,
        distinctRequired,
        filter.periodWindow(),
        groupKeys,
        projection,
        ordering,
        limit);
  }

  private static List<Predicate> predicatesFor(FilterSpecification filter) {
    List<Predicate> predicates = new ArrayList<>();
    for (CategoryDimension dimension : CategoryDimension.values()) {
      Set<String> values = filter.valuesFor(dimension);
      if (!values.isEmpty()) {
        predicates.add(
            new Predicate(dimension.field(), values, dimension == CategoryDimension.LOCATION));
      }
    }
    return predicates;
  }

  private static List<SourceKind> eligibleSources(
      List<Predicate> predicates, List<CanonicalField> required) {
    Set<CanonicalField> constrained = new LinkedHashSet<>(required);
    predicates.forEach(predicate -> constrained.add(predicate.field()));
    return Stream.of(SourceKind.values())
        .filter(kind -> constrained.stream().allMatch(kind::records))
        .toList();
  }

  private static CategoryDimension dimension(
      Map<String, String> params, String name, List<FieldViolation> violations) {
    String raw = params.get(name);
    if (raw == null || raw.isBlank()) {
      violations.add(new FieldViolation(
          name, name + " is required, one of: " + CategoryDimension.allowedValues()));
      return null;
    }
    return CategoryDimension.fromWire(raw).orElseGet(() -> {
      violations.add(new FieldViolation(
          name, name + " must be one of: " + CategoryDimension.allowedValues()));
      return null;
    });
  }

  private static Integer topN(String raw, List<FieldViolation> violations) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_TOP_N;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed < 1) {
        violations.add(new FieldViolation(LIMIT, "n must be >= 1"));
        return null;
      }
      return parsed;
    } catch (NumberFormatException ex) {
      violations.add(new FieldViolation(LIMIT, "n must be an integer"));
      return null;
    }
  }

  private static void failOn(List<FieldViolation> violations) {
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }
}
