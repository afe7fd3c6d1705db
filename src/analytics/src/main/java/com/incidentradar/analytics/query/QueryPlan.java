package com.incidentradar.analytics.query;

import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.source.SourceKind;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative description of one database query over the canonical incident view.
 *
 * <p>A plan never holds SQL; {@link QueryRenderer} turns it into a parameterized statement.
 *
 * @param kind result shape
 * @param sources source tables to read; empty when no source can match
 * @param predicates set-membership restrictions, combined with AND
 * @param requiredFields fields that must be non-null
 * @param window period restriction on the cleaned period date, nullable
 * @param groupKeys grouping expressions; empty for listings and single-row counts
 * @param projection fields selected per row by listing plans
 * @param ordering sort keys by output alias
 * @param limit maximum row count, nullable
 */
public record QueryPlan(
    QueryKind kind,
    List<SourceKind> sources,
    List<Predicate> predicates,
    List<CanonicalField> requiredFields,
    PeriodWindow window,
    List<GroupKey> groupKeys,
    List<CanonicalField> projection,
    List<SortKey> ordering,
    Integer limit) {

  public static final String COUNT_ALIAS = "incident_count";

  public QueryPlan {
    sources = List.copyOf(sources);
    predicates = List.copyOf(predicates);
    requiredFields = List.copyOf(requiredFields);
    groupKeys = List.copyOf(groupKeys);
    projection = List.copyOf(projection);
    ordering = List.copyOf(ordering);
  }

  public boolean isAggregate() {
    return projection.isEmpty();
  }

  /**
   * True when source pruning left nothing to read.
   *
   * @return whether the plan can only produce an empty result
   */
  public boolean matchesNothing() {
    return sources.isEmpty();
  }

  /**
   * Canonical fields any part of the plan reads.
   *
   * @return referenced fields in a stable order
   */
  public Set<CanonicalField> referencedFields() {
    Set<CanonicalField> fields = new LinkedHashSet<>(requiredFields);
    predicates.forEach(predicate -> fields.add(predicate.field()));
    if (window != null) {
      fields.add(CanonicalField.PERIOD_DATE);
    }
    groupKeys.forEach(key -> fields.add(key.field()));
    fields.addAll(projection);
    return fields;
  }

  /**
   * Membership restriction on one field.
   *
   * @param field restricted field
   * @param values accepted values, never empty
   * @param caseInsensitive compare against the upper-cased column value
   */
  public record Predicate(CanonicalField field, Set<String> values, boolean caseInsensitive) {
    public Predicate {
      values = Set.copyOf(values);
    }
  }

  /**
   * One grouping expression.
   *
   * @param alias output column name
   * @param field grouped field
   * @param bucket date truncation, only for {@link CanonicalField#PERIOD_DATE}; nullable
   */
  public record GroupKey(String alias, CanonicalField field, PeriodGranularity bucket) {}

  /**
   * Sort key referencing an output alias.
   *
   * @param alias output column name
   * @param descending sort direction
   */
  public record SortKey(String alias, boolean descending) {
    public static SortKey asc(String alias) {
      return new SortKey(alias, false);
    }

    public static SortKey desc(String alias) {
      return new SortKey(alias, true);
    }
  }
}
