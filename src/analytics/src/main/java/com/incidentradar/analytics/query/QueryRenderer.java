package com.incidentradar.analytics.query;

import com.incidentradar.analytics.query.QueryPlan.GroupKey;
import com.incidentradar.analytics.query.QueryPlan.Predicate;
import com.incidentradar.analytics.query.QueryPlan.SortKey;
import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.source.SourceKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Component;

/**
 * Renders {@link QueryPlan}s into parameterized SQL.
 *
 * <p>The plan's sources become a {@code UNION ALL} common table expression named {@code incidents}
 * whose columns carry canonical names. Identifiers only ever come from {@link SourceKind} and
 * {@link CanonicalField}; every filter value is a bind parameter.
 */
@Component
public class QueryRenderer {
  static final String PERIOD_START = "periodStart";
  static final String PERIOD_END = "periodEnd";
  static final String LIMIT = "limit";

  private final SqlDialect dialect;

  public QueryRenderer(SqlDialect dialect) {
    this.dialect = dialect;
  }

  /**
   * Renders a plan.
   *
   * @param plan plan with at least one source
   * @return SQL text and bind parameters
   */
  public SqlQuery render(QueryPlan plan) {
    if (plan.matchesNothing()) {
      throw new IllegalStateException("plan has no sources to read: " + plan.kind());
    }
    MapSqlParameterSource params = new MapSqlParameterSource();
    Set<CanonicalField> fields = plan.referencedFields();

    StringBuilder sql = new StringBuilder("WITH incidents AS (\n");
    sql.append(plan.sources().stream()
        .map(source -> sourceSelect(source, fields))
        .collect(Collectors.joining("\n  UNION ALL\n")));
    sql.append("\n)\nSELECT ").append(selectList(plan)).append("\nFROM incidents");

    List<String> conditions = conditions(plan, params);
    if (!conditions.isEmpty()) {
      sql.append("\nWHERE ").append(String.join("\n  AND ", conditions));
    }
    if (!plan.groupKeys().isEmpty()) {
      Set<String> expressions = new LinkedHashSet<>();
      plan.groupKeys().forEach(key -> expressions.add(groupExpression(key)));
      sql.append("\nGROUP BY ").append(String.join(", ", expressions));
    }
    if (!plan.ordering().isEmpty()) {
      sql.append("\nORDER BY ").append(plan.ordering().stream()
          .map(this::sortTerm)
          .collect(Collectors.joining(", ")));
    }
    if (plan.limit() != null) {
      sql.append("\nLIMIT :").append(LIMIT);
      params.addValue(LIMIT, plan.limit());
    }
    return new SqlQuery(sql.toString(), params);
  }

  private String sourceSelect(SourceKind source, Set<CanonicalField> fields) {
    String columns = fields.stream()
        .map(field -> source.nativeColumn(field)
            .map(dialect::quote)
            .orElse("NULL")
            + " AS " + dialect.quote(field.columnName()))
        .collect(Collectors.joining(", "));
    return "  SELECT " + columns + " FROM " + dialect.quote(source.table());
  }

  private String selectList(QueryPlan plan) {
    if (!plan.isAggregate()) {
      return plan.projection().stream()
          .map(field -> dialect.quote(field.columnName()))
          .collect(Collectors.joining(", "));
    }
    List<String> items = new ArrayList<>();
    plan.groupKeys().forEach(key -> items.add(groupExpression(key) + " AS " + dialect.quote(key.alias())));
    items.add("COUNT(*) AS " + dialect.quote(QueryPlan.COUNT_ALIAS));
    return String.join(", ", items);
  }

  private List<String> conditions(QueryPlan plan, MapSqlParameterSource params) {
    List<String> conditions = new ArrayList<>();
    for (CanonicalField field : plan.requiredFields()) {
      conditions.add(dialect.quote(field.columnName()) + " IS NOT NULL");
    }
    for (Predicate predicate : plan.predicates()) {
      String name = predicate.field().columnName();
      String column = dialect.quote(name);
      String target = predicate.caseInsensitive() ? "UPPER(" + column + ")" : column;
      conditions.add(target + " IN (:" + name + ")");
      params.addValue(name, new ArrayList<>(new TreeSet<>(predicate.values())));
    }
    PeriodWindow window = plan.window();
    if (window != null) {
      String date = dialect.quote(CanonicalField.PERIOD_DATE.columnName());
      if (window.startInclusive() != null) {
        conditions.add(date + " >= :" + PERIOD_START);
        params.addValue(PERIOD_START, dialect.dateValue(window.startInclusive()));
      }
      if (window.endExclusive() != null) {
        conditions.add(date + " < :" + PERIOD_END);
        params.addValue(PERIOD_END, dialect.dateValue(window.endExclusive()));
      }
    }
    return conditions;
  }

  private String groupExpression(GroupKey key) {
    String column = dialect.quote(key.field().columnName());
    return key.bucket() == null ? column : dialect.periodBucket(column, key.bucket());
  }

  private String sortTerm(SortKey key) {
    return dialect.quote(key.alias()) + (key.descending() ? " DESC" : " ASC");
  }
}
