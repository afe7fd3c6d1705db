package com.incidentradar.analytics.incident;

import com.incidentradar.analytics.model.ClassificationResult;
import com.incidentradar.analytics.model.MergedIncident;
import com.incidentradar.analytics.model.SourceRecord;
import com.incidentradar.analytics.query.SqlDialect;
import com.incidentradar.analytics.source.CanonicalField;
import com.incidentradar.analytics.source.SourceKind;
import com.incidentradar.analytics.support.JdbcValues;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to source records and their classifications.
 *
 * <p>Native column names are renamed to canonical ones inside the SQL, so every row mapper here
 * reads the same labels whatever the source kind.
 */
@Repository
public class IncidentRepository {
  static final String CLASSIFICATION_COLUMNS =
      "c.id, c.source_uid, c.model_version, c.predicted_category, c.predicted_confidence, "
          + "c.final_category, c.is_complete, c.evaluator_id, c.processed_at";

  private static final String ORIGIN_PREFIX = "origin_";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final SqlDialect dialect;

  public IncidentRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlDialect dialect) {
    this.jdbcTemplate = jdbcTemplate;
    this.dialect = dialect;
  }

  /**
   * Loads one record from its source table.
   *
   * @param kind source kind resolved from the identifier
   * @param uid record identifier
   * @return canonical record, empty when no row matches
   */
  public Optional<SourceRecord> findRecord(SourceKind kind, String uid) {
    String columns = CanonicalField.recordFields().stream()
        .map(field -> column("s", kind, field) + " AS " + dialect.quote(field.columnName()))
        .collect(Collectors.joining(", "));
    String sql = "SELECT " + columns
        + " FROM " + dialect.quote(kind.table()) + " s"
        + " WHERE " + column("s", kind, CanonicalField.UID) + " = :uid";
    List<SourceRecord> rows = jdbcTemplate.query(
        sql, new MapSqlParameterSource("uid", uid), (rs, rowNum) -> mapRecord(rs));
    return rows.stream().findFirst();
  }

  /**
   * Pages through classification results by id.
   *
   * @param skip rows to skip
   * @param limit maximum rows
   * @param evaluatorId optional evaluator filter
   * @return classification page
   */
  public List<ClassificationResult> findClassificationResults(int skip, int limit, String evaluatorId) {
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("limit", limit)
        .addValue("skip", skip);
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(CLASSIFICATION_COLUMNS)
        .append(" FROM classification_results c");
    if (evaluatorId != null) {
      sql.append(" WHERE c.evaluator_id = :evaluatorId");
      params.addValue("evaluatorId", evaluatorId);
    }
    sql.append(" ORDER BY c.id LIMIT :limit OFFSET :skip");
    return jdbcTemplate.query(sql.toString(), params, CLASSIFICATION_MAPPER);
  }

  /**
   * Joins classifications with their origin rows for one source kind.
   *
   * <p>Rows come back ordered by classification id, so when an identifier has several
   * classifications the newest one is last.
   *
   * @param kind source kind shared by all identifiers
   * @param uids identifiers of that kind
   * @return merged rows ordered by classification id
   */
  public List<MergedIncident> findMerged(SourceKind kind, Collection<String> uids) {
    if (uids.isEmpty()) {
      return List.of();
    }
    List<String> origin = new ArrayList<>();
    for (CanonicalField field : CanonicalField.recordFields()) {
      if (field != CanonicalField.UID) {
        origin.add(column("s", kind, field) + " AS " + dialect.quote(ORIGIN_PREFIX + field.columnName()));
      }
    }
    String sql = "SELECT " + CLASSIFICATION_COLUMNS + ", " + String.join(", ", origin)
        + " FROM classification_results c"
        + " JOIN " + dialect.quote(kind.table()) + " s"
        + " ON " + column("s", kind, CanonicalField.UID) + " = c.source_uid"
        + " WHERE c.source_uid IN (:uids)"
        + " ORDER BY c.id";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("uids", new ArrayList<>(uids)), MERGED_MAPPER);
  }

  private String column(String alias, SourceKind kind, CanonicalField field) {
    return kind.nativeColumn(field)
        .map(name -> alias + "." + dialect.quote(name))
        .orElse("NULL");
  }

  private static SourceRecord mapRecord(ResultSet rs) throws SQLException {
    return new SourceRecord(
        rs.getString(CanonicalField.UID.columnName()),
        rs.getString(CanonicalField.DATE.columnName()),
        rs.getString(CanonicalField.PHASE.columnName()),
        rs.getString(CanonicalField.AIRCRAFT_TYPE.columnName()),
        rs.getString(CanonicalField.LOCATION.columnName()),
        rs.getString(CanonicalField.OPERATOR.columnName()),
        rs.getString(CanonicalField.NARRATIVE.columnName()));
  }

  private static final RowMapper<ClassificationResult> CLASSIFICATION_MAPPER = (rs, rowNum) ->
      new ClassificationResult(
          rs.getLong("id"),
          rs.getString("source_uid"),
          rs.getString("model_version"),
          rs.getString("predicted_category"),
          JdbcValues.readDouble(rs, "predicted_confidence"),
          rs.getString("final_category"),
          rs.getBoolean("is_complete"),
          rs.getString("evaluator_id"),
          rs.getString("processed_at"));

  private static final RowMapper<MergedIncident> MERGED_MAPPER = (rs, rowNum) ->
      new MergedIncident(
          rs.getLong("id"),
          rs.getString("source_uid"),
          rs.getString("model_version"),
          rs.getString("predicted_category"),
          JdbcValues.readDouble(rs, "predicted_confidence"),
          rs.getString("final_category"),
          rs.getBoolean("is_complete"),
          rs.getString("evaluator_id"),
          rs.getString("processed_at"),
          rs.getString(ORIGIN_PREFIX + CanonicalField.DATE.columnName()),
          rs.getString(ORIGIN_PREFIX + CanonicalField.PHASE.columnName()),
          rs.getString(ORIGIN_PREFIX + CanonicalField.AIRCRAFT_TYPE.columnName()),
          rs.getString(ORIGIN_PREFIX + CanonicalField.LOCATION.columnName()),
          rs.getString(ORIGIN_PREFIX + CanonicalField.OPERATOR.columnName()),
          rs.getString(ORIGIN_PREFIX + CanonicalField.NARRATIVE.columnName()));
}
