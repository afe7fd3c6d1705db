package com.incidentradar.analytics.support;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Null-aware column readers shared by the row mappers.
 */
public final class JdbcValues {
  private JdbcValues() {}

  /**
   * Reads a cleaned date stored as {@code DATE}, {@code TIMESTAMP} or ISO-8601 text.
   *
   * @param rs current row
   * @param column column label
   * @return calendar date, {@code null} when absent or not a date
   * @throws SQLException on driver failure
   */
  public static LocalDate readDate(ResultSet rs, String column) throws SQLException {
    String raw = rs.getString(column);
    if (raw == null || raw.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(raw.substring(0, 10));
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  public static Double readDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
