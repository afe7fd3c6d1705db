package com.incidentradar.analytics.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DatabaseConfigTest {

  private final DatabaseConfig config = new DatabaseConfig();

  @Test
  void selectsDialectByName() {
    AnalyticsProperties properties = new AnalyticsProperties();
    assertEquals("postgres", config.sqlDialect(properties).name());

    properties.getDatabase().setDialect(" SQLite ");
    assertEquals("sqlite", config.sqlDialect(properties).name());

    properties.getDatabase().setDialect("PostgreSQL");
    assertEquals("postgres", config.sqlDialect(properties).name());
  }

  @Test
  void rejectsUnknownDialect() {
    AnalyticsProperties properties = new AnalyticsProperties();
    properties.getDatabase().setDialect("oracle");

    assertThrows(IllegalStateException.class, () -> config.sqlDialect(properties));
  }
}
