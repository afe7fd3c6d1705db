package com.incidentradar.analytics.config;

import com.incidentradar.analytics.query.PostgresDialect;
import com.incidentradar.analytics.query.SqlDialect;
import com.incidentradar.analytics.query.SqliteDialect;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the SQL dialect used by plan rendering.
 *
 * <p>The DataSource, {@code NamedParameterJdbcTemplate} and transaction template come from Spring
 * Boot auto-configuration.
 */
@Configuration
public class DatabaseConfig {
  private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

  /**
   * Selects the dialect named by {@code analytics.database.dialect}.
   *
   * @param properties typed analytics properties
   * @return dialect implementation
   */
  @Bean
  public SqlDialect sqlDialect(AnalyticsProperties properties) {
    String name = properties.getDatabase().getDialect();
    SqlDialect dialect = switch (name == null ? "" : name.trim().toLowerCase(Locale.ROOT)) {
      case "postgres", "postgresql" -> new PostgresDialect();
      case "sqlite" -> new SqliteDialect();
      default -> throw new IllegalStateException(
          "analytics.database.dialect must be postgres or sqlite, got '" + name + "'");
    };
    log.info("Incident database dialect configured: {}", dialect.name());
    return dialect;
  }
}
