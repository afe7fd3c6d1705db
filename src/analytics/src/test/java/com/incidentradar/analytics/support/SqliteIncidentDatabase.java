package com.incidentradar.analytics.support;

import java.nio.file.Path;
import javax.sql.DataSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * File-backed SQLite incident database seeded with the shared fixture rows.
 *
 * <p>Each {@link DataSource#getConnection()} opens a new connection, so concurrent callers get
 * independent transactions against the same file. Transactions start with {@code BEGIN IMMEDIATE}
 * so a second writer waits for the write lock instead of failing with {@code SQLITE_BUSY}.
 */
public final class SqliteIncidentDatabase {
  private SqliteIncidentDatabase() {}

  public static DataSource create(Path directory) {
    SQLiteConfig config = new SQLiteConfig();
    config.setBusyTimeout(10_000);
    config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + directory.resolve("incidents.db").toAbsolutePath());

    ResourceDatabasePopulator populator = new ResourceDatabasePopulator(
        new ClassPathResource("db/sqlite-schema.sql"),
        new ClassPathResource("db/seed.sql"));
    DatabasePopulatorUtils.execute(populator, dataSource);
    return dataSource;
  }

  public static NamedParameterJdbcTemplate template(Path directory) {
    return new NamedParameterJdbcTemplate(create(directory));
  }
}
