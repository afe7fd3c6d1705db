package com.incidentradar.analytics.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration container for the analytics API service.
 *
 * <p>Values are bound from {@code analytics.*} in {@code application.yml} and environment
 * variables.
 */
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {
  private final Database database = new Database();
  private final Api api = new Api();
  private final Bulk bulk = new Bulk();
  private final Airports airports = new Airports();

  public Database getDatabase() {
    return database;
  }

  public Api getApi() {
    return api;
  }

  public Bulk getBulk() {
    return bulk;
  }

  public Airports getAirports() {
    return airports;
  }

  /** SQL dialect of the incident database ({@code postgres} or {@code sqlite}). */
  public static class Database {
    private String dialect = "postgres";

    public String getDialect() {
      return dialect;
    }

    public void setDialect(String dialect) {
      this.dialect = dialect;
    }
  }

  /** Pagination defaults for listing endpoints. */
  public static class Api {
    private int defaultLimit = 100;
    private int maxLimit = 1000;

    public int getDefaultLimit() {
      return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
      return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
      this.maxLimit = maxLimit;
    }
  }

  /** Bulk join retrieval limits. */
  public static class Bulk {
    private int maxIdentifiers = 5000;
    private int chunkSize = 500;

    public int getMaxIdentifiers() {
      return maxIdentifiers;
    }

    public void setMaxIdentifiers(int maxIdentifiers) {
      this.maxIdentifiers = maxIdentifiers;
    }

    public int getChunkSize() {
      return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
    }
  }

  /** Airport reference lookup settings. */
  public static class Airports {
    private String table = "airport_location";
    private int cacheSize = 10000;

    public String getTable() {
      return table;
    }

    public void setTable(String table) {
      this.table = table;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }
  }
}
