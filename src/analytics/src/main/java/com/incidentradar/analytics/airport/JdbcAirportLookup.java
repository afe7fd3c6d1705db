package com.incidentradar.analytics.airport;

import com.incidentradar.analytics.config.AnalyticsProperties;
import com.incidentradar.analytics.support.JdbcValues;
import com.incidentradar.analytics.support.Partitions;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * JDBC implementation of {@link AirportLookup} over the airport reference table.
 *
 * <p>Reference rows never change at runtime, so found airports are kept in a small in-memory LRU
 * cache. Codes that are not found are not cached.
 */
@Repository
public class JdbcAirportLookup implements AirportLookup {
  private static final Logger log = LoggerFactory.getLogger(JdbcAirportLookup.class);
  private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");
  private static final int CHUNK_SIZE = 500;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final String selectByCodesSql;
  private final Map<String, AirportDetails> cache;

  /**
   * Creates the lookup.
   *
   * @param jdbcTemplate template over the incident database
   * @param properties typed analytics properties
   */
  public JdbcAirportLookup(NamedParameterJdbcTemplate jdbcTemplate, AnalyticsProperties properties) {
    String table = properties.getAirports().getTable();
    if (table == null || !TABLE_NAME.matcher(table).matches()) {
      throw new IllegalStateException("analytics.airports.table is not a valid table name: " + table);
    }
    this.jdbcTemplate = jdbcTemplate;
    this.selectByCodesSql =
        "SELECT icao_code, iata_code, name, city, country, lat, lon FROM " + table
            + " WHERE LOWER(icao_code) IN (:codes) OR LOWER(iata_code) IN (:codes)";

    int maxEntries = Math.max(0, properties.getAirports().getCacheSize());
    this.cache =
        Collections.synchronizedMap(new LinkedHashMap<>(1024, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, AirportDetails> eldest) {
            return size() > maxEntries;
          }
        });
  }

  @Override
  public Map<String, AirportDetails> lookupAirports(Collection<String> codes) {
    Set<String> requested = new LinkedHashSet<>();
    for (String code : codes) {
      if (code != null && !code.isBlank()) {
        requested.add(code.trim().toLowerCase(Locale.ROOT));
      }
    }
    Map<String, AirportDetails> found = new LinkedHashMap<>();
    List<String> misses = new ArrayList<>();
    for (String code : requested) {
      AirportDetails cached = cache.get(code);
      if (cached != null) {
        found.put(code, cached);
      } else {
        misses.add(code);
      }
    }

    for (List<String> chunk : Partitions.of(misses, CHUNK_SIZE)) {
      Set<String> wanted = Set.copyOf(chunk);
      jdbcTemplate.query(selectByCodesSql, new MapSqlParameterSource("codes", chunk), rs -> {
        AirportDetails airport = map(rs);
        for (String key : new String[] {lower(airport.icaoCode()), lower(airport.iataCode())}) {
          if (key != null && wanted.contains(key) && !found.containsKey(key)) {
            found.put(key, airport);
            cache.put(key, airport);
          }
        }
      });
    }
    if (found.size() < requested.size()) {
      log.debug("Airport lookup resolved {}/{} codes", found.size(), requested.size());
    }
    return found;
  }

  private static AirportDetails map(ResultSet rs) throws SQLException {
    return new AirportDetails(
        rs.getString("icao_code"),
        rs.getString("iata_code"),
        rs.getString("name"),
        rs.getString("city"),
        rs.getString("country"),
        JdbcValues.readDouble(rs, "lat"),
        JdbcValues.readDouble(rs, "lon"));
  }

  private static String lower(String value) {
    return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
  }
}
