package com.incidentradar.analytics.query;

import com.incidentradar.analytics.api.FieldViolation;
import com.incidentradar.analytics.api.ValidationException;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing and validating incident filter parameters.
 *
 * <p>Parsing collects every violation before failing, so a client sees all rejected fields at once.
 */
public final class FilterParser {
  public static final String OPERATORS = "operators";
  public static final String PHASES = "phases";
  public static final String AIRCRAFT_TYPES = "aircraftTypes";
  public static final String LOCATIONS = "locations";
  public static final String START_PERIOD = "startPeriod";
  public static final String END_PERIOD = "endPeriod";
  public static final String GRANULARITY = "granularity";

  private static final Pattern PERIOD_PATTERN = Pattern.compile("^(\\d{4})-(\\d{2})$");

  private FilterParser() {}

  /**
   * Parses a raw parameter bundle into a filter specification.
   *
   * @param raw parameter name to raw values; unknown names are ignored
   * @return validated filter
   * @throws ValidationException listing every rejected field
   */
  public static FilterSpecification parse(Map<String, List<String>> raw) {
    Map<String, List<String>> params = raw == null ? Map.of() : raw;
    List<FieldViolation> violations = new ArrayList<>();

    Set<String> operators = parseValues(params.get(OPERATORS), false);
    Set<String> phases = parseValues(params.get(PHASES), false);
    Set<String> aircraftTypes = parseValues(params.get(AIRCRAFT_TYPES), false);
    Set<String> locations = parseValues(params.get(LOCATIONS), true);

    YearMonth start = parsePeriod(START_PERIOD, single(params.get(START_PERIOD)), violations);
    YearMonth end = parsePeriod(END_PERIOD, single(params.get(END_PERIOD)), violations);
    if (start != null && end != null && start.isAfter(end)) {
      violations.add(new FieldViolation(START_PERIOD, "startPeriod must be <= endPeriod"));
    }

    PeriodGranularity granularity = PeriodGranularity.MONTH;
    String granularityRaw = single(params.get(GRANULARITY));
    if (granularityRaw != null) {
      granularity = PeriodGranularity.fromWire(granularityRaw).orElse(null);
      if (granularity == null) {
        violations.add(new FieldViolation(GRANULARITY, "granularity must be one of: year,month"));
      }
    }

    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
    return new FilterSpecification(
        operators, phases, aircraftTypes, locations, start, end, granularity);
  }

  /**
   * Parses one {@code YYYY-MM} period bound.
   *
   * @param field wire name used in error messages
   * @param raw raw value, nullable
   * @return parsed month or {@code null} when absent
   * @throws ValidationException when the value is malformed
   */
  public static YearMonth parsePeriod(String field, String raw) {
    List<FieldViolation> violations = new ArrayList<>();
    YearMonth parsed = parsePeriod(field, raw, violations);
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
    return parsed;
  }

  /**
   * Parses and clamps pagination limits.
   *
   * @param raw raw limit query value
   * @param defaultLimit default value when absent
   * @param maxLimit hard upper bound
   * @return effective limit
   */
  public static int parseLimit(String raw, int defaultLimit, int maxLimit) {
    if (raw == null || raw.isBlank()) {
      return defaultLimit;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed <= 0) {
        throw new ValidationException("limit", "limit must be > 0");
      }
      return Math.min(parsed, maxLimit);
    } catch (NumberFormatException ex) {
      throw new ValidationException("limit", "limit must be an integer");
    }
  }

  /**
   * Parses a pagination offset.
   *
   * @param raw raw skip query value
   * @return offset, {@code 0} when absent
   */
  public static int parseSkip(String raw) {
    if (raw == null || raw.isBlank()) {
      return 0;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      if (parsed < 0) {
        throw new ValidationException("skip", "skip must be >= 0");
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new ValidationException("skip", "skip must be an integer");
    }
  }

  /**
   * Returns the first non-blank value of a repeatable parameter.
   *
   * @param values raw values, nullable
   * @return trimmed value or {@code null}
   */
  public static String single(List<String> values) {
    if (values == null) {
      return null;
    }
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  private static YearMonth parsePeriod(String field, String raw, List<FieldViolation> violations) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    Matcher matcher = PERIOD_PATTERN.matcher(raw.trim());
    if (!matcher.matches()) {
      violations.add(new FieldViolation(field, field + " must use format YYYY-MM"));
      return null;
    }
    int month = Integer.parseInt(matcher.group(2));
    if (month < 1 || month > 12) {
      violations.add(new FieldViolation(field, field + " must be a valid calendar month"));
      return null;
    }
    return YearMonth.of(Integer.parseInt(matcher.group(1)), month);
  }

  private static Set<String> parseValues(List<String> raw, boolean upperCase) {
    if (raw == null || raw.isEmpty()) {
      return Set.of();
    }
    Set<String> values = new LinkedHashSet<>();
    for (String value : raw) {
      if (value == null || value.isBlank()) {
        continue;
      }
      String trimmed = value.trim();
      values.add(upperCase ? trimmed.toUpperCase(Locale.ROOT) : trimmed);
    }
    return Collections.unmodifiableSet(values);
  }
}
