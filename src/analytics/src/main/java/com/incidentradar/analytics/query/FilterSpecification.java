package com.incidentradar.analytics.query;

import java.time.YearMonth;
import java.util.Set;

/**
 * Immutable slice of incident data requested by one call.
 *
 * <p>An empty value set means the dimension is unrestricted. Locations are held upper-cased.
 *
 * @param operators accepted operators
 * @param phases accepted flight phases
 * @param aircraftTypes accepted aircraft types
 * @param locations accepted location codes
 * @param startPeriod first month of the window (inclusive), nullable
 * @param endPeriod last month of the window (inclusive), nullable
 * @param granularity bucket size for time-series aggregations
 */
public record FilterSpecification(
    Set<String> operators,
    Set<String> phases,
    Set<String> aircraftTypes,
    Set<String> locations,
    YearMonth startPeriod,
    YearMonth endPeriod,
    PeriodGranularity granularity) {

  public FilterSpecification {
    operators = Set.copyOf(operators);
    phases = Set.copyOf(phases);
    aircraftTypes = Set.copyOf(aircraftTypes);
    locations = Set.copyOf(locations);
    if (granularity == null) {
      granularity = PeriodGranularity.MONTH;
    }
    if (startPeriod != null && endPeriod != null && startPeriod.isAfter(endPeriod)) {
      throw new IllegalArgumentException("startPeriod must not be after endPeriod");
    }
  }

  /**
   * Filter that restricts nothing.
   *
   * @return unrestricted filter with monthly granularity
   */
  public static FilterSpecification unrestricted() {
    return new FilterSpecification(
        Set.of(), Set.of(), Set.of(), Set.of(), null, null, PeriodGranularity.MONTH);
  }

  /**
   * Returns the accepted values for one dimension.
   *
   * @param dimension filter dimension
   * @return accepted values, empty when unrestricted
   */
  public Set<String> valuesFor(CategoryDimension dimension) {
    return switch (dimension) {
      case OPERATOR -> operators;
      case PHASE -> phases;
      case AIRCRAFT_TYPE -> aircraftTypes;
      case LOCATION -> locations;
    };
  }

  public PeriodWindow periodWindow() {
    return PeriodWindow.of(startPeriod, endPeriod);
  }
}
