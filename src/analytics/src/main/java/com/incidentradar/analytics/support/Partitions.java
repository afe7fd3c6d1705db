package com.incidentradar.analytics.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits bind-value lists so a single {@code IN (...)} never exceeds driver parameter limits.
 */
public final class Partitions {
  private Partitions() {}

  /**
   * Splits values into consecutive chunks.
   *
   * @param values values to split, iteration order preserved
   * @param size maximum chunk size, at least 1
   * @param <T> element type
   * @return chunks, empty when {@code values} is empty
   */
  public static <T> List<List<T>> of(Collection<T> values, int size) {
    int chunkSize = Math.max(1, size);
    List<List<T>> chunks = new ArrayList<>();
    List<T> current = new ArrayList<>(Math.min(chunkSize, values.size()));
    for (T value : values) {
      current.add(value);
      if (current.size() == chunkSize) {
        chunks.add(current);
        current = new ArrayList<>(chunkSize);
      }
    }
    if (!current.isEmpty()) {
      chunks.add(current);
    }
    return chunks;
  }
}
