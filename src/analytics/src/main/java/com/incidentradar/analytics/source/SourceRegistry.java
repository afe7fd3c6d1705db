package com.incidentradar.analytics.source;

import com.incidentradar.analytics.api.UnknownSourceKindException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Static lookup from identifier prefix to source kind and column mapping.
 */
@Component
public class SourceRegistry {
  public static final char SEPARATOR = '_';

  private static final Map<String, SourceKind> BY_PREFIX =
      Stream.of(SourceKind.values())
          .collect(Collectors.toUnmodifiableMap(SourceKind::prefix, Function.identity()));

  /**
   * Resolves an identifier such as {@code asrs_1234} to its source.
   *
   * @param identifier opaque record identifier
   * @return source kind and canonical column mapping
   * @throws UnknownSourceKindException when the identifier has no separator or an unknown prefix
   */
  public ResolvedSource resolve(String identifier) {
    SourceKind kind = findKind(identifier)
        .orElseThrow(() -> new UnknownSourceKindException(identifier, registeredPrefixes()));
    return new ResolvedSource(kind, kind.columnMap());
  }

  /**
   * Groups identifiers by source kind without failing on unknown prefixes.
   *
   * @param identifiers identifiers to partition
   * @return partitions per kind plus the identifiers that could not be resolved
   */
  public BatchResolution resolveBatch(Collection<String> identifiers) {
    Map<SourceKind, Set<String>> partitions = new EnumMap<>(SourceKind.class);
    List<String> unresolved = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (String identifier : identifiers) {
      if (identifier == null || !seen.add(identifier)) {
        continue;
      }
      Optional<SourceKind> kind = findKind(identifier);
      if (kind.isPresent()) {
        partitions.computeIfAbsent(kind.get(), ignored -> new LinkedHashSet<>()).add(identifier);
      } else {
        unresolved.add(identifier);
      }
    }
    return new BatchResolution(
        Collections.unmodifiableMap(partitions), Collections.unmodifiableList(unresolved));
  }

  /**
   * Lists the prefixes accepted by {@link #resolve(String)}.
   *
   * @return registered prefixes in declaration order
   */
  public List<String> registeredPrefixes() {
    return Stream.of(SourceKind.values()).map(SourceKind::prefix).toList();
  }

  private Optional<SourceKind> findKind(String identifier) {
    if (identifier == null) {
      return Optional.empty();
    }
    int separator = identifier.indexOf(SEPARATOR);
    if (separator <= 0) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_PREFIX.get(identifier.substring(0, separator)));
  }
}
