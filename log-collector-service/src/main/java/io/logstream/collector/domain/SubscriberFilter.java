package io.logstream.collector.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Per-subscriber predicate. Empty sets and an absent trace id match everything; the three
 * dimensions are combined with AND.
 */
public record SubscriberFilter(Set<String> projects, Set<String> levels, String traceId) {

  public static final SubscriberFilter ALL = new SubscriberFilter(Set.of(), Set.of(), null);

  public SubscriberFilter {
    projects = projects == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(projects));
    levels = levels == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(levels));
    traceId = traceId == null || traceId.isBlank() ? null : traceId;
  }

  /**
   * Builds a filter from comma separated connection parameters. Level names are matched
   * case-insensitively.
   */
  public static SubscriberFilter fromParameters(String projects, String levels, String traceId) {
    Set<String> levelNames = new LinkedHashSet<>();
    splitCsv(levels).forEach(level -> levelNames.add(level.toLowerCase(Locale.ROOT)));
    return new SubscriberFilter(splitCsv(projects), levelNames, traceId);
  }

  public boolean matches(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (!projects.isEmpty() && !projects.contains(entry.project())) {
      return false;
    }
    if (!levels.isEmpty() && !levels.contains(entry.level().wireName())) {
      return false;
    }
    return traceId == null || traceId.equals(entry.traceId());
  }

  private static Set<String> splitCsv(String value) {
    if (value == null || value.isBlank()) {
      return Set.of();
    }
    Set<String> result = new LinkedHashSet<>();
    Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .forEach(result::add);
    return result;
  }
}
