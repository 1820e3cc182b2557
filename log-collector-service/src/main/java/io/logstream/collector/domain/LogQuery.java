package io.logstream.collector.domain;

import java.util.List;
import java.util.Set;

/**
 * Engine-neutral query handed to a {@link LogIndex}. Filter values are canonical (trimmed, absent
 * when blank); translating them into the engine's filter syntax is the index's job.
 *
 * @param since time window such as {@code 15m} or {@code 2d}, resolved against the current instant
 *              by the index
 */
public record LogQuery(
    String text,
    String project,
    Set<LogLevel> levels,
    String traceId,
    String environment,
    String since,
    int limit,
    Sort sort,
    List<String> facets
) {

  public enum Sort { NEWEST_FIRST, OLDEST_FIRST }

  public LogQuery {
    text = text == null ? "" : text.trim();
    project = clean(project);
    levels = levels == null ? Set.of() : Set.copyOf(levels);
    traceId = clean(traceId);
    environment = clean(environment);
    since = clean(since);
    limit = Math.max(0, limit);
    sort = sort == null ? Sort.NEWEST_FIRST : sort;
    facets = facets == null ? List.of() : List.copyOf(facets);
  }

  private static String clean(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
