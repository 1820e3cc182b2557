package io.logstream.collector.infra;

import io.logstream.collector.domain.LogLevel;
import io.logstream.collector.domain.LogQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates a {@link LogQuery} into a Meilisearch filter expression.
 */
final class MeilisearchFilter {

  private MeilisearchFilter() {
  }

  static Optional<String> build(LogQuery query, Clock clock) {
    List<String> clauses = new ArrayList<>();
    if (query.project() != null) {
      clauses.add(equalsClause("project", query.project()));
    }
    if (!query.levels().isEmpty()) {
      List<String> levels = new ArrayList<>();
      for (LogLevel level : LogLevel.values()) {
        if (query.levels().contains(level)) {
          levels.add(equalsClause("level", level.wireName()));
        }
      }
      clauses.add(levels.size() == 1 ? levels.get(0) : "(" + String.join(" OR ", levels) + ")");
    }
    if (query.traceId() != null) {
      clauses.add(equalsClause("traceId", query.traceId()));
    }
    if (query.environment() != null) {
      clauses.add(equalsClause("environment", query.environment()));
    }
    TimeWindow.parse(query.since())
        .ifPresent(window -> clauses.add("timestampMs > " + (clock.millis() - window.toMillis())));
    return clauses.isEmpty() ? Optional.empty() : Optional.of(String.join(" AND ", clauses));
  }

  private static String equalsClause(String attribute, String value) {
    return attribute + " = \"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
