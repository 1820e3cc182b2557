package io.logstream.collector.app;

import com.fasterxml.jackson.databind.JsonNode;
import io.logstream.collector.domain.IndexException;
import io.logstream.collector.domain.LogIndex;
import io.logstream.collector.domain.LogLevel;
import io.logstream.collector.domain.LogQuery;
import io.logstream.collector.domain.SearchHits;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side over the index. Requests go straight to the {@link LogIndex}; nothing here touches the
 * ingestion pipeline.
 */
@RestController
public class LogQueryController {

  private static final Logger log = LoggerFactory.getLogger(LogQueryController.class);

  static final int TRACE_LIMIT = 500;

  private final LogIndex index;

  public LogQueryController(LogIndex index) {
    this.index = Objects.requireNonNull(index, "index");
  }

  @GetMapping("/search")
  public SearchResponse search(
      @RequestParam(required = false) String q,
      @RequestParam(required = false) String project,
      @RequestParam(required = false) String level,
      @RequestParam(required = false) String traceId,
      @RequestParam(required = false) String environment,
      @RequestParam(required = false) String since,
      @RequestParam(required = false) Integer limit) {
    log.info("[REST] GET /search q={} project={} level={}", q, project, level);
    Set<LogLevel> levels = level == null || level.isBlank() ? Set.of() : Set.of(LogLevel.from(level));
    LogQuery query = new LogQuery(q, project, levels, traceId, environment, since,
        clampLimit(limit, 20, 200), LogQuery.Sort.NEWEST_FIRST, List.of("project", "level"));
    SearchHits result = index.search(query);
    return new SearchResponse(result.totalHits(), result.facets(), result.hits());
  }

  @GetMapping("/projects")
  public ProjectsResponse projects() {
    log.info("[REST] GET /projects");
    LogQuery query = new LogQuery(null, null, null, null, null, null, 0,
        LogQuery.Sort.NEWEST_FIRST, List.of("project", "level", "environment"));
    SearchHits result = index.search(query);
    return new ProjectsResponse(result.totalHits(), result.facets());
  }

  @GetMapping("/trace/{traceId}")
  public TraceTimeline trace(@PathVariable String traceId) {
    log.info("[REST] GET /trace/{}", traceId);
    LogQuery query = new LogQuery(null, null, null, traceId, null, null, TRACE_LIMIT,
        LogQuery.Sort.OLDEST_FIRST, List.of());
    SearchHits result = index.search(query);
    SortedSet<String> projects = new TreeSet<>();
    for (JsonNode hit : result.hits()) {
      JsonNode project = hit.get("project");
      if (project != null && project.isTextual()) {
        projects.add(project.asText());
      }
    }
    return new TraceTimeline(traceId, result.hits().size(), projects, result.hits());
  }

  @GetMapping("/errors")
  public ErrorSummary errors(
      @RequestParam(required = false) String q,
      @RequestParam(required = false) String project,
      @RequestParam(required = false) String since,
      @RequestParam(required = false) Integer limit) {
    log.info("[REST] GET /errors project={} since={}", project, since);
    LogQuery query = new LogQuery(q, project, Set.of(LogLevel.ERROR, LogLevel.FATAL), null, null,
        since, clampLimit(limit, 30, 100), LogQuery.Sort.NEWEST_FIRST, List.of("project"));
    SearchHits result = index.search(query);
    return new ErrorSummary(result.totalHits(), result.facets(), result.hits());
  }

  @ExceptionHandler(IndexException.class)
  ResponseEntity<Map<String, Object>> indexFailure(IndexException ex) {
    log.error("[REST] index query failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ResponseEntity<Map<String, Object>> invalidParameter(IllegalArgumentException ex) {
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
  }

  private static int clampLimit(Integer requested, int defaultLimit, int max) {
    if (requested == null) {
      return defaultLimit;
    }
    return Math.max(0, Math.min(max, requested));
  }

  public record SearchResponse(long totalHits, Map<String, Map<String, Long>> facets, List<JsonNode> hits) {}

  public record ProjectsResponse(long totalLogs, Map<String, Map<String, Long>> facets) {}

  public record TraceTimeline(String traceId, int eventCount, SortedSet<String> projects, List<JsonNode> timeline) {}

  public record ErrorSummary(long totalErrors, Map<String, Map<String, Long>> byProject, List<JsonNode> errors) {}
}
