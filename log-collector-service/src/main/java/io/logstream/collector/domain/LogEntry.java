package io.logstream.collector.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One structured log record as accepted on the ingest surfaces and written to the index.
 * <p>
 * Absent {@code project}, {@code level}, {@code message} and {@code environment} fall back to their
 * defaults on construction; {@code id}, {@code timestamp} and {@code timestampMs} are filled by
 * {@link LogEntryNormalizer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
    String id,
    String timestamp,
    long timestampMs,
    String project,
    LogLevel level,
    String message,
    String traceId,
    String spanId,
    String parentSpanId,
    JsonNode meta,
    String source,
    String environment
) {

  public static final String DEFAULT_PROJECT = "unknown";
  public static final String DEFAULT_ENVIRONMENT = "dev";

  public LogEntry {
    project = project == null ? DEFAULT_PROJECT : project;
    level = level == null ? LogLevel.INFO : level;
    message = message == null ? "" : message;
    environment = environment == null ? DEFAULT_ENVIRONMENT : environment;
  }

  public static LogEntry of(String project, LogLevel level, String message) {
    return new LogEntry(null, null, 0L, project, level, message, null, null, null, null, null, null);
  }

  public LogEntry withIdentity(String id, String timestamp, long timestampMs) {
    return new LogEntry(id, timestamp, timestampMs, project, level, message, traceId, spanId,
        parentSpanId, meta, source, environment);
  }
}
