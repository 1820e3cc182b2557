package io.logstream.collector.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes the single-or-batch ingest payload shared by every transport. A payload is accepted or
 * rejected as a whole.
 */
public class IngestPayloadReader {

  private final ObjectMapper mapper;

  public IngestPayloadReader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public List<LogEntry> read(String json) {
    if (json == null || json.isBlank()) {
      throw new MalformedPayloadException("empty payload");
    }
    JsonNode tree;
    try {
      tree = mapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new MalformedPayloadException("invalid JSON: " + ex.getOriginalMessage(), ex);
    }
    return read(tree);
  }

  public List<LogEntry> read(JsonNode tree) {
    if (tree == null || tree.isNull() || tree.isMissingNode()) {
      throw new MalformedPayloadException("empty payload");
    }
    if (tree.isObject()) {
      return List.of(toEntry(tree, 0));
    }
    if (tree.isArray()) {
      List<LogEntry> entries = new ArrayList<>(tree.size());
      for (int i = 0; i < tree.size(); i++) {
        entries.add(toEntry(tree.get(i), i));
      }
      return entries;
    }
    throw new MalformedPayloadException("expected a log entry object or an array of entries");
  }

  private LogEntry toEntry(JsonNode node, int index) {
    if (!node.isObject()) {
      throw new MalformedPayloadException("entry " + index + " is not an object");
    }
    try {
      return mapper.treeToValue(node, LogEntry.class);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new MalformedPayloadException("entry " + index + " is invalid: " + rootMessage(ex), ex);
    }
  }

  private static String rootMessage(Exception ex) {
    Throwable cause = ex;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    return cause.getMessage();
  }
}
