package io.logstream.collector.domain;

import java.util.List;

/**
 * Port to the durable full-text index. The pipeline only writes ordered batches; the query surface
 * only searches.
 */
public interface LogIndex {

  /**
   * Submits one ordered batch for indexing.
   *
   * @throws IndexException when the index is unreachable or rejects the write
   */
  void addDocuments(List<LogEntry> batch);

  /**
   * Executes a structured query and returns ranked hits with facet counts.
   *
   * @throws IndexException when the index is unreachable or rejects the query
   */
  SearchHits search(LogQuery query);

  /**
   * Creates the index and applies its attribute settings. Safe to call on an existing index.
   */
  void initialize();
}
