package io.logstream.collector.app;

import com.fasterxml.jackson.databind.JsonNode;
import io.logstream.collector.domain.IngestPayloadReader;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.LogEntryNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;

/**
 * Entry point shared by every ingest transport. Each entry is normalized, offered to live
 * subscribers and handed to the write batcher, in arrival order. Neither sink can block the caller,
 * so the returned count reflects entries received, not entries already indexed.
 */
public class IngestionGateway {

  private final IngestPayloadReader reader;
  private final LogEntryNormalizer normalizer;
  private final BroadcastHub hub;
  private final WriteBatcher batcher;
  private final Counter ingested;

  public IngestionGateway(IngestPayloadReader reader,
                          LogEntryNormalizer normalizer,
                          BroadcastHub hub,
                          WriteBatcher batcher,
                          MeterRegistry meterRegistry) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.batcher = Objects.requireNonNull(batcher, "batcher");
    this.ingested = Counter.builder("logstream.ingest.entries")
        .description("Entries accepted on any ingest transport")
        .register(meterRegistry);
  }

  /**
   * @throws io.logstream.collector.domain.MalformedPayloadException when the payload is rejected;
   *     nothing from it has been ingested in that case
   */
  public int ingest(String payload) {
    return ingest(reader.read(payload));
  }

  public int ingest(JsonNode payload) {
    return ingest(reader.read(payload));
  }

  public int ingest(List<LogEntry> entries) {
    for (LogEntry entry : entries) {
      LogEntry normalized = normalizer.normalize(entry);
      hub.broadcast(normalized);
      batcher.submit(normalized);
    }
    ingested.increment(entries.size());
    return entries.size();
  }
}
