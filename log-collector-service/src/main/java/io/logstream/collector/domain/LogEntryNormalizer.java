package io.logstream.collector.domain;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Fills identity and time fields of incoming entries.
 * <p>
 * Normalizing an entry that already carries an {@code id} and a {@code timestamp} is idempotent.
 * Entries missing either field receive fresh values on every call, so an entry must be normalized
 * exactly once on its way into the pipeline.
 */
public class LogEntryNormalizer {

  private final Clock clock;
  private final LogIdGenerator ids;

  public LogEntryNormalizer(Clock clock, LogIdGenerator ids) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  public LogEntryNormalizer(Clock clock) {
    this(clock, new LogIdGenerator(clock));
  }

  public LogEntry normalize(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    String id = isBlank(entry.id()) ? ids.next() : entry.id();
    String timestamp = isBlank(entry.timestamp()) ? clock.instant().toString() : entry.timestamp();
    long timestampMs = resolveMillis(timestamp, entry.timestampMs());
    return entry.withIdentity(id, timestamp, timestampMs);
  }

  private long resolveMillis(String timestamp, long existing) {
    try {
      return OffsetDateTime.parse(timestamp).toInstant().toEpochMilli();
    } catch (DateTimeException | ArithmeticException ex) {
      // unparsable or out-of-range timestamps keep what the sender computed, or fall back to now
      return existing != 0L ? existing : clock.millis();
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isEmpty();
  }
}
