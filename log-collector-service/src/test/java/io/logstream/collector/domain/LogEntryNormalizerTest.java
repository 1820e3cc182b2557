package io.logstream.collector.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LogEntryNormalizerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final LogEntryNormalizer normalizer = new LogEntryNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void fillsMissingIdentityAndTime() {
    LogEntry normalized = normalizer.normalize(LogEntry.of("api", LogLevel.ERROR, "boom"));

    assertThat(normalized.id()).hasSize(26);
    assertThat(normalized.timestamp()).isEqualTo("2024-05-01T10:00:00Z");
    assertThat(normalized.timestampMs()).isEqualTo(NOW.toEpochMilli());
    assertThat(normalized.project()).isEqualTo("api");
    assertThat(normalized.level()).isEqualTo(LogLevel.ERROR);
  }

  @Test
  void appliesDefaultsForAbsentFields() {
    LogEntry normalized = normalizer.normalize(
        new LogEntry(null, null, 0L, null, null, null, null, null, null, null, null, null));

    assertThat(normalized.project()).isEqualTo("unknown");
    assertThat(normalized.level()).isEqualTo(LogLevel.INFO);
    assertThat(normalized.environment()).isEqualTo("dev");
    assertThat(normalized.message()).isEmpty();
  }

  @Test
  void derivesMillisFromOffsetTimestamps() {
    LogEntry entry = entry("id-1", "2024-05-01T12:30:00+02:00", 0L);

    LogEntry normalized = normalizer.normalize(entry);

    assertThat(normalized.timestamp()).isEqualTo("2024-05-01T12:30:00+02:00");
    assertThat(normalized.timestampMs()).isEqualTo(Instant.parse("2024-05-01T10:30:00Z").toEpochMilli());
  }

  @Test
  void recomputesMillisThatDisagreeWithTimestamp() {
    LogEntry normalized = normalizer.normalize(entry("id-1", "2024-05-01T09:00:00Z", 12345L));

    assertThat(normalized.timestampMs()).isEqualTo(Instant.parse("2024-05-01T09:00:00Z").toEpochMilli());
  }

  @Test
  void unparsableTimestampFallsBackToNow() {
    LogEntry normalized = normalizer.normalize(entry("id-1", "yesterday-ish", 0L));

    assertThat(normalized.timestamp()).isEqualTo("yesterday-ish");
    assertThat(normalized.timestampMs()).isEqualTo(NOW.toEpochMilli());
  }

  @Test
  void outOfRangeTimestampFallsBackInsteadOfFailing() {
    LogEntry normalized = normalizer.normalize(entry("id-1", "+999999999-01-01T00:00:00Z", 0L));
    LogEntry withSenderMillis = normalizer.normalize(entry("id-2", "-999999999-01-01T00:00:00Z", 7L));

    assertThat(normalized.timestamp()).isEqualTo("+999999999-01-01T00:00:00Z");
    assertThat(normalized.timestampMs()).isEqualTo(NOW.toEpochMilli());
    assertThat(withSenderMillis.timestampMs()).isEqualTo(7L);
  }

  @Test
  void unparsableTimestampKeepsSenderMillis() {
    LogEntry normalized = normalizer.normalize(entry("id-1", "not-a-time", 42L));

    assertThat(normalized.timestampMs()).isEqualTo(42L);
  }

  @Test
  void isIdempotentForEntriesWithIdentity() {
    LogEntryNormalizer later = new LogEntryNormalizer(
        Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));

    for (String timestamp : new String[] {"2024-05-01T08:00:00.123Z", "garbage"}) {
      LogEntry once = normalizer.normalize(entry("01HXYZ", timestamp, 0L));
      LogEntry twice = later.normalize(once);
      assertThat(twice).isEqualTo(once);
    }
  }

  @Test
  void producesFreshIncreasingIdsOnEveryCall() {
    LogEntry raw = LogEntry.of("api", LogLevel.INFO, "hello");

    LogEntry first = normalizer.normalize(raw);
    LogEntry second = normalizer.normalize(raw);

    assertThat(second.id()).isNotEqualTo(first.id());
    assertThat(second.id()).isGreaterThan(first.id());
  }

  private static LogEntry entry(String id, String timestamp, long timestampMs) {
    return new LogEntry(id, timestamp, timestampMs, "api", LogLevel.INFO, "msg",
        null, null, null, null, null, null);
  }
}
