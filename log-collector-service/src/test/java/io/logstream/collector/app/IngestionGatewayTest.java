package io.logstream.collector.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.domain.IngestPayloadReader;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.LogEntryNormalizer;
import io.logstream.collector.domain.MalformedPayloadException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class IngestionGatewayTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private BroadcastHub hub;
  private WriteBatcher batcher;
  private IngestionGateway gateway;

  @BeforeEach
  void setUp() {
    hub = mock(BroadcastHub.class);
    batcher = mock(WriteBatcher.class);
    when(batcher.submit(any())).thenReturn(true);
    gateway = new IngestionGateway(new IngestPayloadReader(new ObjectMapper()),
        new LogEntryNormalizer(clock), hub, batcher, registry);
  }

  @Test
  void normalizesThenBroadcastsThenBatchesEachEntry() {
    int accepted = gateway.ingest("[{\"project\":\"api\",\"message\":\"a\"},{\"message\":\"b\"}]");

    assertThat(accepted).isEqualTo(2);
    ArgumentCaptor<LogEntry> broadcast = ArgumentCaptor.forClass(LogEntry.class);
    ArgumentCaptor<LogEntry> submitted = ArgumentCaptor.forClass(LogEntry.class);
    verify(hub, times(2)).broadcast(broadcast.capture());
    verify(batcher, times(2)).submit(submitted.capture());

    assertThat(broadcast.getAllValues()).isEqualTo(submitted.getAllValues());
    assertThat(submitted.getAllValues()).extracting(LogEntry::message).containsExactly("a", "b");
    assertThat(submitted.getAllValues()).allSatisfy(entry -> {
      assertThat(entry.id()).hasSize(26);
      assertThat(entry.timestamp()).isEqualTo("2024-05-01T10:00:00Z");
      assertThat(entry.timestampMs()).isEqualTo(clock.millis());
    });
    assertThat(submitted.getAllValues().get(1).project()).isEqualTo("unknown");

    InOrder order = inOrder(hub, batcher);
    order.verify(hub).broadcast(submitted.getAllValues().get(0));
    order.verify(batcher).submit(submitted.getAllValues().get(0));
    order.verify(hub).broadcast(submitted.getAllValues().get(1));
    order.verify(batcher).submit(submitted.getAllValues().get(1));
    assertThat(registry.get("logstream.ingest.entries").counter().count()).isEqualTo(2.0);
  }

  @Test
  void countsEntriesEvenWhenBatcherDropsThem() {
    when(batcher.submit(any())).thenReturn(false);

    assertThat(gateway.ingest("{\"message\":\"x\"}")).isEqualTo(1);
  }

  @Test
  void malformedPayloadIngestsNothing() {
    assertThatThrownBy(() -> gateway.ingest("[{\"message\":\"ok\"},{\"level\":\"nope\"}]"))
        .isInstanceOf(MalformedPayloadException.class);

    verify(hub, never()).broadcast(any());
    verify(batcher, never()).submit(any());
  }

  @Test
  void emptyBatchIsAccepted() {
    assertThat(gateway.ingest(List.of())).isZero();
  }
}
