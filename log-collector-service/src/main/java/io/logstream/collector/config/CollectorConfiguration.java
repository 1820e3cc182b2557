package io.logstream.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.app.BroadcastHub;
import io.logstream.collector.app.IngestionGateway;
import io.logstream.collector.app.LogStreamWebSocketHandler;
import io.logstream.collector.app.WriteBatcher;
import io.logstream.collector.domain.IngestPayloadReader;
import io.logstream.collector.domain.LogEntryNormalizer;
import io.logstream.collector.domain.LogIndex;
import io.logstream.collector.infra.IndexInitializer;
import io.logstream.collector.infra.MeilisearchLogIndex;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ingestion pipeline: normalizer, broadcast hub, write batcher and the index adapter.
 */
@Configuration
@EnableConfigurationProperties(LogstreamProperties.class)
public class CollectorConfiguration {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  LogEntryNormalizer logEntryNormalizer(Clock clock) {
    return new LogEntryNormalizer(clock);
  }

  @Bean
  IngestPayloadReader ingestPayloadReader(ObjectMapper objectMapper) {
    return new IngestPayloadReader(objectMapper);
  }

  @Bean
  BroadcastHub broadcastHub(ObjectMapper objectMapper, LogstreamProperties properties, MeterRegistry meterRegistry) {
    BroadcastHub hub = new BroadcastHub(objectMapper, properties.subscribers().bufferSize());
    Gauge.builder("logstream.subscribers", hub, BroadcastHub::count)
        .description("Live subscribers")
        .register(meterRegistry);
    return hub;
  }

  @Bean
  LogIndex logIndex(RestTemplateBuilder restTemplateBuilder, LogstreamProperties properties,
                    ObjectMapper objectMapper, Clock clock) {
    return new MeilisearchLogIndex(restTemplateBuilder, properties.index(), objectMapper, clock);
  }

  @Bean
  WriteBatcher writeBatcher(LogIndex logIndex, LogstreamProperties properties, MeterRegistry meterRegistry) {
    return new WriteBatcher(logIndex, properties.batch(), meterRegistry);
  }

  @Bean
  IngestionGateway ingestionGateway(IngestPayloadReader reader, LogEntryNormalizer normalizer,
                                    BroadcastHub hub, WriteBatcher batcher, MeterRegistry meterRegistry) {
    return new IngestionGateway(reader, normalizer, hub, batcher, meterRegistry);
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService subscriberForwarders() {
    return Executors.newCachedThreadPool(new ForwarderThreadFactory());
  }

  @Bean
  LogStreamWebSocketHandler logStreamWebSocketHandler(IngestionGateway gateway, BroadcastHub hub,
                                                      ExecutorService subscriberForwarders,
                                                      ObjectMapper objectMapper) {
    return new LogStreamWebSocketHandler(gateway, hub, subscriberForwarders, objectMapper);
  }

  @Bean
  @ConditionalOnProperty(prefix = "logstream.index", name = "initialize", havingValue = "true")
  IndexInitializer indexInitializer(LogIndex logIndex) {
    return new IndexInitializer(logIndex);
  }

  @Bean
  InfoContributor pipelineInfoContributor(BroadcastHub hub, WriteBatcher batcher) {
    return builder -> builder
        .withDetail("subscribers", hub.count())
        .withDetail("intakeDepth", batcher.pending());
  }

  private static final class ForwarderThreadFactory implements ThreadFactory {
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, "logstream-subscriber-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
