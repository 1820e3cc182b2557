package io.logstream.collector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the collector settings so they are validated once during startup.
 */
@Validated
@ConfigurationProperties("logstream")
public record LogstreamProperties(
    @NotNull @Valid Index index,
    @NotNull @Valid Batch batch,
    @NotNull @Valid Subscribers subscribers,
    @NotNull @Valid Amqp amqp) {

  @Validated
  public record Index(
      @NotBlank String url,
      String apiKey,
      @NotBlank String name,
      boolean initialize,
      @NotNull Duration connectTimeout,
      @NotNull Duration readTimeout) {}

  /**
   * @param size entries that trigger a flush
   * @param flushInterval longest time a non-empty buffer waits after the previous flush
   * @param intakeCapacity bound of the queue between ingestion and the batcher; entries offered to
   *     a full queue are dropped
   * @param maxAttempts write attempts per batch before it is discarded
   */
  @Validated
  public record Batch(
      @Min(1) int size,
      @NotNull Duration flushInterval,
      @Min(1) int intakeCapacity,
      @Min(1) int maxAttempts,
      @NotNull Duration retryBackoff) {}

  @Validated
  public record Subscribers(@Min(1) int bufferSize) {}

  @Validated
  public record Amqp(boolean enabled, @NotBlank String exchange, @NotBlank String queue) {}
}
