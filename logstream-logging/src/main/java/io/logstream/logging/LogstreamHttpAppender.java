package io.logstream.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;

/**
 * A Logback appender that ships log events as JSON entries to a Logstream collector's
 * {@code /ingest} endpoint.
 * <p>
 * Events are buffered and posted as one array when {@code batchSize} events are pending or every
 * {@code flushIntervalMs}. Trace correlation is read from the MDC keys {@code traceId},
 * {@code spanId} and {@code parentSpanId}; the remaining MDC entries travel in {@code meta}.
 */
public class LogstreamHttpAppender extends AppenderBase<ILoggingEvent> {

  static final String TRACE_ID = "traceId";
  static final String SPAN_ID = "spanId";
  static final String PARENT_SPAN_ID = "parentSpanId";

  private final ObjectMapper mapper = new ObjectMapper();
  private final Object lock = new Object();

  private String url = "http://localhost:4800/ingest";
  private String project = "unknown";
  private String environment = "dev";
  private int batchSize = 50;
  private long flushIntervalMs = 100;
  private boolean enabled = true;

  private List<Map<String, Object>> pending = new ArrayList<>();
  private CloseableHttpClient httpClient;
  private ScheduledExecutorService flusher;

  public void setUrl(String url) {
    this.url = url;
  }

  public void setProject(String project) {
    this.project = project;
  }

  public void setEnvironment(String environment) {
    this.environment = environment;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public void setFlushIntervalMs(long flushIntervalMs) {
    this.flushIntervalMs = flushIntervalMs;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public void start() {
    if (!enabled) {
      addInfo("LogstreamHttpAppender disabled by configuration");
      return;
    }
    if (url == null || url.isBlank()) {
      addError("No url set for LogstreamHttpAppender " + getName());
      return;
    }
    httpClient = HttpClients.createDefault();
    flusher = Executors.newSingleThreadScheduledExecutor(task -> {
      Thread thread = new Thread(task, "logstream-appender-" + getName());
      thread.setDaemon(true);
      return thread;
    });
    flusher.scheduleWithFixedDelay(this::flush, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
    super.start();
  }

  @Override
  protected void append(ILoggingEvent eventObject) {
    if (!isStarted()) {
      return;
    }
    Map<String, Object> entry = toEntry(eventObject);
    boolean full;
    synchronized (lock) {
      pending.add(entry);
      full = pending.size() >= batchSize;
    }
    if (full) {
      flusher.execute(this::flush);
    }
  }

  /**
   * Posts everything buffered so far. Runs on the flusher thread, or on the caller during
   * {@link #stop()}.
   */
  void flush() {
    List<Map<String, Object>> batch;
    synchronized (lock) {
      if (pending.isEmpty()) {
        return;
      }
      batch = pending;
      pending = new ArrayList<>();
    }
    try {
      HttpPost post = new HttpPost(url);
      post.setEntity(new StringEntity(mapper.writeValueAsString(batch), ContentType.APPLICATION_JSON));
      httpClient.execute(post, response -> {
        if (response.getCode() >= 300) {
          addWarn("Collector rejected " + batch.size() + " log entries: HTTP " + response.getCode());
        }
        return null;
      });
    } catch (IOException e) {
      addError("Unable to ship " + batch.size() + " log entries to " + url, e);
    }
  }

  Map<String, Object> toEntry(ILoggingEvent event) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
    entry.put("project", project);
    entry.put("environment", environment);
    entry.put("level", level(event.getLevel()));
    entry.put("message", event.getFormattedMessage());
    entry.put("source", event.getLoggerName());

    Map<String, String> mdc = event.getMDCPropertyMap() == null ? Map.of() : event.getMDCPropertyMap();
    putIfPresent(entry, TRACE_ID, mdc.get(TRACE_ID));
    putIfPresent(entry, SPAN_ID, mdc.get(SPAN_ID));
    putIfPresent(entry, PARENT_SPAN_ID, mdc.get(PARENT_SPAN_ID));

    Map<String, Object> meta = new HashMap<>();
    meta.put("thread", event.getThreadName());
    mdc.forEach((key, value) -> {
      if (!TRACE_ID.equals(key) && !SPAN_ID.equals(key) && !PARENT_SPAN_ID.equals(key)) {
        meta.put(key, value);
      }
    });
    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      meta.put("exception", throwable.getClassName() + ": " + throwable.getMessage());
    }
    entry.put("meta", meta);
    return entry;
  }

  static String level(Level level) {
    if (level == null) {
      return "info";
    }
    if (level.isGreaterOrEqual(Level.ERROR)) {
      return "error";
    }
    if (level.isGreaterOrEqual(Level.WARN)) {
      return "warn";
    }
    if (level.isGreaterOrEqual(Level.INFO)) {
      return "info";
    }
    return "debug";
  }

  private static void putIfPresent(Map<String, Object> entry, String key, String value) {
    if (value != null && !value.isBlank()) {
      entry.put(key, value);
    }
  }

  @Override
  public void stop() {
    if (!isStarted()) {
      return;
    }
    super.stop();
    if (flusher != null) {
      flusher.shutdown();
      try {
        flusher.awaitTermination(1, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    flush();
    try {
      if (httpClient != null) {
        httpClient.close();
      }
    } catch (IOException e) {
      addError("Failed to close HTTP client", e);
    }
  }
}
