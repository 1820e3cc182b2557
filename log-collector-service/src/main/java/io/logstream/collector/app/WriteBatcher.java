package io.logstream.collector.app;

import io.logstream.collector.config.LogstreamProperties;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.LogIndex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Micro-batching writer between ingestion and the {@link LogIndex}.
 * <p>
 * Producers hand entries over through a bounded intake queue and never block. One dedicated thread
 * owns the buffer and alternates between two wake-ups: an entry arriving on the intake, or the flush
 * deadline passing. A batch is written when the buffer reaches {@code size} entries or when
 * {@code flushInterval} has elapsed since the previous flush with entries pending. An elapsed
 * interval with an empty buffer does nothing, and missed intervals coalesce into one.
 * <p>
 * {@link #close()} stops the intake; the thread then drains what was queued, writes the remainder
 * and exits. A batch the index refuses is retried up to {@code maxAttempts} times and then logged and
 * discarded.
 */
public class WriteBatcher implements SmartLifecycle, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(WriteBatcher.class);

  // after the web server stops accepting requests, so in-flight ingests still land in the buffer
  static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

  private static final LogEntry CLOSE_MARKER = LogEntry.of("", null, "");
  private static final long DROP_WARN_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final LogIndex index;
  private final BlockingQueue<LogEntry> intake;
  private final int batchSize;
  private final long flushIntervalNanos;
  private final int maxAttempts;
  private final long retryBackoffMillis;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  // submit holds the read side across check-and-offer; close takes the write side, so nothing lands
  // in the intake after the worker has seen the close
  private final ReadWriteLock intakeGate = new ReentrantReadWriteLock();
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final Thread worker;

  private final AtomicLong droppedSinceWarn = new AtomicLong();
  private final AtomicLong lastDropWarnNanos = new AtomicLong(System.nanoTime() - DROP_WARN_INTERVAL_NANOS);

  private final Counter droppedCounter;
  private final Counter batchCounter;
  private final Counter flushedEntriesCounter;
  private final Counter failureCounter;

  // owned by the worker thread
  private List<LogEntry> buffer;

  public WriteBatcher(LogIndex index, LogstreamProperties.Batch settings, MeterRegistry meterRegistry) {
    this.index = Objects.requireNonNull(index, "index");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.batchSize = settings.size();
    this.flushIntervalNanos = settings.flushInterval().toNanos();
    this.maxAttempts = Math.max(1, settings.maxAttempts());
    this.retryBackoffMillis = Math.max(0L, settings.retryBackoff().toMillis());
    this.intake = new ArrayBlockingQueue<>(settings.intakeCapacity());
    this.buffer = new ArrayList<>(batchSize);
    this.worker = new Thread(this::run, "logstream-batcher");
    this.worker.setDaemon(true);

    this.droppedCounter = Counter.builder("logstream.intake.dropped")
        .description("Entries dropped because the intake queue was full or closed")
        .register(meterRegistry);
    this.batchCounter = Counter.builder("logstream.flush.batches")
        .description("Batches written to the index")
        .register(meterRegistry);
    this.flushedEntriesCounter = Counter.builder("logstream.flush.entries")
        .description("Entries written to the index")
        .register(meterRegistry);
    this.failureCounter = Counter.builder("logstream.flush.failures")
        .description("Batches discarded after the index refused them")
        .register(meterRegistry);
    Gauge.builder("logstream.intake.depth", intake, BlockingQueue::size)
        .description("Entries waiting in the intake queue")
        .register(meterRegistry);
  }

  /**
   * Hands an entry to the batcher without blocking.
   *
   * @return {@code false} when the entry was dropped because the intake is full or closed
   */
  public boolean submit(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    intakeGate.readLock().lock();
    try {
      if (!closed.get() && intake.offer(entry)) {
        return true;
      }
    } finally {
      intakeGate.readLock().unlock();
    }
    droppedCounter.increment();
    droppedSinceWarn.incrementAndGet();
    warnDropped();
    return false;
  }

  public int pending() {
    return intake.size();
  }

  @Override
  public void start() {
    if (started.compareAndSet(false, true)) {
      worker.start();
      log.info("Write batcher started (size={}, flushInterval={}ms, intakeCapacity={})",
          batchSize, TimeUnit.NANOSECONDS.toMillis(flushIntervalNanos), intake.remainingCapacity());
    }
  }

  @Override
  public void close() {
    intakeGate.writeLock().lock();
    try {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
    } finally {
      intakeGate.writeLock().unlock();
    }
    if (!started.get()) {
      terminated.countDown();
      return;
    }
    // wakes the worker early; when the queue is full it finds the closed flag after draining
    intake.offer(CLOSE_MARKER);
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminated.await(timeout, unit);
  }

  @Override
  public void stop() {
    close();
    try {
      if (!awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Write batcher did not drain within 30s; {} entries still queued", intake.size());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public boolean isRunning() {
    return started.get() && terminated.getCount() > 0;
  }

  @Override
  public int getPhase() {
    return PHASE;
  }

  private void run() {
    long deadline = System.nanoTime() + flushIntervalNanos;
    try {
      while (true) {
        long waitNanos = deadline - System.nanoTime();
        LogEntry next = waitNanos > 0 ? intake.poll(waitNanos, TimeUnit.NANOSECONDS) : intake.poll();
        if (next == CLOSE_MARKER || (next == null && closed.get())) {
          break;
        }
        if (next != null) {
          buffer.add(next);
          if (buffer.size() >= batchSize) {
            flush();
            deadline = System.nanoTime() + flushIntervalNanos;
          }
        }
        long now = System.nanoTime();
        if (now - deadline >= 0) {
          if (!buffer.isEmpty()) {
            flush();
          }
          deadline = now + flushIntervalNanos;
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Write batcher interrupted; flushing {} buffered entries", buffer.size());
    } finally {
      drainRemaining();
      terminated.countDown();
      log.info("Write batcher stopped");
    }
  }

  private void drainRemaining() {
    List<LogEntry> rest = new ArrayList<>();
    intake.drainTo(rest);
    for (LogEntry entry : rest) {
      if (entry == CLOSE_MARKER) {
        continue;
      }
      buffer.add(entry);
      if (buffer.size() >= batchSize) {
        flush();
      }
    }
    if (!buffer.isEmpty()) {
      flush();
    }
  }

  private void flush() {
    List<LogEntry> batch = buffer;
    buffer = new ArrayList<>(batchSize);
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        index.addDocuments(batch);
        batchCounter.increment();
        flushedEntriesCounter.increment(batch.size());
        log.debug("Flushed {} entries to the index", batch.size());
        return;
      } catch (RuntimeException ex) {
        if (attempt == maxAttempts) {
          failureCounter.increment();
          log.error("Failed to write batch of {} entries to the index; discarding it", batch.size(), ex);
          return;
        }
        log.warn("Index write attempt {}/{} failed: {}", attempt, maxAttempts, ex.getMessage());
        if (!backoff(attempt)) {
          failureCounter.increment();
          log.error("Interrupted while retrying; discarding batch of {} entries", batch.size());
          return;
        }
      }
    }
  }

  private boolean backoff(int attempt) {
    try {
      Thread.sleep(retryBackoffMillis * attempt);
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void warnDropped() {
    long now = System.nanoTime();
    long last = lastDropWarnNanos.get();
    if (now - last < DROP_WARN_INTERVAL_NANOS || !lastDropWarnNanos.compareAndSet(last, now)) {
      return;
    }
    long dropped = droppedSinceWarn.getAndSet(0);
    log.warn("Intake queue full or closed; dropped {} entries (capacity={})", dropped,
        intake.size() + intake.remainingCapacity());
  }
}
