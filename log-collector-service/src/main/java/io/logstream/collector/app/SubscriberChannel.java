package io.logstream.collector.app;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded outbound buffer of one subscriber. The hub offers serialized frames without blocking;
 * a single forwarding task drains them onto the transport.
 */
public class SubscriberChannel {

  private final BlockingQueue<String> frames;
  private final AtomicBoolean closed = new AtomicBoolean();

  public SubscriberChannel(int capacity) {
    this.frames = new LinkedBlockingQueue<>(Math.max(1, capacity));
  }

  /**
   * @return {@code false} when the channel is closed or its buffer is full
   */
  public boolean offer(String frame) {
    if (closed.get()) {
      return false;
    }
    return frames.offer(frame);
  }

  /**
   * Waits up to {@code timeout} for the next frame.
   *
   * @return the next frame, or {@code null} when none arrived in time or the channel was closed and
   *     is fully drained
   */
  public String poll(long timeout, TimeUnit unit) throws InterruptedException {
    String frame = frames.poll();
    if (frame != null || closed.get()) {
      return frame;
    }
    return frames.poll(timeout, unit);
  }

  public void close() {
    closed.set(true);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public int pending() {
    return frames.size();
  }
}
