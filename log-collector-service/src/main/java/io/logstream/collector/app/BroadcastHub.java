package io.logstream.collector.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.domain.LogEntry;
import io.logstream.collector.domain.SubscriberFilter;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of live subscribers and real-time fan-out of normalized entries.
 * <p>
 * The registry is a concurrent map keyed by a never-reused id, so subscribe, unsubscribe and
 * broadcast run concurrently without a global lock. A broadcast only offers frames to each matching
 * subscriber's bounded channel; a refused offer (closed channel or full buffer) removes that
 * subscriber and is never reported to the publisher.
 */
public class BroadcastHub {

  private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

  private final Map<Long, Subscription> subscribers = new ConcurrentHashMap<>();
  private final AtomicLong nextId = new AtomicLong(1);
  private final ObjectMapper mapper;
  private final int channelCapacity;

  public BroadcastHub(ObjectMapper mapper, int channelCapacity) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    if (channelCapacity <= 0) {
      throw new IllegalArgumentException("channelCapacity must be positive");
    }
    this.channelCapacity = channelCapacity;
  }

  public Subscription subscribe(SubscriberFilter filter) {
    Objects.requireNonNull(filter, "filter");
    long id = nextId.getAndIncrement();
    Subscription subscription = new Subscription(id, filter, new SubscriberChannel(channelCapacity));
    subscribers.put(id, subscription);
    log.debug("subscriber {} registered with {}", id, filter);
    return subscription;
  }

  public void unsubscribe(long id) {
    Subscription removed = subscribers.remove(id);
    if (removed != null) {
      removed.channel().close();
      log.debug("subscriber {} removed", id);
    }
  }

  public void broadcast(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    String frame = null;
    for (Subscription subscription : subscribers.values()) {
      if (!subscription.filter().matches(entry)) {
        continue;
      }
      if (frame == null) {
        frame = serialize(entry);
        if (frame == null) {
          return;
        }
      }
      if (!subscription.channel().offer(frame)) {
        reap(subscription);
      }
    }
  }

  public int count() {
    return subscribers.size();
  }

  private void reap(Subscription subscription) {
    // remove only the exact instance we failed to deliver to
    if (subscribers.remove(subscription.id(), subscription)) {
      subscription.channel().close();
      log.debug("subscriber {} reaped after failed delivery", subscription.id());
    }
  }

  private String serialize(LogEntry entry) {
    try {
      return mapper.writeValueAsString(new LogEvent(entry));
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize log entry {} for subscribers", entry.id(), ex);
      return null;
    }
  }

  record LogEvent(String type, LogEntry data) {
    LogEvent(LogEntry data) {
      this("log", data);
    }
  }
}
