package io.logstream.collector.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.domain.SubscriberFilter;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Subscribe mode: registers a subscriber, acknowledges it with a {@code connected} frame and starts a
 * forwarder that streams matching entries until the connection closes. Inbound frames are ignored.
 */
class SubscribeStreamSession implements StreamSession {

  private static final Logger log = LoggerFactory.getLogger(SubscribeStreamSession.class);

  private final BroadcastHub hub;
  private final Executor forwarders;
  private final ObjectMapper mapper;
  private final SubscriberFilter filter;
  private volatile Subscription subscription;

  SubscribeStreamSession(BroadcastHub hub, Executor forwarders, ObjectMapper mapper, SubscriberFilter filter) {
    this.hub = Objects.requireNonNull(hub, "hub");
    this.forwarders = Objects.requireNonNull(forwarders, "forwarders");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.filter = Objects.requireNonNull(filter, "filter");
  }

  @Override
  public void open(WebSocketSession session) throws IOException {
    Subscription registered = hub.subscribe(filter);
    subscription = registered;
    log.info("[WS] subscriber {} connected filter={}", registered.id(), filter);
    try {
      String ack = mapper.writeValueAsString(new ConnectedFrame("connected", registered.id(), filter));
      session.sendMessage(new TextMessage(ack));
    } catch (IOException | RuntimeException ex) {
      hub.unsubscribe(registered.id());
      throw ex;
    }
    forwarders.execute(new SubscriberForwarder(hub, registered, session));
  }

  @Override
  public void onText(WebSocketSession session, String payload) {
    log.trace("[WS] ignoring inbound frame on subscriber session {}", session.getId());
  }

  @Override
  public void close() {
    Subscription current = subscription;
    if (current != null) {
      hub.unsubscribe(current.id());
      log.info("[WS] subscriber {} disconnected", current.id());
    }
  }

  Subscription subscription() {
    return subscription;
  }

  record ConnectedFrame(String type, long subscriberId, SubscriberFilter filters) {}
}
