package io.logstream.collector.app;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Drains one subscriber's channel onto its WebSocket session. Exits when the session closes, when a
 * send fails, or when the channel is closed and drained; in the last two cases the session is closed
 * with {@link CloseStatus#SESSION_NOT_RELIABLE} so the client knows to reconnect.
 */
class SubscriberForwarder implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(SubscriberForwarder.class);
  private static final long POLL_SECONDS = 1;

  private final BroadcastHub hub;
  private final Subscription subscription;
  private final WebSocketSession session;

  SubscriberForwarder(BroadcastHub hub, Subscription subscription, WebSocketSession session) {
    this.hub = Objects.requireNonNull(hub, "hub");
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.session = Objects.requireNonNull(session, "session");
  }

  @Override
  public void run() {
    SubscriberChannel channel = subscription.channel();
    try {
      while (session.isOpen()) {
        String frame = channel.poll(POLL_SECONDS, TimeUnit.SECONDS);
        if (frame == null) {
          if (channel.isClosed()) {
            // reaped or unsubscribed: nothing more will arrive on this session
            log.debug("[WS] subscriber {} channel closed; closing session {}", subscription.id(), session.getId());
            closeQuietly();
            break;
          }
          continue;
        }
        session.sendMessage(new TextMessage(frame));
      }
    } catch (IOException ex) {
      log.debug("[WS] delivery to subscriber {} failed: {}", subscription.id(), ex.getMessage());
      closeQuietly();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      hub.unsubscribe(subscription.id());
    }
  }

  private void closeQuietly() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException ex) {
      log.debug("[WS] failed to close session {}", session.getId(), ex);
    }
  }
}
