package io.logstream.collector.app;

import io.logstream.collector.domain.MalformedPayloadException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.WebSocketSession;

/**
 * Ingest mode: every text frame is a single-or-batch payload. A bad frame is skipped and the
 * connection stays open.
 */
class IngestStreamSession implements StreamSession {

  private static final Logger log = LoggerFactory.getLogger(IngestStreamSession.class);

  private final IngestionGateway gateway;

  IngestStreamSession(IngestionGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  @Override
  public void open(WebSocketSession session) {
    log.debug("[WS] ingest session {} opened", session.getId());
  }

  @Override
  public void onText(WebSocketSession session, String payload) {
    try {
      gateway.ingest(payload);
    } catch (MalformedPayloadException ex) {
      log.warn("[WS] invalid frame on ingest session {}: {}", session.getId(), ex.getMessage());
    }
  }

  @Override
  public void close() {
    // stateless
  }
}
