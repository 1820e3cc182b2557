package io.logstream.collector.app;

import java.io.IOException;
import org.springframework.web.socket.WebSocketSession;

/**
 * Protocol driven over one {@code /ws} connection. The mode is fixed when the connection opens, and
 * each mode keeps its own state.
 */
interface StreamSession {

  void open(WebSocketSession session) throws IOException;

  void onText(WebSocketSession session, String payload);

  /**
   * Called once the transport is gone. Must be idempotent.
   */
  void close();
}
