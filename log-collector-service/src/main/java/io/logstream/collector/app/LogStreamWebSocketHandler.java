package io.logstream.collector.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logstream.collector.domain.SubscriberFilter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Handler for {@code /ws}. The {@code mode} query parameter selects ingest (default) or subscribe
 * once, at connection time; the session then stays in that mode until it closes.
 */
public class LogStreamWebSocketHandler extends TextWebSocketHandler {

  private static final Logger log = LoggerFactory.getLogger(LogStreamWebSocketHandler.class);
  static final String STREAM_SESSION = "logstream.streamSession";

  private final IngestionGateway gateway;
  private final BroadcastHub hub;
  private final Executor forwarders;
  private final ObjectMapper mapper;

  public LogStreamWebSocketHandler(IngestionGateway gateway, BroadcastHub hub, Executor forwarders,
                                   ObjectMapper mapper) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.hub = Objects.requireNonNull(hub, "hub");
    this.forwarders = Objects.requireNonNull(forwarders, "forwarders");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    MultiValueMap<String, String> params = queryParams(session.getUri());
    StreamSession stream = switch (StreamMode.from(params.getFirst("mode"))) {
      case SUBSCRIBE -> new SubscribeStreamSession(hub, forwarders, mapper,
          SubscriberFilter.fromParameters(
              params.getFirst("projects"), params.getFirst("levels"), params.getFirst("traceId")));
      case INGEST -> new IngestStreamSession(gateway);
    };
    session.getAttributes().put(STREAM_SESSION, stream);
    stream.open(session);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    StreamSession stream = streamOf(session);
    if (stream != null) {
      stream.onText(session, message.getPayload());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("[WS] transport error on session {}: {}", session.getId(), exception.getMessage());
    StreamSession stream = streamOf(session);
    if (stream != null) {
      stream.close();
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    StreamSession stream = streamOf(session);
    if (stream != null) {
      stream.close();
    }
  }

  private static StreamSession streamOf(WebSocketSession session) {
    return (StreamSession) session.getAttributes().get(STREAM_SESSION);
  }

  private static MultiValueMap<String, String> queryParams(URI uri) {
    MultiValueMap<String, String> raw = uri == null
        ? UriComponentsBuilder.newInstance().build().getQueryParams()
        : UriComponentsBuilder.fromUri(uri).build().getQueryParams();
    MultiValueMap<String, String> decoded = new LinkedMultiValueMap<>();
    raw.forEach((key, values) -> values.forEach(value ->
        decoded.add(key, value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8))));
    return decoded;
  }
}
