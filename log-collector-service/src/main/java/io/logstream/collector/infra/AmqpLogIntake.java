package io.logstream.collector.infra;

import io.logstream.collector.app.IngestionGateway;
import io.logstream.collector.domain.MalformedPayloadException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;

/**
 * Consumes ingest payloads published to RabbitMQ. Each message body is handled like a WebSocket
 * ingest frame: a malformed message is logged and skipped.
 */
public class AmqpLogIntake {

  private static final Logger log = LoggerFactory.getLogger(AmqpLogIntake.class);

  private final IngestionGateway gateway;

  public AmqpLogIntake(IngestionGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  @RabbitListener(queues = "${logstream.amqp.queue}")
  public void onMessage(Message message) {
    String json = new String(message.getBody(), StandardCharsets.UTF_8);
    try {
      int accepted = gateway.ingest(json);
      log.trace("ingested {} entries from AMQP", accepted);
    } catch (MalformedPayloadException ex) {
      log.warn("Failed to decode log message: {}", ex.getMessage());
    }
  }
}
