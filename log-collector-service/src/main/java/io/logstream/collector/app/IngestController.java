package io.logstream.collector.app;

import com.fasterxml.jackson.databind.JsonNode;
import io.logstream.collector.domain.MalformedPayloadException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IngestController {

  private static final Logger log = LoggerFactory.getLogger(IngestController.class);

  private final IngestionGateway gateway;

  public IngestController(IngestionGateway gateway) {
    this.gateway = Objects.requireNonNull(gateway, "gateway");
  }

  /**
   * POST {@code /ingest}: accepts one entry object or an array of entries. The write to the index
   * happens asynchronously after the response.
   */
  @PostMapping(value = "/ingest", consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> ingest(@RequestBody JsonNode body) {
    int accepted = gateway.ingest(body);
    log.debug("[REST] POST /ingest accepted={}", accepted);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted));
  }

  @ExceptionHandler(MalformedPayloadException.class)
  ResponseEntity<Map<String, Object>> malformed(MalformedPayloadException ex) {
    log.info("[REST] POST /ingest rejected: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
  }
}
