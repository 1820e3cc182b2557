package io.logstream.collector.app;

import java.util.Map;
import java.util.Objects;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  private final BroadcastHub hub;

  public HealthController(BroadcastHub hub) {
    this.hub = Objects.requireNonNull(hub, "hub");
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    return Map.of("status", "ok", "subscribers", hub.count());
  }
}
