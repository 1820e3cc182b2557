package io.logstream.collector.infra;

import io.logstream.collector.domain.IndexException;
import io.logstream.collector.domain.LogIndex;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Applies the index settings once the application is up. A failure is logged and does not stop the
 * collector; ingestion keeps buffering and live subscribers keep receiving entries.
 */
public class IndexInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(IndexInitializer.class);

  private final LogIndex index;

  public IndexInitializer(LogIndex index) {
    this.index = Objects.requireNonNull(index, "index");
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      index.initialize();
    } catch (IndexException ex) {
      log.warn("failed to initialize the log index: {}", ex.getMessage());
    }
  }
}
