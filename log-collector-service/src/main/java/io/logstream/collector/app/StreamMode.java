package io.logstream.collector.app;

import java.util.Locale;

enum StreamMode {
  INGEST,
  SUBSCRIBE;

  /**
   * Resolves the {@code mode} connection parameter; anything other than {@code subscribe} ingests.
   */
  static StreamMode from(String value) {
    if (value != null && "subscribe".equals(value.trim().toLowerCase(Locale.ROOT))) {
      return SUBSCRIBE;
    }
    return INGEST;
  }
}
