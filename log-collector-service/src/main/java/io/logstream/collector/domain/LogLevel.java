package io.logstream.collector.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR,
  FATAL;

  /**
   * Lower-case wire form, also used by subscriber level filters.
   */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static LogLevel from(String value) {
    if (value == null || value.isBlank()) {
      return INFO;
    }
    try {
      return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown log level '" + value + "'", ex);
    }
  }

  @Override
  public String toString() {
    return wireName();
  }
}
