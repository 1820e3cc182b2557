package io.logstream.collector.infra;

import java.time.Duration;
import java.util.Optional;

/**
 * Parses look-back windows such as {@code 30s}, {@code 15m}, {@code 1h} or {@code 7d}. Windows too
 * large to express in milliseconds are treated as invalid.
 */
final class TimeWindow {

  private TimeWindow() {
  }

  static Optional<Duration> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    if (trimmed.length() < 2) {
      return Optional.empty();
    }
    long amount;
    try {
      amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
    if (amount < 0) {
      return Optional.empty();
    }
    try {
      Optional<Duration> window = switch (trimmed.charAt(trimmed.length() - 1)) {
        case 's' -> Optional.of(Duration.ofSeconds(amount));
        case 'm' -> Optional.of(Duration.ofMinutes(amount));
        case 'h' -> Optional.of(Duration.ofHours(amount));
        case 'd' -> Optional.of(Duration.ofDays(amount));
        default -> Optional.empty();
      };
      // callers work in epoch millis, so the window must fit in a long of millis
      window.ifPresent(Duration::toMillis);
      return window;
    } catch (ArithmeticException ex) {
      return Optional.empty();
    }
  }
}
