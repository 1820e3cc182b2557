package io.logstream.collector.domain;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Generates ULIDs: 26 Crockford base32 characters, a 48-bit millisecond timestamp followed by 80
 * random bits.
 * <p>
 * Ids are monotonic: when two ids share a millisecond (or the clock steps backwards) the random part
 * of the previous id is incremented, so every id sorts strictly after the one generated before it.
 */
public final class LogIdGenerator {

  private static final char[] ENC = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
  private static final long RANDOM_HIGH_MASK = 0xFFFFL;

  private final Clock clock;
  private final Random random;

  private long lastMillis = -1L;
  // 80 random bits: 16 in randomHigh, 64 in randomLow
  private long randomHigh;
  private long randomLow;

  public LogIdGenerator(Clock clock) {
    this(clock, new SecureRandom());
  }

  LogIdGenerator(Clock clock, Random random) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  public synchronized String next() {
    long now = clock.millis();
    if (now > lastMillis) {
      lastMillis = now;
      randomHigh = random.nextLong() & RANDOM_HIGH_MASK;
      randomLow = random.nextLong();
    } else {
      increment();
    }
    return encode(lastMillis, randomHigh, randomLow);
  }

  private void increment() {
    randomLow++;
    if (randomLow == 0L) {
      randomHigh = (randomHigh + 1) & RANDOM_HIGH_MASK;
      if (randomHigh == 0L) {
        // random space exhausted for this millisecond, borrow the next one
        lastMillis++;
      }
    }
  }

  static String encode(long millis, long randomHigh, long randomLow) {
    char[] out = new char[26];
    long time = millis;
    for (int i = 9; i >= 0; i--) {
      out[i] = ENC[(int) (time & 31)];
      time >>>= 5;
    }
    // 80 bits -> 16 chars, consumed from the least significant end
    long low = randomLow;
    long high = randomHigh;
    for (int i = 25; i >= 10; i--) {
      out[i] = ENC[(int) (low & 31)];
      low = (low >>> 5) | ((high & 31) << 59);
      high >>>= 5;
    }
    return new String(out);
  }
}
