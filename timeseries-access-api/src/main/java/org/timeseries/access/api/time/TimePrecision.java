package org.timeseries.access.api.time;

import java.time.Instant;
import java.util.Locale;
import org.timeseries.access.api.ValidationException;

/** Unit in which a backend expresses timestamps. Each step is a factor of 1000. */
public enum TimePrecision {
  S("s", 0),
  MS("ms", 1),
  US("us", 2),
  NS("ns", 3);

  private static final long STEP = 1000L;

  private final String tag;
  private final int exponent;

  TimePrecision(String tag, int exponent) {
    this.tag = tag;
    this.exponent = exponent;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Converts {@code value}, expressed in {@code from}, into this precision. Widening multiplies
   * exactly and fails on overflow; narrowing truncates toward zero.
   */
  public long convert(long value, TimePrecision from) {
    int steps = exponent - from.exponent;
    long result = value;
    if (steps > 0) {
      for (int i = 0; i < steps; i++) {
        result = Math.multiplyExact(result, STEP);
      }
    } else {
      for (int i = 0; i < -steps; i++) {
        result = result / STEP;
      }
    }
    return result;
  }

  /** Timestamp of {@code instant} in this precision, rounded down to the unit. */
  public long fromInstant(Instant instant) {
    long seconds = instant.getEpochSecond();
    long nanos = instant.getNano();
    switch (this) {
      case S:
        return seconds;
      case MS:
        return Math.addExact(Math.multiplyExact(seconds, 1_000L), nanos / 1_000_000L);
      case US:
        return Math.addExact(Math.multiplyExact(seconds, 1_000_000L), nanos / 1_000L);
      case NS:
        return Math.addExact(Math.multiplyExact(seconds, 1_000_000_000L), nanos);
      default:
        throw new IllegalStateException("Unhandled precision " + this);
    }
  }

  public Instant toInstant(long value) {
    switch (this) {
      case S:
        return Instant.ofEpochSecond(value);
      case MS:
        return Instant.ofEpochMilli(value);
      case US:
        return Instant.ofEpochSecond(
            Math.floorDiv(value, 1_000_000L), Math.floorMod(value, 1_000_000L) * 1_000L);
      case NS:
        return Instant.ofEpochSecond(
            Math.floorDiv(value, 1_000_000_000L), Math.floorMod(value, 1_000_000_000L));
      default:
        throw new IllegalStateException("Unhandled precision " + this);
    }
  }

  public static TimePrecision fromTag(String tag) {
    if (tag != null) {
      String normalized = tag.trim().toLowerCase(Locale.ROOT);
      for (TimePrecision precision : values()) {
        if (precision.tag.equals(normalized)) {
          return precision;
        }
      }
    }
    throw new ValidationException("Unknown time precision: " + tag);
  }
}
