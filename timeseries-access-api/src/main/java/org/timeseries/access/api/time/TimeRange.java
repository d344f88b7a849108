package org.timeseries.access.api.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.ValidationException;

/**
 * A time window given by any two of start, end and duration. Missing bounds are derived on each
 * call to {@link #getStart()} or {@link #getEnd()}, so a range without a fixed end follows the
 * clock: two resolutions of the same range may differ.
 */
@Value
@EqualsAndHashCode(doNotUseGetters = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeRange {
  private static final Duration DURATION_TOLERANCE = Duration.ofSeconds(1);

  Instant start;
  Instant end;
  Duration duration;
  @EqualsAndHashCode.Exclude Clock clock;

  /**
   * General form. Any field may be null; the combination is validated here and resolved lazily.
   *
   * @throws ValidationException if the duration is negative, start is after end, or all three
   *     fields are given and disagree by more than one second
   */
  public static TimeRange of(Instant start, Instant end, Duration duration) {
    if (duration != null && duration.isNegative()) {
      throw new ValidationException("Duration must not be negative: " + duration);
    }
    if (start != null && end != null) {
      if (start.isAfter(end)) {
        throw new ValidationException("Start " + start + " is after end " + end);
      }
      if (duration != null
          && Duration.between(start, end).minus(duration).abs().compareTo(DURATION_TOLERANCE)
              > 0) {
        throw new ValidationException(
            "Duration " + duration + " does not match the range " + start + " to " + end);
      }
    }
    return new TimeRange(start, end, duration, Clock.systemUTC());
  }

  public static TimeRange between(Instant start, Instant end) {
    return of(requireBound(start, "start"), requireBound(end, "end"), null);
  }

  public static TimeRange startingAt(Instant start, Duration duration) {
    return of(requireBound(start, "start"), null, requireBound(duration, "duration"));
  }

  public static TimeRange endingAt(Instant end, Duration duration) {
    return of(null, requireBound(end, "end"), requireBound(duration, "duration"));
  }

  /** The window of the given length ending at the current instant. */
  public static TimeRange last(Duration duration) {
    return of(null, null, requireBound(duration, "duration"));
  }

  public static TimeRange since(Instant start) {
    return of(requireBound(start, "start"), null, null);
  }

  public static TimeRange lastMinutes(long minutes) {
    return last(Duration.ofMinutes(minutes));
  }

  public static TimeRange lastHours(long hours) {
    return last(Duration.ofHours(hours));
  }

  public static TimeRange lastDays(long days) {
    return last(Duration.ofDays(days));
  }

  public static TimeRange unbounded() {
    return of(null, null, null);
  }

  public TimeRange withClock(Clock clock) {
    return new TimeRange(start, end, duration, requireBound(clock, "clock"));
  }

  public Optional<Instant> getFixedStart() {
    return Optional.ofNullable(start);
  }

  public Optional<Instant> getFixedEnd() {
    return Optional.ofNullable(end);
  }

  public Optional<Duration> getDuration() {
    return Optional.ofNullable(duration);
  }

  /**
   * @throws ConfigurationException if neither start nor duration can anchor the window
   */
  public Instant getStart() {
    if (start != null) {
      return start;
    }
    if (end == null && duration == null) {
      throw new ConfigurationException("Cannot resolve start: neither end nor duration is set");
    }
    if (duration == null) {
      throw new ConfigurationException("Cannot resolve start from an end without a duration");
    }
    return getEnd().minus(duration);
  }

  public Instant getEnd() {
    if (end != null) {
      return end;
    }
    if (duration != null && start != null) {
      return start.plus(duration);
    }
    return clock.instant();
  }

  /** Resolves both bounds against a single reading of the clock. */
  public Resolved resolve() {
    if (start == null && end == null && duration != null) {
      Instant now = clock.instant();
      return new Resolved(now.minus(duration), now);
    }
    return new Resolved(getStart(), getEnd());
  }

  public boolean isEmpty() {
    Resolved resolved = resolve();
    return resolved.getStart().equals(resolved.getEnd());
  }

  @Override
  public String toString() {
    if (start != null && end != null) {
      return "TimeRange[" + start + ", " + end + "]";
    }
    if (duration != null) {
      String length = Durations.format(duration);
      if (start != null) {
        return "TimeRange[" + start + " +" + length + "]";
      }
      return end != null
          ? "TimeRange[" + end + " -" + length + "]"
          : "TimeRange[last " + length + "]";
    }
    return start != null ? "TimeRange[" + start + ", now]" : "TimeRange[now]";
  }

  private static <T> T requireBound(T value, String name) {
    if (value == null) {
      throw new ValidationException("Time range " + name + " is required");
    }
    return value;
  }

  @Value
  public static class Resolved {
    Instant start;
    Instant end;
  }
}
