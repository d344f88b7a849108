package org.timeseries.access.api.time;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.timeseries.access.api.ValidationException;

/** Parses and renders compact relative durations such as {@code 5m}, {@code 1h} or {@code 7d}. */
public final class Durations {
  private static final Pattern RELATIVE = Pattern.compile("^(\\d+)([smhdwy])$");
  private static final long MINUTE = 60;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;
  private static final long WEEK = 7 * DAY;
  private static final long YEAR = 365 * DAY;

  private Durations() {}

  public static Duration parse(String text) {
    if (text == null) {
      throw new ValidationException("Duration is required");
    }
    Matcher matcher = RELATIVE.matcher(text.trim());
    if (!matcher.matches()) {
      throw new ValidationException("Invalid relative duration: " + text);
    }
    long amount = Long.parseLong(matcher.group(1));
    return Duration.ofSeconds(Math.multiplyExact(amount, unitSeconds(matcher.group(2).charAt(0))));
  }

  /** Renders whole seconds using the largest unit that divides them exactly. */
  public static String format(Duration duration) {
    long seconds = duration.getSeconds();
    if (seconds == 0) {
      return "0s";
    }
    for (char unit : new char[] {'y', 'w', 'd', 'h', 'm'}) {
      long unitSeconds = unitSeconds(unit);
      if (seconds % unitSeconds == 0) {
        return (seconds / unitSeconds) + String.valueOf(unit);
      }
    }
    return seconds + "s";
  }

  private static long unitSeconds(char unit) {
    switch (unit) {
      case 's':
        return 1;
      case 'm':
        return MINUTE;
      case 'h':
        return HOUR;
      case 'd':
        return DAY;
      case 'w':
        return WEEK;
      case 'y':
        return YEAR;
      default:
        throw new ValidationException("Unknown duration unit: " + unit);
    }
  }
}
