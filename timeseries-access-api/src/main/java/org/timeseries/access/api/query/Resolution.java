package org.timeseries.access.api.query;

import java.util.OptionalLong;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import org.timeseries.access.api.ValidationException;

/** Step between consolidated points; {@link #auto()} leaves the choice to the backend. */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Resolution {
  private static final Resolution AUTO = new Resolution(null);

  private final Long seconds;

  public static Resolution auto() {
    return AUTO;
  }

  public static Resolution seconds(long seconds) {
    if (seconds <= 0) {
      throw new ValidationException("Resolution must be positive: " + seconds);
    }
    return new Resolution(seconds);
  }

  public static Resolution minutes(long minutes) {
    return seconds(Math.multiplyExact(minutes, 60L));
  }

  public boolean isAuto() {
    return seconds == null;
  }

  public OptionalLong getSeconds() {
    return seconds == null ? OptionalLong.empty() : OptionalLong.of(seconds);
  }

  @Override
  public String toString() {
    return isAuto() ? "auto" : seconds + "s";
  }
}
