package org.timeseries.access.api.data;

import java.time.Instant;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/** A timestamped value; a missing value marks a gap in the series. */
@Value
public class DataPoint {
  @NonNull Instant timestamp;

  @Getter(AccessLevel.NONE)
  Double value;

  public Optional<Double> getValue() {
    return Optional.ofNullable(value);
  }

  public boolean hasValue() {
    return value != null;
  }
}
