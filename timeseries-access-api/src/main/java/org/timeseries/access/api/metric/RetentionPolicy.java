package org.timeseries.access.api.metric;

import java.time.Duration;
import lombok.NonNull;
import lombok.Value;

/** How long samples are kept at a given step. */
@Value
public class RetentionPolicy {
  @NonNull String name;
  @NonNull Duration resolution;
  @NonNull Duration retention;

  /** Number of slots needed to cover the retention period at this resolution. */
  public long getSlots() {
    return Math.max(1, retention.getSeconds() / Math.max(1, resolution.getSeconds()));
  }
}
