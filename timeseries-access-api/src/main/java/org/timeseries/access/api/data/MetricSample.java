package org.timeseries.access.api.data;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.metric.MetricIdentifier;

/** A single value to be written for one series of a metric. */
@Value
@Builder(toBuilder = true)
public class MetricSample {
  @NonNull MetricIdentifier metric;
  @Singular Map<String, String> labels;
  double value;
  @NonNull Instant timestamp;

  /** True when the value has no fractional part and fits a long. */
  public boolean isIntegral() {
    return value == Math.rint(value)
        && !Double.isInfinite(value)
        && Math.abs(value) < 9.2e18;
  }
}
