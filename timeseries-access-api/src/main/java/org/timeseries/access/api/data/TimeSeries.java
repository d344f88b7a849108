package org.timeseries.access.api.data;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TimeSeries {
  @NonNull String metric;

  @Getter(AccessLevel.NONE)
  String alias;

  @Singular Map<String, String> labels;
  @Singular List<DataPoint> points;

  public Optional<String> getAlias() {
    return Optional.ofNullable(alias);
  }

  /** Display name: the alias when one was requested, the metric key otherwise. */
  public String getName() {
    return alias != null ? alias : metric;
  }

  public OptionalDouble min() {
    return values().min();
  }

  public OptionalDouble max() {
    return values().max();
  }

  public OptionalDouble avg() {
    return values().average();
  }

  private DoubleStream values() {
    return points.stream()
        .map(DataPoint::getValue)
        .filter(Optional::isPresent)
        .mapToDouble(Optional::get);
  }
}
