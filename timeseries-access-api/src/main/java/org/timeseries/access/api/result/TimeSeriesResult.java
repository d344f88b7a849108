package org.timeseries.access.api.result;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;
import org.timeseries.access.api.data.TimeSeries;
import org.timeseries.access.api.query.Resolution;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeSeriesResult implements Result {
  List<TimeSeries> series;
  Instant start;
  Instant end;
  Resolution resolution;

  @Getter(AccessLevel.NONE)
  String error;

  public static TimeSeriesResult of(
      List<TimeSeries> series, Instant start, Instant end, Resolution resolution) {
    return new TimeSeriesResult(ImmutableList.copyOf(series), start, end, resolution, null);
  }

  public static TimeSeriesResult empty(Instant start, Instant end, Resolution resolution) {
    return of(List.of(), start, end, resolution);
  }

  public static TimeSeriesResult failure(
      String error, Instant start, Instant end, Resolution resolution) {
    return new TimeSeriesResult(List.of(), start, end, resolution, error);
  }

  @Override
  public boolean hasData() {
    return !series.isEmpty();
  }

  @Override
  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }
}
