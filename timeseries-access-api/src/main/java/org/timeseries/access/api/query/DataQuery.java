package org.timeseries.access.api.query;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.time.TimePrecision;
import org.timeseries.access.api.time.TimeRange;

/** Selects one or more streams over a time range. */
@Value
public class DataQuery implements Query {
  TimeRange timeRange;
  TimePrecision precision;
  Resolution resolution;
  List<Stream> streams;

  @Builder
  private DataQuery(
      @NonNull TimeRange timeRange,
      TimePrecision precision,
      Resolution resolution,
      @Singular List<Stream> streams) {
    if (streams.isEmpty()) {
      throw new ValidationException("A data query needs at least one stream");
    }
    this.timeRange = timeRange;
    this.precision = precision == null ? TimePrecision.S : precision;
    this.resolution = resolution == null ? Resolution.auto() : resolution;
    this.streams = streams;
  }

  @Override
  public QueryType getQueryType() {
    return QueryType.DATA;
  }
}
