package org.timeseries.access.api.query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.time.TimePrecision;
import org.timeseries.access.api.time.TimeRange;

/**
 * Fluent construction of a {@link DataQuery}:
 *
 * <pre>
 * DataQueryBuilder.forPeriod(TimeRange.lastHours(1))
 *     .resolution(Resolution.minutes(5))
 *     .select("net.bytes", s -&gt; s.where("host", "a").rate().multiplyBy(8).as("bits"))
 *     .build();
 * </pre>
 */
public class DataQueryBuilder {
  private final TimeRange timeRange;
  private TimePrecision precision = TimePrecision.S;
  private Resolution resolution = Resolution.auto();
  private final List<Stream> streams = new ArrayList<>();

  private DataQueryBuilder(TimeRange timeRange) {
    this.timeRange = timeRange;
  }

  public static DataQueryBuilder forPeriod(TimeRange timeRange) {
    return new DataQueryBuilder(timeRange);
  }

  public DataQueryBuilder precision(TimePrecision precision) {
    this.precision = precision;
    return this;
  }

  public DataQueryBuilder resolution(Resolution resolution) {
    this.resolution = resolution;
    return this;
  }

  public DataQueryBuilder select(String metric) {
    return select(MetricIdentifier.named(metric), stream -> {});
  }

  public DataQueryBuilder select(String metric, Consumer<StreamBuilder> setup) {
    return select(MetricIdentifier.named(metric), setup);
  }

  public DataQueryBuilder select(MetricIdentifier metric, Consumer<StreamBuilder> setup) {
    StreamBuilder streamBuilder = new StreamBuilder(metric);
    setup.accept(streamBuilder);
    streams.add(streamBuilder.build());
    return this;
  }

  public DataQuery build() {
    return DataQuery.builder()
        .timeRange(timeRange)
        .precision(precision)
        .resolution(resolution)
        .streams(streams)
        .build();
  }
}
