package org.timeseries.access.schema;

import java.util.Arrays;
import org.timeseries.access.TimeseriesConnection;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.time.TimeRange;

/**
 * Fluent label discovery:
 *
 * <pre>
 * connection.schema().labels().where("host", "a").during(TimeRange.lastDays(1))
 *     .labelValues("ifName", MetricIdentifier.named("net.bytes"));
 * </pre>
 */
public class LabelQueryBuilder {
  private final TimeseriesConnection connection;
  private LabelFilter filter = LabelFilter.empty();
  private TimeRange timeRange;

  LabelQueryBuilder(TimeseriesConnection connection) {
    this.connection = connection;
  }

  public LabelQueryBuilder where(String label, String value) {
    filter = filter.withEqual(label, value);
    return this;
  }

  public LabelQueryBuilder where(String label, LabelMatcher matcher) {
    filter = filter.with(label, matcher);
    return this;
  }

  public LabelQueryBuilder during(TimeRange timeRange) {
    this.timeRange = timeRange;
    return this;
  }

  public LabelResult metricNames() {
    return execute(LabelQuery.metricNames());
  }

  public LabelResult labelNames(MetricIdentifier... metrics) {
    return execute(LabelQuery.labelNames(Arrays.asList(metrics)));
  }

  public LabelResult labelValues(String label, MetricIdentifier... metrics) {
    return execute(LabelQuery.labelValues(label, Arrays.asList(metrics)));
  }

  LabelQuery finish(LabelQuery query) {
    LabelQuery filtered = query.withFilter(filter);
    return timeRange == null ? filtered : filtered.withTimeRange(timeRange);
  }

  private LabelResult execute(LabelQuery query) {
    Result result = connection.query(finish(query));
    if (result instanceof LabelResult) {
      return (LabelResult) result;
    }
    return LabelResult.failure(
        query.getKind(),
        result.getError().orElse("Driver " + connection.getName() + " returned no label result"));
  }
}
