package org.timeseries.access.api.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.time.TimeRange;

/** Discovers metric names, label names, or the values of one label. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabelQuery implements Query {
  LabelQueryKind kind;

  @Getter(AccessLevel.NONE)
  String label;

  List<MetricIdentifier> metrics;
  LabelFilter filter;

  @Getter(AccessLevel.NONE)
  TimeRange timeRange;

  public static LabelQuery metricNames() {
    return new LabelQuery(
        LabelQueryKind.METRIC_NAMES, null, ImmutableList.of(), LabelFilter.empty(), null);
  }

  public static LabelQuery labelNames(List<MetricIdentifier> metrics) {
    return new LabelQuery(
        LabelQueryKind.LABEL_NAMES,
        null,
        ImmutableList.copyOf(metrics),
        LabelFilter.empty(),
        null);
  }

  public static LabelQuery labelValues(String label, List<MetricIdentifier> metrics) {
    if (label == null || label.isBlank()) {
      throw new ValidationException("Label name is required to list label values");
    }
    return new LabelQuery(
        LabelQueryKind.LABEL_VALUES,
        label,
        ImmutableList.copyOf(metrics),
        LabelFilter.empty(),
        null);
  }

  public LabelQuery withFilter(LabelFilter filter) {
    if (filter == null) {
      throw new ValidationException("Label filter is required");
    }
    return new LabelQuery(kind, label, metrics, filter, timeRange);
  }

  public LabelQuery withTimeRange(TimeRange timeRange) {
    return new LabelQuery(kind, label, metrics, filter, timeRange);
  }

  public Optional<String> getLabel() {
    return Optional.ofNullable(label);
  }

  public Optional<TimeRange> getTimeRange() {
    return Optional.ofNullable(timeRange);
  }

  @Override
  public QueryType getQueryType() {
    return QueryType.LABEL;
  }
}
