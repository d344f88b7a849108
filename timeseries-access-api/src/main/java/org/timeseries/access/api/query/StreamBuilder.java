package org.timeseries.access.api.query;

import java.util.Arrays;
import java.util.List;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.metric.MetricIdentifier;

public class StreamBuilder {
  private final Stream.Builder delegate;
  private LabelFilter filter = LabelFilter.empty();

  StreamBuilder(MetricIdentifier metric) {
    this.delegate = Stream.builder().metric(metric);
  }

  public StreamBuilder where(String label, String value) {
    filter = filter.withEqual(label, value);
    return this;
  }

  public StreamBuilder where(String label, LabelMatcher matcher) {
    filter = filter.with(label, matcher);
    return this;
  }

  public StreamBuilder where(LabelFilter additional) {
    filter = filter.merge(additional);
    return this;
  }

  public StreamBuilder whereIn(String label, String... values) {
    filter = filter.withIn(label, Arrays.asList(values));
    return this;
  }

  public StreamBuilder rate() {
    delegate.operation(BasicOperation.rate());
    return this;
  }

  public StreamBuilder delta() {
    delegate.operation(BasicOperation.delta());
    return this;
  }

  public StreamBuilder math(MathOperator operator, double value) {
    delegate.operation(MathOperation.of(operator, value));
    return this;
  }

  public StreamBuilder add(double value) {
    return math(MathOperator.ADD, value);
  }

  public StreamBuilder subtract(double value) {
    return math(MathOperator.SUBTRACT, value);
  }

  public StreamBuilder multiplyBy(double value) {
    return math(MathOperator.MULTIPLY, value);
  }

  public StreamBuilder divideBy(double value) {
    return math(MathOperator.DIVIDE, value);
  }

  public StreamBuilder quantile(double quantile) {
    delegate.operation(QuantileOperation.of(quantile));
    return this;
  }

  public StreamBuilder labelJoin(String target, String separator, List<String> sources) {
    delegate.operation(LabelJoinOperation.of(target, separator, sources));
    return this;
  }

  public StreamBuilder operation(Operation operation) {
    delegate.operation(operation);
    return this;
  }

  public StreamBuilder aggregate(Aggregation... aggregations) {
    for (Aggregation aggregation : aggregations) {
      delegate.aggregation(aggregation);
    }
    return this;
  }

  public StreamBuilder as(String alias) {
    delegate.alias(alias);
    return this;
  }

  Stream build() {
    return delegate.filter(filter).build();
  }
}
