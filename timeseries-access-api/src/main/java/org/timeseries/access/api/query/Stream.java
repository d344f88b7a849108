package org.timeseries.access.api.query;

import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.metric.MetricIdentifier;

/**
 * One selected series family: a metric, the label filter narrowing it, the operations applied
 * left to right, and the aggregations consolidating the result.
 */
@Value
@Builder(toBuilder = true, builderClassName = "Builder")
public class Stream {
  @NonNull MetricIdentifier metric;
  @NonNull @lombok.Builder.Default LabelFilter filter = LabelFilter.empty();
  @Singular("operation") List<Operation> pipeline;
  @Singular List<Aggregation> aggregations;

  @Getter(AccessLevel.NONE)
  String alias;

  public Optional<String> getAlias() {
    return Optional.ofNullable(alias);
  }

  public boolean hasOperation(OperationType type) {
    return pipeline.stream().anyMatch(operation -> operation.getType() == type);
  }
}
