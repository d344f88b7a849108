package org.timeseries.access.graph;

import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.OperationType;

/** One plotted line: a metric key, its fixed filter and pipeline, and an optional legend. */
@Value
@Builder(toBuilder = true)
public class SeriesDefinition {
  @NonNull String metric;

  @Getter(AccessLevel.NONE)
  String legend;

  @Builder.Default Aggregation aggregation = Aggregation.AVERAGE;
  @Builder.Default LabelFilter filter = LabelFilter.empty();

  @Singular("operation")
  List<Operation> pipeline;

  public Optional<String> getLegend() {
    return Optional.ofNullable(legend);
  }

  public boolean hasOperation(OperationType type) {
    return pipeline.stream().anyMatch(operation -> operation.getType() == type);
  }
}
