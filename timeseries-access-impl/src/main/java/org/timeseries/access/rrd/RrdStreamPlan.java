package org.timeseries.access.rrd;

import java.nio.file.Path;
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
import org.timeseries.access.api.query.MathOperation;

/** Per-stream part of an xport: which files to look for and how to combine them. */
@Value
@Builder
public class RrdStreamPlan {
  int index;
  @NonNull MetricIdentifier metric;
  @NonNull Path directory;
  @NonNull LabelFilter filter;
  @NonNull ConsolidationFunction consolidation;
  @Singular List<MathOperation> mathOperations;
  @NonNull String legend;

  @Getter(AccessLevel.NONE)
  String alias;

  public Optional<String> getAlias() {
    return Optional.ofNullable(alias);
  }

  String vname() {
    return "s" + index;
  }
}
