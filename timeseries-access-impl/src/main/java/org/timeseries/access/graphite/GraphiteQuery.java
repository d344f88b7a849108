package org.timeseries.access.graphite;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;

/** Render targets for data queries, or an index lookup for label queries. */
@Value
@Builder(builderClassName = "Builder")
public class GraphiteQuery implements CompiledQuery {
  public static final String FORMAT_JSON = "json";

  @NonNull QueryType queryType;
  @Singular List<Target> targets;
  @NonNull Instant from;
  @NonNull Instant until;
  @NonNull Resolution resolution;

  @Getter(AccessLevel.NONE)
  LabelQueryKind labelKind;

  @Getter(AccessLevel.NONE)
  String label;

  @lombok.Builder.Default LabelFilter filter = LabelFilter.empty();
  @Singular List<MetricIdentifier> metrics;

  public Optional<LabelQueryKind> getLabelKind() {
    return Optional.ofNullable(labelKind);
  }

  public Optional<String> getLabel() {
    return Optional.ofNullable(label);
  }

  public String getFormat() {
    return FORMAT_JSON;
  }

  /** A render expression and the stream it was compiled from. */
  @Value
  public static class Target {
    @NonNull String expression;
    @NonNull MetricIdentifier metric;

    @Getter(AccessLevel.NONE)
    String alias;

    public Optional<String> getAlias() {
      return Optional.ofNullable(alias);
    }
  }

  @Override
  public String getRawQuery() {
    if (queryType == QueryType.LABEL) {
      return "/metrics/index.json";
    }
    return targets.stream()
        .map(target -> "target=" + target.getExpression())
        .collect(
            Collectors.joining(
                "&",
                "",
                "&from="
                    + from.getEpochSecond()
                    + "&until="
                    + until.getEpochSecond()
                    + "&format="
                    + FORMAT_JSON));
  }
}
