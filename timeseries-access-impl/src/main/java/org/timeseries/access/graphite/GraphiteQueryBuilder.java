package org.timeseries.access.graphite;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeSet;
import org.timeseries.access.api.QueryException;
import org.timeseries.access.api.UnsupportedFeatureException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.Capability;
import org.timeseries.access.api.driver.AbstractQueryBuilder;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.labels.MatchType;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.MathOperation;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.query.Stream;
import org.timeseries.access.api.time.TimeRange;

/**
 * Compiles streams into Graphite render targets. Equality matchers select path segments, every
 * other matcher becomes a wildcard narrowed by {@code grep} or {@code exclude}.
 */
public class GraphiteQueryBuilder extends AbstractQueryBuilder<GraphiteQuery> {
  static final Duration DEFAULT_LABEL_LOOKBACK = Duration.ofHours(1);

  private final GraphitePaths paths;

  public GraphiteQueryBuilder(GraphitePaths paths, Capabilities capabilities, Clock clock) {
    super(capabilities, clock);
    this.paths = paths;
  }

  @Override
  protected GraphiteQuery compileData(DataQuery query) {
    TimeRange.Resolved range = resolve(query.getTimeRange());
    GraphiteQuery.Builder compiled =
        GraphiteQuery.builder()
            .queryType(QueryType.DATA)
            .from(range.getStart())
            .until(range.getEnd())
            .resolution(query.getResolution());
    for (Stream stream : query.getStreams()) {
      compiled.target(
          new GraphiteQuery.Target(
              target(query, stream), stream.getMetric(), stream.getAlias().orElse(null)));
    }
    return compiled.build();
  }

  @Override
  protected GraphiteQuery compileLabels(LabelQuery query) {
    if (query.getKind() == LabelQueryKind.METRIC_NAMES) {
      throw new QueryException(
          query, "Graphite paths cannot separate metric names from label pairs");
    }
    if (query.getMetrics().isEmpty()) {
      throw new QueryException(query, "Graphite label discovery needs at least one metric");
    }
    TimeRange.Resolved range =
        resolve(query.getTimeRange().orElse(TimeRange.last(DEFAULT_LABEL_LOOKBACK)));
    return GraphiteQuery.builder()
        .queryType(QueryType.LABEL)
        .labelKind(query.getKind())
        .label(query.getLabel().orElse(null))
        .filter(query.getFilter())
        .metrics(query.getMetrics())
        .from(range.getStart())
        .until(range.getEnd())
        .resolution(Resolution.auto())
        .build();
  }

  private String target(DataQuery query, Stream stream) {
    LabelFilter filter = stream.getFilter();
    TreeSet<String> labels = new TreeSet<>(stream.getMetric().getLabels());
    labels.addAll(filter.getMatchers().keySet());

    StringBuilder path = new StringBuilder(paths.base(stream.getMetric()));
    for (String label : labels) {
      LabelMatcher matcher = filter.getMatchers().get(label);
      String segment =
          matcher != null && matcher.getMatchType() == MatchType.EQUAL
              ? GraphitePaths.segment(matcher.getValue())
              : "*";
      path.append('.').append(GraphitePaths.segment(label)).append('.').append(segment);
    }

    String target = path.toString();
    for (Map.Entry<String, LabelMatcher> entry : filter.getMatchers().entrySet()) {
      target = narrow(target, entry.getKey(), entry.getValue());
    }
    for (Operation operation : stream.getPipeline()) {
      target = apply(query, target, operation);
    }
    for (Aggregation aggregation : stream.getAggregations()) {
      target = aggregate(query, target, aggregation, query.getResolution());
    }
    if (stream.getAlias().isPresent()) {
      target = "alias(" + target + ", " + string(stream.getAlias().get()) + ")";
    }
    return target;
  }

  private static String narrow(String target, String label, LabelMatcher matcher) {
    String segment = "\\." + GraphitePaths.segment(label) + "\\.";
    switch (matcher.getMatchType()) {
      case EQUAL:
        return target;
      case NOT_EQUAL:
        return "exclude("
            + target
            + ", "
            + string(
                segment
                    + LabelFilter.escapeRegex(GraphitePaths.segment(matcher.getValue()))
                    + "(\\.|$)")
            + ")";
      case REGEX_MATCH:
        return "grep("
            + target
            + ", "
            + string(segment + "(" + unanchored(matcher.getValue()) + ")(\\.|$)")
            + ")";
      case REGEX_NO_MATCH:
        return "exclude("
            + target
            + ", "
            + string(segment + "(" + unanchored(matcher.getValue()) + ")(\\.|$)")
            + ")";
      default:
        throw new IllegalArgumentException("Unhandled match type " + matcher.getMatchType());
    }
  }

  /**
   * Drops one leading {@code ^} and one unescaped trailing {@code $}; the pattern is embedded
   * between segment delimiters where anchors would never match.
   */
  static String unanchored(String regex) {
    String body = regex.startsWith("^") ? regex.substring(1) : regex;
    if (body.endsWith("$") && !body.endsWith("\\$")) {
      body = body.substring(0, body.length() - 1);
    }
    return body;
  }

  private static String apply(DataQuery query, String target, Operation operation) {
    switch (operation.getType()) {
      case RATE:
        return "perSecond(" + target + ")";
      case DELTA:
        return "derivative(" + target + ")";
      case MATH:
        MathOperation math = (MathOperation) operation;
        switch (math.getOperator()) {
          case ADD:
            return "offset(" + target + ", " + number(math.getValue()) + ")";
          case SUBTRACT:
            return "offset(" + target + ", " + number(-math.getValue()) + ")";
          case MULTIPLY:
            return "scale(" + target + ", " + number(math.getValue()) + ")";
          case DIVIDE:
            return "scale(" + target + ", " + number(1.0 / math.getValue()) + ")";
          default:
            throw new IllegalArgumentException("Unhandled operator " + math.getOperator());
        }
      default:
        throw new UnsupportedFeatureException(
            Capability.forOperation(operation.getType()).getFeature(),
            query,
            "Graphite cannot apply " + operation.getType());
    }
  }

  private static String aggregate(
      DataQuery query, String target, Aggregation aggregation, Resolution resolution) {
    if (!resolution.isAuto()) {
      return "summarize("
          + target
          + ", "
          + string(resolution.getSeconds().getAsLong() + "s")
          + ", "
          + string(summarizeFunction(aggregation))
          + ")";
    }
    switch (aggregation) {
      case MEDIAN:
      case COUNT:
        throw new UnsupportedFeatureException(
            Capability.AGGREGATION.getFeature(),
            query,
            "Graphite cannot consolidate by " + aggregation + " without a fixed resolution");
      default:
        return "consolidateBy(" + target + ", " + string(consolidateFunction(aggregation)) + ")";
    }
  }

  static String summarizeFunction(Aggregation aggregation) {
    switch (aggregation) {
      case AVERAGE:
        return "avg";
      case SUM:
        return "sum";
      case MINIMUM:
        return "min";
      case MAXIMUM:
        return "max";
      case LAST:
        return "last";
      case MEDIAN:
        return "median";
      case COUNT:
        return "count";
      default:
        throw new IllegalArgumentException("Unhandled aggregation " + aggregation);
    }
  }

  static String consolidateFunction(Aggregation aggregation) {
    switch (aggregation) {
      case AVERAGE:
        return "average";
      case SUM:
        return "sum";
      case MINIMUM:
        return "min";
      case MAXIMUM:
        return "max";
      case LAST:
        return "last";
      default:
        throw new IllegalArgumentException("No consolidation for " + aggregation);
    }
  }

  static String string(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
