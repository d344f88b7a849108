package org.timeseries.access.influxdb;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.driver.AbstractQueryBuilder;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelJoinOperation;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.MathOperation;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.QuantileOperation;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.query.Stream;
import org.timeseries.access.api.time.TimeRange;

/** Compiles queries into Flux, one {@code from |> ... |> yield} block per stream. */
@Slf4j
public class InfluxQueryBuilder extends AbstractQueryBuilder<InfluxQuery> {
  static final Duration DEFAULT_LABEL_LOOKBACK = Duration.ofHours(1);
  private static final String INDENT = "  ";
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final InfluxDbConfig config;

  public InfluxQueryBuilder(InfluxDbConfig config, Capabilities capabilities, Clock clock) {
    super(capabilities, clock);
    this.config = config;
  }

  @Override
  protected InfluxQuery compileData(DataQuery query) {
    TimeRange.Resolved range = resolve(query.getTimeRange());
    InfluxQuery.Builder compiled =
        InfluxQuery.builder()
            .queryType(QueryType.DATA)
            .precision(query.getPrecision())
            .start(range.getStart())
            .end(range.getEnd())
            .resolution(query.getResolution());

    List<String> blocks = new ArrayList<>();
    Set<String> yieldNames = new HashSet<>();
    List<Stream> streams = query.getStreams();
    for (int i = 0; i < streams.size(); i++) {
      Stream stream = streams.get(i);
      String yieldName = stream.getAlias().orElse("s" + i);
      if (!yieldNames.add(yieldName)) {
        throw new ValidationException("Duplicate stream alias: " + yieldName);
      }
      stream.getAlias().ifPresent(alias -> compiled.alias(yieldName, alias));
      blocks.add(streamBlock(stream, yieldName, range, query.getResolution()));
    }
    InfluxQuery result = compiled.flux(String.join("\n\n", blocks)).build();
    log.debug("Compiled Flux: {}", result.getFlux());
    return result;
  }

  @Override
  protected InfluxQuery compileLabels(LabelQuery query) {
    TimeRange.Resolved range =
        resolve(query.getTimeRange().orElse(TimeRange.last(DEFAULT_LABEL_LOOKBACK)));
    String bounds =
        "start: "
            + FluxSyntax.time(range.getStart())
            + ", stop: "
            + FluxSyntax.time(range.getEnd());
    String bucket = "bucket: " + FluxSyntax.string(config.getBucket());
    String predicate = "predicate: (r) => " + predicate(query);

    String call;
    switch (query.getKind()) {
      case METRIC_NAMES:
        call =
            query.getFilter().isEmpty()
                ? "schema.measurements(" + bucket + ", " + bounds + ")"
                : "schema.tagValues("
                    + bucket
                    + ", tag: \"_measurement\", "
                    + predicate
                    + ", "
                    + bounds
                    + ")";
        break;
      case LABEL_NAMES:
        call = "schema.tagKeys(" + bucket + ", " + predicate + ", " + bounds + ")";
        break;
      case LABEL_VALUES:
        call =
            "schema.tagValues("
                + bucket
                + ", tag: "
                + FluxSyntax.string(query.getLabel().orElseThrow())
                + ", "
                + predicate
                + ", "
                + bounds
                + ")";
        break;
      default:
        throw new IllegalArgumentException("Unhandled label query kind " + query.getKind());
    }
    return InfluxQuery.builder()
        .queryType(QueryType.LABEL)
        .labelKind(query.getKind())
        .precision(config.getPrecision())
        .start(range.getStart())
        .end(range.getEnd())
        .resolution(Resolution.auto())
        .flux("import \"influxdata/influxdb/schema\"\n\n" + call)
        .build();
  }

  private String streamBlock(
      Stream stream, String yieldName, TimeRange.Resolved range, Resolution resolution) {
    FieldStrategy strategy = config.getFieldStrategy();
    List<String> steps = new ArrayList<>();
    steps.add(
        "|> range(start: "
            + FluxSyntax.time(range.getStart())
            + ", stop: "
            + FluxSyntax.time(range.getEnd())
            + ")");
    steps.add(
        "|> filter(fn: (r) => r._measurement == "
            + FluxSyntax.string(strategy.measurement(stream.getMetric()))
            + ")");
    steps.add(
        "|> filter(fn: (r) => r._field == "
            + FluxSyntax.string(strategy.field(stream.getMetric()))
            + ")");
    steps.addAll(FilterToFluxConverter.filterSteps(stream.getFilter()));
    for (Operation operation : stream.getPipeline()) {
      steps.add(operationStep(operation));
    }
    for (Aggregation aggregation : stream.getAggregations()) {
      steps.add(aggregationStep(aggregation, resolution));
    }
    steps.add("|> yield(name: " + FluxSyntax.string(yieldName) + ")");

    StringBuilder block =
        new StringBuilder("from(bucket: ")
            .append(FluxSyntax.string(config.getBucket()))
            .append(")");
    for (String step : steps) {
      block.append('\n').append(INDENT).append(step);
    }
    return block.toString();
  }

  private String operationStep(Operation operation) {
    switch (operation.getType()) {
      case RATE:
        return "|> derivative(unit: 1s, nonNegative: true)";
      case DELTA:
        return "|> difference(nonNegative: false)";
      case MATH:
        MathOperation math = (MathOperation) operation;
        return "|> map(fn: (r) => ({ r with _value: r._value "
            + math.getOperator().getSymbol()
            + " "
            + FluxSyntax.number(math.getValue())
            + " }))";
      case HISTOGRAM_QUANTILE:
        return "|> histogramQuantile(quantile: "
            + FluxSyntax.number(((QuantileOperation) operation).getQuantile())
            + ")";
      case LABEL_JOIN:
        LabelJoinOperation join = (LabelJoinOperation) operation;
        String joined =
            join.getSourceLabels().stream()
                .map(FluxSyntax::column)
                .collect(
                    Collectors.joining(" + " + FluxSyntax.string(join.getSeparator()) + " + "));
        return "|> map(fn: (r) => ({ r with "
            + recordKey(join.getTargetLabel())
            + ": "
            + joined
            + " }))";
      default:
        throw new IllegalArgumentException("Unhandled operation " + operation.getType());
    }
  }

  private static String aggregationStep(Aggregation aggregation, Resolution resolution) {
    String function = function(aggregation);
    if (resolution.isAuto()) {
      return "|> " + function + "()";
    }
    return "|> aggregateWindow(every: "
        + resolution.getSeconds().getAsLong()
        + "s, fn: "
        + function
        + ", createEmpty: false)";
  }

  static String function(Aggregation aggregation) {
    switch (aggregation) {
      case AVERAGE:
        return "mean";
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

  private String predicate(LabelQuery query) {
    List<String> clauses = new ArrayList<>();
    List<MetricIdentifier> metrics = query.getMetrics();
    if (!metrics.isEmpty()) {
      String metricClause =
          metrics.stream().map(this::metricCondition).collect(Collectors.joining(" or "));
      clauses.add(metrics.size() > 1 ? "(" + metricClause + ")" : metricClause);
    }
    clauses.addAll(FilterToFluxConverter.conditions(query.getFilter()));
    return clauses.isEmpty() ? "true" : String.join(" and ", clauses);
  }

  private String metricCondition(MetricIdentifier metric) {
    FieldStrategy strategy = config.getFieldStrategy();
    return "(r._measurement == "
        + FluxSyntax.string(strategy.measurement(metric))
        + " and r._field == "
        + FluxSyntax.string(strategy.field(metric))
        + ")";
  }

  private static String recordKey(String label) {
    return IDENTIFIER.matcher(label).matches() ? label : FluxSyntax.string(label);
  }
}
