package org.timeseries.access.graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.TimeseriesConnection;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.metric.UnknownMetricException;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.OperationType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.query.Stream;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.time.TimeRange;

/**
 * Renders stored graph definitions: binds variables, checks the graph against the metric
 * catalogue, then compiles and runs one stream per series on a connection.
 */
@Slf4j
public class GraphService {
  private final GraphRepository graphs;
  private final MetricRepository metrics;
  private final TimeseriesConnection connection;

  public GraphService(
      GraphRepository graphs, MetricRepository metrics, TimeseriesConnection connection) {
    this.graphs = graphs;
    this.metrics = metrics;
    this.connection = connection;
  }

  public GraphDefinition load(String id) {
    return graphs.load(id);
  }

  public TimeSeriesResult render(String id, TimeRange range, List<VariableBinding> bindings) {
    return render(graphs.load(id), range, bindings, Resolution.auto());
  }

  public TimeSeriesResult render(
      String id, TimeRange range, List<VariableBinding> bindings, Resolution resolution) {
    return render(graphs.load(id), range, bindings, resolution);
  }

  /**
   * @throws InvalidGraphException if a variable cannot be bound or a series is invalid for its
   *     metric
   * @throws org.timeseries.access.api.QueryException if the connection cannot run the graph
   */
  public TimeSeriesResult render(
      GraphDefinition graph,
      TimeRange range,
      List<VariableBinding> bindings,
      Resolution resolution) {
    LabelFilter bound = bind(graph, bindings);
    DataQuery query = toQuery(graph, bound, range, resolution);
    log.debug("Rendering graph {} on {}", graph.getId(), connection.getName());
    Result result = connection.execute(connection.compile(query));
    if (!(result instanceof TimeSeriesResult)) {
      throw new IllegalStateException(
          "Connection " + connection.getName() + " returned a non time-series result");
    }
    return (TimeSeriesResult) result;
  }

  /** Matchers contributed by bound and defaulted variables. */
  LabelFilter bind(GraphDefinition graph, List<VariableBinding> bindings) {
    Map<String, VariableBinding> byLabel = new LinkedHashMap<>();
    for (VariableBinding binding : bindings) {
      byLabel.put(binding.getLabel(), binding);
    }
    LabelFilter filter = LabelFilter.empty();
    for (GraphVariable variable : graph.getVariables()) {
      VariableBinding binding = byLabel.remove(variable.getName());
      if (binding != null && binding.hasValue()) {
        if (!variable.allows(binding.getMatchType())) {
          throw new InvalidGraphException(
              "Operator '"
                  + binding.getMatchType().getSymbol()
                  + "' not allowed for '"
                  + variable.getName()
                  + "'");
        }
        filter = filter.with(variable.getName(), binding.toMatcher());
      } else if (variable.getDefaultValue().isPresent()) {
        filter =
            filter.with(variable.getName(), LabelMatcher.equal(variable.getDefaultValue().get()));
      } else if (variable.isRequired()) {
        throw new InvalidGraphException(
            "Missing required variable '" + variable.getName() + "'");
      }
    }
    if (!byLabel.isEmpty()) {
      log.debug(
          "Ignoring bindings for undeclared variables {} of {}", byLabel.keySet(), graph.getId());
    }
    return filter;
  }

  private DataQuery toQuery(
      GraphDefinition graph, LabelFilter bound, TimeRange range, Resolution resolution) {
    if (graph.getSeries().isEmpty()) {
      throw new InvalidGraphException("Graph " + graph.getId() + " has no series");
    }
    DataQuery.DataQueryBuilder query =
        DataQuery.builder().timeRange(range).resolution(resolution);
    for (SeriesDefinition series : graph.getSeries()) {
      MetricIdentifier metric = validate(series);
      query.stream(
          Stream.builder()
              .metric(metric)
              .filter(series.getFilter().merge(bound))
              .pipeline(series.getPipeline())
              .aggregation(series.getAggregation())
              .alias(series.getLegend().orElse(null))
              .build());
    }
    return query.build();
  }

  private MetricIdentifier validate(SeriesDefinition series) {
    MetricIdentifier metric;
    try {
      metric = metrics.get(series.getMetric());
    } catch (UnknownMetricException e) {
      throw new InvalidGraphException("Unknown metric: " + series.getMetric(), e);
    }
    if (!metric.supportsAggregation(series.getAggregation())) {
      throw new InvalidGraphException(
          "Aggregation '"
              + series.getAggregation()
              + "' is invalid for metric '"
              + metric.key()
              + "'");
    }
    if (metric.getType() == MetricType.COUNTER && !series.hasOperation(OperationType.RATE)) {
      throw new InvalidGraphException(
          "Counter metric '" + metric.key() + "' must be queried using rate");
    }
    return metric;
  }
}
