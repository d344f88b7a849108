package org.timeseries.access.graphite;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.Capability;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.data.TimeSeries;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.driver.AbstractDriver;
import org.timeseries.access.driver.ResponseParseException;

public class GraphiteDriver extends AbstractDriver<GraphiteQuery> {
  public static final String NAME = "graphite";
  public static final Capabilities CAPABILITIES =
      Capabilities.builder()
          .support(Capability.RATE)
          .support(Capability.DELTA)
          .support(Capability.MATH)
          .support(Capability.AGGREGATION)
          .support(Capability.REGEX)
          .support(Capability.LABEL_DISCOVERY)
          .support(Capability.WRITE)
          .build();

  private final GraphitePaths paths;

  public GraphiteDriver(GraphiteConfig config, Clock clock) {
    this(config, new GraphiteConnectionAdapter(config), clock);
  }

  public GraphiteDriver(GraphiteConfig config, ConnectionAdapter adapter, Clock clock) {
    this(new GraphitePaths(config.getPrefix()), adapter, clock);
  }

  private GraphiteDriver(GraphitePaths paths, ConnectionAdapter adapter, Clock clock) {
    super(
        NAME,
        CAPABILITIES,
        adapter,
        new GraphiteQueryBuilder(paths, CAPABILITIES, clock),
        GraphiteQuery.class);
    this.paths = paths;
  }

  @Override
  protected Result execute(GraphiteQuery query) {
    return query.getQueryType() == QueryType.DATA ? executeData(query) : executeLabels(query);
  }

  private Result executeData(GraphiteQuery query) {
    List<TimeSeries> series = new ArrayList<>();
    for (GraphiteQuery.Target target : query.getTargets()) {
      CommandResponse response =
          getAdapter()
              .executeCommand(
                  GraphiteConnectionAdapter.COMMAND_RENDER, renderParameters(query, target));
      if (!response.isSuccess()) {
        return failedResponse(query, response);
      }
      for (GraphiteRenderResponse rendered : parseRender(response.getData())) {
        series.add(toSeries(target, rendered));
      }
    }
    return TimeSeriesResult.of(series, query.getFrom(), query.getUntil(), query.getResolution());
  }

  private TimeSeries toSeries(GraphiteQuery.Target target, GraphiteRenderResponse rendered) {
    Map<String, String> labels =
        seriesPath(target.getMetric(), rendered.seriesName())
            .flatMap(seriesPath -> paths.labels(target.getMetric(), seriesPath))
            .orElse(Map.of());
    return TimeSeries.builder()
        .metric(target.getMetric().key())
        .alias(target.getAlias().orElse(null))
        .labels(labels)
        .points(rendered.points())
        .build();
  }

  /** The plain series path inside a possibly function-wrapped render name. */
  private Optional<String> seriesPath(MetricIdentifier metric, String name) {
    if (name == null) {
      return Optional.empty();
    }
    String base = paths.base(metric);
    int start = name.indexOf(base);
    if (start < 0) {
      return Optional.empty();
    }
    int end = start;
    while (end < name.length() && ",) ".indexOf(name.charAt(end)) < 0) {
      end++;
    }
    return Optional.of(name.substring(start, end));
  }

  private Result executeLabels(GraphiteQuery query) {
    return handleResponse(
        query,
        getAdapter().executeCommand(GraphiteConnectionAdapter.COMMAND_INDEX, ""),
        data -> {
          LabelQueryKind kind = query.getLabelKind().orElseThrow();
          Set<String> values = new TreeSet<>();
          for (String path : parseIndex(data)) {
            for (MetricIdentifier metric : query.getMetrics()) {
              Optional<Map<String, String>> labels = paths.labels(metric, path);
              if (labels.isEmpty() || !GraphitePaths.matches(labels.get(), query.getFilter())) {
                continue;
              }
              if (kind == LabelQueryKind.LABEL_NAMES) {
                values.addAll(labels.get().keySet());
              } else {
                Optional.ofNullable(labels.get().get(query.getLabel().orElseThrow()))
                    .ifPresent(values::add);
              }
            }
          }
          return LabelResult.of(kind, values);
        });
  }

  @Override
  protected Result failure(GraphiteQuery query, String error) {
    if (query.getQueryType() == QueryType.DATA) {
      return TimeSeriesResult.failure(
          error, query.getFrom(), query.getUntil(), query.getResolution());
    }
    return LabelResult.failure(query.getLabelKind().orElseThrow(), error);
  }

  @Override
  protected WriteResult doWrite(List<MetricSample> samples) {
    String lines = samples.stream().map(this::plaintext).collect(Collectors.joining("\n"));
    return handleWriteResponse(
        getAdapter().executeCommand(GraphiteConnectionAdapter.COMMAND_WRITE, lines),
        samples.size());
  }

  /**
   * Carbon plaintext: {@code <path> <value> <epoch seconds>}.
   *
   * @throws ValidationException if the value is NaN or infinite
   */
  String plaintext(MetricSample sample) {
    if (!Double.isFinite(sample.getValue())) {
      throw new ValidationException(
          "Cannot write non-finite value "
              + sample.getValue()
              + " for "
              + sample.getMetric().key());
    }
    return paths.path(sample.getMetric(), sample.getLabels())
        + " "
        + GraphiteQueryBuilder.number(sample.getValue())
        + " "
        + sample.getTimestamp().getEpochSecond();
  }

  private static String renderParameters(GraphiteQuery query, GraphiteQuery.Target target) {
    Map<String, List<String>> parameters = new LinkedHashMap<>();
    parameters.put("target", List.of(target.getExpression()));
    parameters.put("from", List.of(Long.toString(query.getFrom().getEpochSecond())));
    parameters.put("until", List.of(Long.toString(query.getUntil().getEpochSecond())));
    parameters.put("format", List.of(query.getFormat()));
    return GraphiteConnectionAdapter.encodeParameters(parameters);
  }

  private static List<GraphiteRenderResponse> parseRender(String json) {
    try {
      return GraphiteRenderResponse.fromJson(json);
    } catch (IOException e) {
      throw new ResponseParseException("Invalid render response: " + e.getMessage(), e);
    }
  }

  private static List<String> parseIndex(String json) {
    try {
      return GraphiteRenderResponse.indexFromJson(json);
    } catch (IOException e) {
      throw new ResponseParseException("Invalid metrics index: " + e.getMessage(), e);
    }
  }
}
