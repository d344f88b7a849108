package org.timeseries.access.rrd;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.Capability;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.data.TimeSeries;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.metric.RetentionPolicy;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.driver.AbstractDriver;
import org.timeseries.access.rrd.FilenameLabelStrategy.RrdFile;

@Slf4j
public class RrdDriver extends AbstractDriver<RrdQuery> {
  public static final String NAME = "rrd";
  public static final Capabilities CAPABILITIES =
      Capabilities.builder()
          .support(
              Capability.AGGREGATION,
              Capability.MATH,
              Capability.LABEL_DISCOVERY,
              Capability.WRITE)
          .build();

  private final RrdConfig config;
  private final FilenameLabelStrategy labelStrategy;
  private final RrdXportParser parser = new RrdXportParser();

  public RrdDriver(RrdConfig config, Clock clock) {
    this(config, adapter(config, ProcessLauncher.DEFAULT), clock);
  }

  public RrdDriver(RrdConfig config, ConnectionAdapter adapter, Clock clock) {
    this(config, new FilenameLabelStrategy(config.getDirectory()), adapter, clock);
  }

  private RrdDriver(
      RrdConfig config,
      FilenameLabelStrategy labelStrategy,
      ConnectionAdapter adapter,
      Clock clock) {
    super(
        NAME,
        CAPABILITIES,
        adapter,
        new RrdQueryBuilder(
            config, labelStrategy, supportedCommands(config.getMode()), CAPABILITIES, clock),
        RrdQuery.class);
    this.config = config;
    this.labelStrategy = labelStrategy;
  }

  static ConnectionAdapter adapter(RrdConfig config, ProcessLauncher launcher) {
    switch (config.getMode()) {
      case PERSISTENT:
        return new PersistentProcessConnectionAdapter(config, launcher);
      case RRDCACHED:
        return new RrdCachedConnectionAdapter(config);
      case PROCESS:
      default:
        return new LocalProcessConnectionAdapter(config, launcher);
    }
  }

  static Set<RrdCommandType> supportedCommands(RrdMode mode) {
    return mode == RrdMode.RRDCACHED
        ? RrdCommandType.RRDCACHED_SUPPORTED
        : EnumSet.allOf(RrdCommandType.class);
  }

  @Override
  protected Result execute(RrdQuery query) {
    return query.getQueryType() == QueryType.DATA ? executeData(query) : executeLabels(query);
  }

  private Result executeData(RrdQuery query) {
    List<RrdCommand> listings = query.getListCommands();
    List<List<RrdFile>> matched = new ArrayList<>();
    for (int i = 0; i < listings.size(); i++) {
      RrdStreamPlan stream = query.getStreams().get(i);
      CommandResponse listing = run(listings.get(i));
      if (!listing.isSuccess()) {
        return failedResponse(query, listing);
      }
      matched.add(
          labelStrategy.metricFiles(listing.getData(), stream.getDirectory()).stream()
              .filter(file -> labelStrategy.matches(file.getLabels(), stream.getFilter()))
              .collect(Collectors.toList()));
    }
    List<List<Path>> files =
        matched.stream()
            .map(list -> list.stream().map(RrdFile::getPath).collect(Collectors.toList()))
            .collect(Collectors.toList());
    List<RrdStreamPlan> exported = query.exportedStreams(files);
    if (exported.isEmpty()) {
      log.debug("No RRD files match {}", query.getRawQuery());
      return TimeSeriesResult.empty(query.getStart(), query.getEnd(), query.getResolution());
    }

    return handleResponse(
        query,
        run(query.xport(files)),
        json -> {
          RrdXportParser.Xport xport = parser.parse(json);
          List<TimeSeries> series = new ArrayList<>();
          int columns = Math.min(xport.getColumns().size(), exported.size());
          for (int column = 0; column < columns; column++) {
            RrdStreamPlan stream = exported.get(column);
            series.add(
                TimeSeries.builder()
                    .metric(stream.getMetric().key())
                    .alias(stream.getAlias().orElse(null))
                    .labels(commonLabels(matched.get(stream.getIndex())))
                    .points(xport.getColumns().get(column))
                    .build());
          }
          return TimeSeriesResult.of(
              series, query.getStart(), query.getEnd(), query.getResolution());
        });
  }

  private Result executeLabels(RrdQuery query) {
    RrdCommand listing = query.getListCommands().get(0);
    return handleResponse(
        query,
        run(listing),
        data -> {
          Set<String> metricKeys =
              query.getMetrics().stream().map(MetricIdentifier::key).collect(Collectors.toSet());
          LabelQueryKind kind = query.getLabelKind().orElseThrow();
          Set<String> values = new TreeSet<>();
          for (RrdFile file : labelStrategy.parseListing(data, labelStrategy.getDirectory())) {
            String metric = labelStrategy.metricKey(file).orElse(null);
            if (metric == null
                || (!metricKeys.isEmpty() && !metricKeys.contains(metric))
                || !labelStrategy.matches(file.getLabels(), query.getFilter())) {
              continue;
            }
            switch (kind) {
              case METRIC_NAMES:
                values.add(metric);
                break;
              case LABEL_NAMES:
                values.addAll(file.getLabels().keySet());
                break;
              case LABEL_VALUES:
                String value = file.getLabels().get(query.getLabel().orElseThrow());
                if (value != null) {
                  values.add(value);
                }
                break;
              default:
                throw new IllegalArgumentException("Unhandled label query kind " + kind);
            }
          }
          return LabelResult.of(kind, values);
        });
  }

  @Override
  protected Result failure(RrdQuery query, String error) {
    if (query.getQueryType() == QueryType.DATA) {
      return TimeSeriesResult.failure(
          error, query.getStart(), query.getEnd(), query.getResolution());
    }
    return LabelResult.failure(query.getLabelKind().orElseThrow(), error);
  }

  @Override
  protected WriteResult doWrite(List<MetricSample> samples) {
    int written = 0;
    for (MetricSample sample : samples) {
      Path file = labelStrategy.path(sample.getMetric(), sample.getLabels());
      CommandResponse created = run(create(file, sample.getMetric()));
      if (!created.isSuccess() && !alreadyExists(created)) {
        return handlePartialWrite(created, written);
      }
      CommandResponse updated = run(update(file, sample));
      if (!updated.isSuccess()) {
        return handlePartialWrite(updated, written);
      }
      written++;
    }
    return WriteResult.success(written);
  }

  RrdCommand create(Path file, MetricIdentifier metric) {
    long heartbeat = config.getStep() * 2;
    String sourceType = metric.getType() == MetricType.COUNTER ? "COUNTER" : "GAUGE";
    RrdCommand.RrdCommandBuilder command =
        RrdCommand.builder()
            .type(RrdCommandType.CREATE)
            .target(file.toString())
            .option("--step")
            .option(Long.toString(config.getStep()))
            .option("--no-overwrite")
            .argument("DS:value:" + sourceType + ":" + heartbeat + ":U:U");
    List<RetentionPolicy> retention =
        metric.getRetentionPolicies().isEmpty()
            ? config.getDefaultRetention()
            : metric.getRetentionPolicies();
    for (ConsolidationFunction function : ConsolidationFunction.values()) {
      for (RetentionPolicy policy : retention) {
        long steps = Math.max(1, policy.getResolution().getSeconds() / config.getStep());
        long rows = Math.max(1, policy.getRetention().getSeconds() / (steps * config.getStep()));
        command.argument("RRA:" + function.name() + ":0.5:" + steps + ":" + rows);
      }
    }
    return command.build();
  }

  static RrdCommand update(Path file, MetricSample sample) {
    String value;
    if (!Double.isFinite(sample.getValue())) {
      value = "U";
    } else if (sample.getMetric().getType() == MetricType.COUNTER && sample.isIntegral()) {
      value = Long.toString((long) sample.getValue());
    } else {
      value = RrdQuery.number(sample.getValue());
    }
    return RrdCommand.builder()
        .type(RrdCommandType.UPDATE)
        .target(file.toString())
        .argument(sample.getTimestamp().getEpochSecond() + ":" + value)
        .build();
  }

  private CommandResponse run(RrdCommand command) {
    return getAdapter().executeCommand(command.getType().getCommand(), command.toData());
  }

  private static boolean alreadyExists(CommandResponse response) {
    return response.getError().map(error -> error.contains("exists")).orElse(false);
  }

  /** Labels shared, with the same value, by every file. */
  private static Map<String, String> commonLabels(List<RrdFile> files) {
    if (files.isEmpty()) {
      return Map.of();
    }
    Map<String, String> common = new HashMap<>(files.get(0).getLabels());
    for (RrdFile file : files.subList(1, files.size())) {
      common
          .entrySet()
          .removeIf(entry -> !entry.getValue().equals(file.getLabels().get(entry.getKey())));
    }
    return common;
  }
}
