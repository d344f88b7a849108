package org.timeseries.access.rrd;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.timeseries.access.api.QueryException;
import org.timeseries.access.api.UnsupportedFeatureException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.Capability;
import org.timeseries.access.api.driver.AbstractQueryBuilder;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.MathOperation;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.OperationType;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.query.Stream;
import org.timeseries.access.api.time.TimeRange;

public class RrdQueryBuilder extends AbstractQueryBuilder<RrdQuery> {
  static final Duration DEFAULT_LABEL_LOOKBACK = Duration.ofHours(1);

  private final RrdConfig config;
  private final FilenameLabelStrategy labelStrategy;
  private final Set<RrdCommandType> supportedCommands;

  public RrdQueryBuilder(
      RrdConfig config,
      FilenameLabelStrategy labelStrategy,
      Set<RrdCommandType> supportedCommands,
      Capabilities capabilities,
      Clock clock) {
    super(capabilities, clock);
    this.config = config;
    this.labelStrategy = labelStrategy;
    this.supportedCommands = supportedCommands;
  }

  @Override
  protected RrdQuery compileData(DataQuery query) {
    TimeRange.Resolved range = resolve(query.getTimeRange());
    if (!range.getStart().isBefore(range.getEnd())) {
      throw new UnsupportedFeatureException(
          "empty-range", query, "RRD cannot export an empty time range " + query.getTimeRange());
    }
    long step = query.getResolution().getSeconds().orElse(config.getStep());
    RrdQuery.Builder compiled =
        RrdQuery.builder()
            .queryType(QueryType.DATA)
            .start(range.getStart())
            .end(range.getEnd())
            .step(step)
            .resolution(query.getResolution());

    List<Stream> streams = query.getStreams();
    for (int i = 0; i < streams.size(); i++) {
      Stream stream = streams.get(i);
      RrdStreamPlan.RrdStreamPlanBuilder plan =
          RrdStreamPlan.builder()
              .index(i)
              .metric(stream.getMetric())
              .directory(labelStrategy.metricDirectory(stream.getMetric()))
              .filter(stream.getFilter())
              .consolidation(consolidation(query, stream))
              .legend(stream.getAlias().orElse(stream.getMetric().key()))
              .alias(stream.getAlias().orElse(null));
      for (Operation operation : stream.getPipeline()) {
        if (operation.getType() != OperationType.MATH) {
          throw new UnsupportedFeatureException(
              Capability.forOperation(operation.getType()).getFeature(),
              query,
              "rrdtool cannot apply " + operation.getType());
        }
        plan.mathOperation((MathOperation) operation);
      }
      RrdStreamPlan built = plan.build();
      compiled.stream(built);
      compiled.command(list(built.getDirectory().toString(), query));
    }
    compiled.command(
        command(
            RrdCommand.builder()
                .type(RrdCommandType.XPORT)
                .option("--start")
                .option(Long.toString(range.getStart().getEpochSecond()))
                .option("--end")
                .option(Long.toString(range.getEnd().getEpochSecond()))
                .option("--step")
                .option(Long.toString(step))
                .option("--json")
                .build(),
            query));
    return compiled.build();
  }

  @Override
  protected RrdQuery compileLabels(LabelQuery query) {
    TimeRange.Resolved range =
        resolve(query.getTimeRange().orElse(TimeRange.last(DEFAULT_LABEL_LOOKBACK)));
    return RrdQuery.builder()
        .queryType(QueryType.LABEL)
        .labelKind(query.getKind())
        .label(query.getLabel().orElse(null))
        .filter(query.getFilter())
        .metrics(query.getMetrics())
        .command(list(labelStrategy.getDirectory().toString(), query))
        .start(range.getStart())
        .end(range.getEnd())
        .step(config.getStep())
        .resolution(Resolution.auto())
        .build();
  }

  private RrdCommand list(String directory, Query query) {
    return command(
        RrdCommand.builder()
            .type(RrdCommandType.LIST)
            .option("--recursive")
            .argument(directory)
            .build(),
        query);
  }

  private RrdCommand command(RrdCommand command, Query query) {
    if (!supportedCommands.contains(command.getType())) {
      throw new QueryException(
          query,
          String.format(
              "Command '%s' is not supported in %s mode",
              command.getType().getCommand(), config.getMode()));
    }
    return command;
  }

  private ConsolidationFunction consolidation(DataQuery query, Stream stream) {
    List<Aggregation> aggregations = stream.getAggregations();
    if (aggregations.isEmpty()) {
      return config.getDefaultConsolidation();
    }
    if (aggregations.size() > 1) {
      throw new UnsupportedFeatureException(
          Capability.AGGREGATION.getFeature(),
          query,
          "rrdtool applies a single consolidation function per stream, got " + aggregations);
    }
    Aggregation aggregation = aggregations.get(0);
    return ConsolidationFunction.of(aggregation)
        .orElseThrow(
            () ->
                new UnsupportedFeatureException(
                    Capability.AGGREGATION.getFeature(),
                    query,
                    aggregation + " is not an rrdtool consolidation function"));
  }
}
