package org.timeseries.access.rrd;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
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
import org.timeseries.access.api.query.MathOperation;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;

/**
 * Compiled RRD query. Data queries list the files of each stream, then export the matches with a
 * single {@code xport}; the xport arguments depend on the listing and are produced by {@link
 * #xport(List)}.
 */
@Value
@Builder(builderClassName = "Builder")
public class RrdQuery implements CompiledQuery {
  @NonNull QueryType queryType;
  @Singular List<RrdCommand> commands;
  @Singular List<RrdStreamPlan> streams;
  @NonNull Instant start;
  @NonNull Instant end;
  long step;
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

  /** The listing commands, one per stream for data queries. */
  public List<RrdCommand> getListCommands() {
    return commands.stream()
        .filter(command -> command.getType() == RrdCommandType.LIST)
        .collect(Collectors.toList());
  }

  /**
   * Builds the xport command for the files found per stream. Streams without files are left out;
   * the exported legends follow stream order.
   */
  public RrdCommand xport(List<List<Path>> filesPerStream) {
    RrdCommand.RrdCommandBuilder command =
        RrdCommand.builder()
            .type(RrdCommandType.XPORT)
            .option("--start")
            .option(Long.toString(start.getEpochSecond()))
            .option("--end")
            .option(Long.toString(end.getEpochSecond()))
            .option("--step")
            .option(Long.toString(step))
            .option("--json");
    for (int i = 0; i < streams.size() && i < filesPerStream.size(); i++) {
      RrdStreamPlan stream = streams.get(i);
      List<Path> files = filesPerStream.get(i);
      if (files.isEmpty()) {
        continue;
      }
      List<String> definitions = new ArrayList<>();
      for (int j = 0; j < files.size(); j++) {
        definitions.add(
            stream.vname()
                + "f"
                + j
                + "="
                + escape(files.get(j).toString())
                + ":value:"
                + stream.getConsolidation().name());
      }
      definitions.forEach(definition -> command.argument("DEF:" + definition));

      String current = stream.vname() + "f0";
      if (files.size() > 1) {
        StringBuilder sum = new StringBuilder(current);
        for (int j = 1; j < files.size(); j++) {
          sum.append(',').append(stream.vname()).append('f').append(j).append(",ADDNAN");
        }
        current = stream.vname() + "_combined";
        command.argument("CDEF:" + current + "=" + sum);
      }
      if (!stream.getMathOperations().isEmpty()) {
        StringBuilder rpn = new StringBuilder(current);
        for (MathOperation operation : stream.getMathOperations()) {
          rpn.append(',')
              .append(number(operation.getValue()))
              .append(',')
              .append(operation.getOperator().getSymbol());
        }
        current = stream.vname() + "_calc";
        command.argument("CDEF:" + current + "=" + rpn);
      }
      command.argument("XPORT:" + current + ":" + escape(stream.getLegend()));
    }
    return command.build();
  }

  /** Streams that {@link #xport(List)} exports for the given listing, in legend order. */
  public List<RrdStreamPlan> exportedStreams(List<List<Path>> filesPerStream) {
    List<RrdStreamPlan> exported = new ArrayList<>();
    for (int i = 0; i < streams.size() && i < filesPerStream.size(); i++) {
      if (!filesPerStream.get(i).isEmpty()) {
        exported.add(streams.get(i));
      }
    }
    return exported;
  }

  @Override
  public String getRawQuery() {
    return commands.stream().map(RrdCommand::toLine).collect(Collectors.joining("\n"));
  }

  static String escape(String value) {
    return value.replace(":", "\\:");
  }

  static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
