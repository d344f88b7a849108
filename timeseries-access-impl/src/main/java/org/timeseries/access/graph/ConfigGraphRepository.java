package org.timeseries.access.graph;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.ConfigUtils;
import org.timeseries.access.TimeseriesAccessConfig;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.TimeseriesException;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.MatchType;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.BasicOperation;
import org.timeseries.access.api.query.LabelJoinOperation;
import org.timeseries.access.api.query.MathOperation;
import org.timeseries.access.api.query.MathOperator;
import org.timeseries.access.api.query.Operation;
import org.timeseries.access.api.query.OperationType;
import org.timeseries.access.api.query.QuantileOperation;

/**
 * Graphs declared under {@code timeseries.graphs}. Every series must name a metric known to the
 * metric repository.
 */
@Slf4j
@Singleton
public class ConfigGraphRepository extends RuntimeGraphRepository {
  private static final String CONFIG_PATH_ID = "id";
  private static final String CONFIG_PATH_TITLE = "title";
  private static final String CONFIG_PATH_DESCRIPTION = "description";
  private static final String CONFIG_PATH_SERIES = "series";
  private static final String CONFIG_PATH_VARIABLES = "variables";
  private static final String CONFIG_PATH_METRIC = "metric";
  private static final String CONFIG_PATH_LEGEND = "legend";
  private static final String CONFIG_PATH_AGGREGATION = "aggregation";
  private static final String CONFIG_PATH_FILTER = "filter";
  private static final String CONFIG_PATH_OPERATIONS = "operations";
  private static final String CONFIG_PATH_NAME = "name";
  private static final String CONFIG_PATH_REQUIRED = "required";
  private static final String CONFIG_PATH_DEFAULT = "default";
  private static final String CONFIG_PATH_OPERATORS = "operators";
  private static final String CONFIG_PATH_TYPE = "type";
  private static final String CONFIG_PATH_OPERATOR = "operator";
  private static final String CONFIG_PATH_VALUE = "value";
  private static final String CONFIG_PATH_QUANTILE = "quantile";
  private static final String CONFIG_PATH_TARGET = "target";
  private static final String CONFIG_PATH_SEPARATOR = "separator";
  private static final String CONFIG_PATH_SOURCES = "sources";

  private final Supplier<List<? extends Config>> source;
  private final MetricRepository metrics;

  @Inject
  public ConfigGraphRepository(TimeseriesAccessConfig config, MetricRepository metrics) {
    this(config::getGraphConfigs, metrics);
  }

  public ConfigGraphRepository(Supplier<List<? extends Config>> source, MetricRepository metrics) {
    this.source = source;
    this.metrics = metrics;
    reload();
  }

  @Override
  public void reload() {
    List<GraphDefinition> graphs = new ArrayList<>();
    for (Config graphConfig : source.get()) {
      GraphDefinition graph = parse(graphConfig);
      log.debug("Loaded graph {} with {} series", graph.getId(), graph.getSeries().size());
      graphs.add(graph);
    }
    replaceAll(graphs);
  }

  GraphDefinition parse(Config config) {
    String id = ConfigUtils.getString(config, CONFIG_PATH_ID, "<unnamed>");
    try {
      GraphDefinition.GraphDefinitionBuilder graph =
          GraphDefinition.builder()
              .id(ConfigUtils.requireString(config, CONFIG_PATH_ID))
              .title(ConfigUtils.requireString(config, CONFIG_PATH_TITLE))
              .description(ConfigUtils.getString(config, CONFIG_PATH_DESCRIPTION, null));
      if (!config.hasPath(CONFIG_PATH_SERIES)) {
        throw new ConfigurationException("Missing '" + CONFIG_PATH_SERIES + "'");
      }
      for (Config seriesConfig : config.getConfigList(CONFIG_PATH_SERIES)) {
        graph.series(parseSeries(seriesConfig));
      }
      ConfigUtils.optionallyGet(config, CONFIG_PATH_VARIABLES, Config::getConfigList)
          .ifPresent(variables -> variables.forEach(v -> graph.variable(parseVariable(v))));
      return graph.build();
    } catch (ConfigException | IllegalArgumentException | TimeseriesException e) {
      throw new ConfigurationException(
          "Invalid graph definition '" + id + "': " + e.getMessage(), e);
    }
  }

  private SeriesDefinition parseSeries(Config config) {
    String metric = ConfigUtils.requireString(config, CONFIG_PATH_METRIC);
    if (!metrics.has(metric)) {
      throw new ConfigurationException("Unknown metric '" + metric + "'");
    }
    SeriesDefinition.SeriesDefinitionBuilder series =
        SeriesDefinition.builder()
            .metric(metric)
            .legend(ConfigUtils.getString(config, CONFIG_PATH_LEGEND, null));
    ConfigUtils.optionallyGet(config, CONFIG_PATH_AGGREGATION, Config::getString)
        .map(Aggregation::fromName)
        .ifPresent(series::aggregation);
    ConfigUtils.optionallyGet(config, CONFIG_PATH_FILTER, Config::getObject)
        .map(filter -> LabelFilter.fromArray(filter.unwrapped()))
        .ifPresent(series::filter);
    ConfigUtils.optionallyGet(config, CONFIG_PATH_OPERATIONS, Config::getList)
        .ifPresent(operations -> operations.forEach(v -> series.operation(parseOperation(v))));
    return series.build();
  }

  private static Operation parseOperation(ConfigValue value) {
    if (value.valueType() == ConfigValueType.STRING) {
      return BasicOperation.of(operationType((String) value.unwrapped()));
    }
    if (value.valueType() != ConfigValueType.OBJECT) {
      throw new ConfigurationException("Operation must be a name or an object, got " + value);
    }
    Config operation = ((ConfigObject) value).toConfig();
    OperationType type = operationType(ConfigUtils.requireString(operation, CONFIG_PATH_TYPE));
    switch (type) {
      case MATH:
        return MathOperation.of(
            MathOperator.fromSymbol(ConfigUtils.requireString(operation, CONFIG_PATH_OPERATOR)),
            operation.getDouble(CONFIG_PATH_VALUE));
      case HISTOGRAM_QUANTILE:
        return QuantileOperation.of(operation.getDouble(CONFIG_PATH_QUANTILE));
      case LABEL_JOIN:
        return LabelJoinOperation.of(
            ConfigUtils.requireString(operation, CONFIG_PATH_TARGET),
            ConfigUtils.getString(operation, CONFIG_PATH_SEPARATOR, ""),
            operation.getStringList(CONFIG_PATH_SOURCES));
      default:
        return BasicOperation.of(type);
    }
  }

  private static OperationType operationType(String name) {
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("QUANTILE")) {
      return OperationType.HISTOGRAM_QUANTILE;
    }
    return OperationType.valueOf(normalized);
  }

  private static GraphVariable parseVariable(Config config) {
    GraphVariable.GraphVariableBuilder variable =
        GraphVariable.builder()
            .name(ConfigUtils.requireString(config, CONFIG_PATH_NAME))
            .required(
                ConfigUtils.optionallyGet(config, CONFIG_PATH_REQUIRED, Config::getBoolean)
                    .orElse(false))
            .defaultValue(ConfigUtils.getString(config, CONFIG_PATH_DEFAULT, null));
    ConfigUtils.optionallyGet(config, CONFIG_PATH_OPERATORS, Config::getStringList)
        .ifPresent(
            operators ->
                operators.forEach(tag -> variable.allowedOperator(MatchType.fromTag(tag))));
    return variable.build();
  }
}
