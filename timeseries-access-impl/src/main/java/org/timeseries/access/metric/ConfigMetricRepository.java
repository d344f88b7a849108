package org.timeseries.access.metric;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import java.util.List;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.ConfigUtils;
import org.timeseries.access.TimeseriesAccessConfig;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.TimeseriesException;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.metric.RetentionPolicy;
import org.timeseries.access.api.query.Aggregation;

/**
 * Metrics declared under {@code timeseries.metrics}. Metrics registered at runtime are kept next to
 * the configured ones.
 */
@Slf4j
@Singleton
public class ConfigMetricRepository extends RuntimeMetricRepository {
  private static final String CONFIG_PATH_NAMESPACE = "namespace";
  private static final String CONFIG_PATH_NAME = "name";
  private static final String CONFIG_PATH_UNIT = "unit";
  private static final String CONFIG_PATH_TYPE = "type";
  private static final String CONFIG_PATH_LABELS = "labels";
  private static final String CONFIG_PATH_AGGREGATIONS = "aggregations";
  private static final String CONFIG_PATH_RETENTION = "retention";
  private static final String CONFIG_PATH_RESOLUTION = "resolution";

  @Inject
  public ConfigMetricRepository(TimeseriesAccessConfig config) {
    this(config.getMetricConfigs());
  }

  public ConfigMetricRepository(List<? extends Config> metricConfigs) {
    for (Config metricConfig : metricConfigs) {
      MetricIdentifier metric = parse(metricConfig);
      log.debug("Loaded metric {}", metric.key());
      register(metric);
    }
  }

  static MetricIdentifier parse(Config config) {
    try {
      MetricIdentifier.MetricIdentifierBuilder metric =
          MetricIdentifier.builder()
              .namespace(ConfigUtils.getString(config, CONFIG_PATH_NAMESPACE, null))
              .name(ConfigUtils.requireString(config, CONFIG_PATH_NAME))
              .unit(ConfigUtils.getString(config, CONFIG_PATH_UNIT, null))
              .type(
                  MetricType.valueOf(
                      ConfigUtils.getString(config, CONFIG_PATH_TYPE, MetricType.GAUGE.name())
                          .toUpperCase(Locale.ROOT)));
      ConfigUtils.optionallyGet(config, CONFIG_PATH_LABELS, Config::getStringList)
          .ifPresent(metric::labels);
      ConfigUtils.optionallyGet(config, CONFIG_PATH_AGGREGATIONS, Config::getStringList)
          .ifPresent(
              names -> names.forEach(name -> metric.aggregation(Aggregation.fromName(name))));
      ConfigUtils.optionallyGet(config, CONFIG_PATH_RETENTION, Config::getConfigList)
          .ifPresent(
              policies ->
                  policies.forEach(
                      policy ->
                          metric.retentionPolicy(
                              new RetentionPolicy(
                                  ConfigUtils.requireString(policy, CONFIG_PATH_NAME),
                                  policy.getDuration(CONFIG_PATH_RESOLUTION),
                                  policy.getDuration(CONFIG_PATH_RETENTION)))));
      return metric.build();
    } catch (ConfigException | IllegalArgumentException | TimeseriesException e) {
      throw new ConfigurationException("Invalid metric definition: " + e.getMessage(), e);
    }
  }
}
