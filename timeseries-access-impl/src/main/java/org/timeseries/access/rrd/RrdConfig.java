package org.timeseries.access.rrd;

import com.typesafe.config.Config;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.ConfigUtils;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.metric.RetentionPolicy;
import org.timeseries.access.connection.RetryPolicy;

@Value
@Builder
public class RrdConfig {
  private static final String CONFIG_PATH_DIRECTORY = "directory";
  private static final String CONFIG_PATH_MODE = "mode";
  private static final String CONFIG_PATH_RRDTOOL = "rrdtool";
  private static final String CONFIG_PATH_RRDCACHED = "rrdcached";
  private static final String CONFIG_PATH_TIMEOUT = "timeout";
  private static final String CONFIG_PATH_STEP = "step";
  private static final String CONFIG_PATH_CONSOLIDATION = "default-consolidation";
  private static final String CONFIG_PATH_RETRY = "retry";

  static final List<RetentionPolicy> DEFAULT_RETENTION =
      List.of(
          new RetentionPolicy("5m-1w", Duration.ofMinutes(5), Duration.ofDays(7)),
          new RetentionPolicy("1h-62d", Duration.ofHours(1), Duration.ofDays(62)),
          new RetentionPolicy("1d-1y", Duration.ofDays(1), Duration.ofDays(366)));

  @NonNull Path directory;
  @Builder.Default RrdMode mode = RrdMode.PROCESS;
  @Builder.Default String rrdtool = "rrdtool";
  String rrdcachedAddress;
  @Builder.Default Duration timeout = Duration.ofSeconds(10);
  @Builder.Default long step = 300;
  @Builder.Default ConsolidationFunction defaultConsolidation = ConsolidationFunction.AVERAGE;
  @Builder.Default RetryPolicy retryPolicy = RetryPolicy.defaults();
  @Singular("retention") List<RetentionPolicy> defaultRetention;

  public static RrdConfig from(Config config) {
    RrdMode mode = ConfigUtils.getEnum(config, CONFIG_PATH_MODE, RrdMode.class, RrdMode.PROCESS);
    String rrdcached = ConfigUtils.getString(config, CONFIG_PATH_RRDCACHED, null);
    if (mode == RrdMode.RRDCACHED && (rrdcached == null || rrdcached.isBlank())) {
      throw new ConfigurationException("rrdcached mode requires the 'rrdcached' address");
    }
    long step = ConfigUtils.optionallyGet(config, CONFIG_PATH_STEP, Config::getLong).orElse(300L);
    if (step <= 0) {
      throw new ConfigurationException("RRD step must be positive, got " + step);
    }
    return RrdConfig.builder()
        .directory(Path.of(ConfigUtils.requireString(config, CONFIG_PATH_DIRECTORY)))
        .mode(mode)
        .rrdtool(ConfigUtils.getString(config, CONFIG_PATH_RRDTOOL, "rrdtool"))
        .rrdcachedAddress(rrdcached)
        .timeout(ConfigUtils.getDuration(config, CONFIG_PATH_TIMEOUT, Duration.ofSeconds(10)))
        .step(step)
        .defaultConsolidation(
            ConfigUtils.getEnum(
                config,
                CONFIG_PATH_CONSOLIDATION,
                ConsolidationFunction.class,
                ConsolidationFunction.AVERAGE))
        .retryPolicy(
            ConfigUtils.optionallyGet(config, CONFIG_PATH_RETRY, Config::getConfig)
                .map(RetryPolicy::fromConfig)
                .orElse(RetryPolicy.defaults()))
        .build();
  }

  /** Retention layout for new files when the metric declares none. */
  public List<RetentionPolicy> getDefaultRetention() {
    return defaultRetention.isEmpty() ? DEFAULT_RETENTION : defaultRetention;
  }
}
