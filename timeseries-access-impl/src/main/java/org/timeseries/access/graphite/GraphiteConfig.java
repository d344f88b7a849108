package org.timeseries.access.graphite;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import okhttp3.HttpUrl;
import org.timeseries.access.ConfigUtils;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.connection.RetryPolicy;

@Value
@Builder
public class GraphiteConfig {
  private static final String CONFIG_PATH_HOST = "host";
  private static final String CONFIG_PATH_PORT = "port";
  private static final String CONFIG_PATH_WEB_SCHEME = "web-scheme";
  private static final String CONFIG_PATH_WEB_HOST = "web-host";
  private static final String CONFIG_PATH_WEB_PORT = "web-port";
  private static final String CONFIG_PATH_WEB_PATH = "web-path";
  private static final String CONFIG_PATH_PREFIX = "prefix";
  private static final String CONFIG_PATH_TIMEOUT = "timeout";
  private static final String CONFIG_PATH_BATCH_SIZE = "batch-size";
  private static final String CONFIG_PATH_RETRY = "retry";

  @Builder.Default String host = "localhost";
  @Builder.Default int port = 2003;
  @NonNull HttpUrl webUrl;
  @Builder.Default String renderPath = "/render";
  @Builder.Default String prefix = "";
  @Builder.Default Duration timeout = Duration.ofSeconds(30);
  @Builder.Default int batchSize = 500;
  @Builder.Default RetryPolicy retryPolicy = RetryPolicy.defaults();

  public static GraphiteConfig from(Config config) {
    String host = ConfigUtils.getString(config, CONFIG_PATH_HOST, "localhost");
    int batchSize = ConfigUtils.getInt(config, CONFIG_PATH_BATCH_SIZE, 500);
    if (batchSize <= 0) {
      throw new ConfigurationException("Graphite batch-size must be positive, got " + batchSize);
    }
    HttpUrl webUrl;
    try {
      webUrl =
          new HttpUrl.Builder()
              .scheme(ConfigUtils.getString(config, CONFIG_PATH_WEB_SCHEME, "http"))
              .host(ConfigUtils.getString(config, CONFIG_PATH_WEB_HOST, host))
              .port(ConfigUtils.getInt(config, CONFIG_PATH_WEB_PORT, 8080))
              .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid Graphite web address: " + e.getMessage(), e);
    }
    return GraphiteConfig.builder()
        .host(host)
        .port(ConfigUtils.getInt(config, CONFIG_PATH_PORT, 2003))
        .webUrl(webUrl)
        .renderPath(ConfigUtils.getString(config, CONFIG_PATH_WEB_PATH, "/render"))
        .prefix(ConfigUtils.getString(config, CONFIG_PATH_PREFIX, ""))
        .timeout(ConfigUtils.getDuration(config, CONFIG_PATH_TIMEOUT, Duration.ofSeconds(30)))
        .batchSize(batchSize)
        .retryPolicy(
            ConfigUtils.optionallyGet(config, CONFIG_PATH_RETRY, Config::getConfig)
                .map(RetryPolicy::fromConfig)
                .orElse(RetryPolicy.defaults()))
        .build();
  }
}
