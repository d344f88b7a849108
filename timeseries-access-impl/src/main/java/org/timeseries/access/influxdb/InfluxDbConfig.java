package org.timeseries.access.influxdb;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import okhttp3.HttpUrl;
import org.timeseries.access.ConfigUtils;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.time.TimePrecision;
import org.timeseries.access.connection.RetryPolicy;

@Value
@Builder
public class InfluxDbConfig {
  private static final String CONFIG_PATH_URL = "url";
  private static final String CONFIG_PATH_SCHEME = "scheme";
  private static final String CONFIG_PATH_HOST = "host";
  private static final String CONFIG_PATH_PORT = "port";
  private static final String CONFIG_PATH_TOKEN = "token";
  private static final String CONFIG_PATH_ORG = "org";
  private static final String CONFIG_PATH_BUCKET = "bucket";
  private static final String CONFIG_PATH_PRECISION = "precision";
  private static final String CONFIG_PATH_TIMEOUT = "timeout";
  private static final String CONFIG_PATH_FIELD_STRATEGY = "field-strategy";
  private static final String CONFIG_PATH_RETRY = "retry";

  private static final int DEFAULT_PORT = 8086;

  @NonNull HttpUrl url;
  @Builder.Default String token = "";
  @NonNull String org;
  @NonNull String bucket;
  @Builder.Default TimePrecision precision = TimePrecision.S;
  @Builder.Default Duration timeout = Duration.ofSeconds(30);
  @Builder.Default FieldStrategy fieldStrategy = FieldStrategy.SINGLE;
  @Builder.Default RetryPolicy retryPolicy = RetryPolicy.defaults();

  public static InfluxDbConfig from(Config config) {
    return InfluxDbConfig.builder()
        .url(url(config))
        .token(ConfigUtils.getString(config, CONFIG_PATH_TOKEN, ""))
        .org(ConfigUtils.requireString(config, CONFIG_PATH_ORG))
        .bucket(ConfigUtils.requireString(config, CONFIG_PATH_BUCKET))
        .precision(
            TimePrecision.fromTag(ConfigUtils.getString(config, CONFIG_PATH_PRECISION, "s")))
        .timeout(ConfigUtils.getDuration(config, CONFIG_PATH_TIMEOUT, Duration.ofSeconds(30)))
        .fieldStrategy(
            ConfigUtils.getEnum(
                config, CONFIG_PATH_FIELD_STRATEGY, FieldStrategy.class, FieldStrategy.SINGLE))
        .retryPolicy(
            ConfigUtils.optionallyGet(config, CONFIG_PATH_RETRY, Config::getConfig)
                .map(RetryPolicy::fromConfig)
                .orElse(RetryPolicy.defaults()))
        .build();
  }

  private static HttpUrl url(Config config) {
    if (config.hasPath(CONFIG_PATH_URL)) {
      HttpUrl url = HttpUrl.parse(config.getString(CONFIG_PATH_URL));
      if (url == null) {
        throw new ConfigurationException(
            "Invalid InfluxDB url: " + config.getString(CONFIG_PATH_URL));
      }
      return url;
    }
    try {
      return new HttpUrl.Builder()
          .scheme(ConfigUtils.getString(config, CONFIG_PATH_SCHEME, "http"))
          .host(ConfigUtils.getString(config, CONFIG_PATH_HOST, "localhost"))
          .port(ConfigUtils.getInt(config, CONFIG_PATH_PORT, DEFAULT_PORT))
          .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid InfluxDB address: " + e.getMessage(), e);
    }
  }
}
