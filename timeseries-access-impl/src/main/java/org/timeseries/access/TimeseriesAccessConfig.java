package org.timeseries.access;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.timeseries.access.api.ConfigurationException;

/** Named connections plus the metric and graph catalogues of the {@code timeseries} block. */
@Value
@NonFinal
public class TimeseriesAccessConfig {
  public static final String CONFIG_PATH_ROOT = "timeseries";
  private static final String CONFIG_PATH_DEFAULT = "default";
  private static final String CONFIG_PATH_CONNECTIONS = "connections";
  private static final String CONFIG_PATH_METRICS = "metrics";
  private static final String CONFIG_PATH_GRAPHS = "graphs";

  String defaultConnection;
  List<ConnectionConfig> connections;
  List<? extends Config> metricConfigs;
  List<? extends Config> graphConfigs;

  public TimeseriesAccessConfig(Config config) {
    Config resolved = config.resolve();
    try {
      this.connections =
          resolved.getConfigList(CONFIG_PATH_CONNECTIONS).stream()
              .map(ConnectionConfig::new)
              .collect(Collectors.toUnmodifiableList());
      this.defaultConnection =
          resolved.hasPath(CONFIG_PATH_DEFAULT)
              ? resolved.getString(CONFIG_PATH_DEFAULT)
              : connections.stream()
                  .findFirst()
                  .map(ConnectionConfig::getName)
                  .orElseThrow(() -> new ConfigurationException("No connections configured"));
      this.metricConfigs =
          resolved.hasPath(CONFIG_PATH_METRICS)
              ? resolved.getConfigList(CONFIG_PATH_METRICS)
              : List.of();
      this.graphConfigs =
          resolved.hasPath(CONFIG_PATH_GRAPHS)
              ? resolved.getConfigList(CONFIG_PATH_GRAPHS)
              : List.of();
    } catch (ConfigException e) {
      throw new ConfigurationException("Invalid time-series configuration: " + e.getMessage(), e);
    }
    Set<String> names = new HashSet<>();
    for (ConnectionConfig connection : connections) {
      if (!names.add(connection.getName())) {
        throw new ConfigurationException(
            "Connection '" + connection.getName() + "' is configured twice");
      }
    }
    if (getConnection(defaultConnection).isEmpty()) {
      throw new ConfigurationException(
          "Default connection '" + defaultConnection + "' is not configured");
    }
  }

  /** Reads the {@code timeseries} block of the application configuration. */
  public static TimeseriesAccessConfig load() {
    return new TimeseriesAccessConfig(ConfigFactory.load().getConfig(CONFIG_PATH_ROOT));
  }

  public Optional<ConnectionConfig> getConnection(String name) {
    return connections.stream().filter(connection -> connection.getName().equals(name)).findFirst();
  }

  /** Settings of one named connection. {@code settings} holds the backend-specific entries. */
  @Value
  @NonFinal
  public static class ConnectionConfig {
    private static final String CONFIG_PATH_NAME = "name";
    private static final String CONFIG_PATH_DRIVER = "driver";

    String name;
    String driver;
    Config settings;

    public ConnectionConfig(Config config) {
      this.name = config.getString(CONFIG_PATH_NAME);
      this.driver = config.getString(CONFIG_PATH_DRIVER);
      this.settings = config.withoutPath(CONFIG_PATH_NAME).withoutPath(CONFIG_PATH_DRIVER);
    }

    public ConnectionConfig(String name, String driver, Config settings) {
      this.name = name;
      this.driver = driver;
      this.settings = settings;
    }
  }
}
