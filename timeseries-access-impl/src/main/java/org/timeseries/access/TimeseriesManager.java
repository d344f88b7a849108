package org.timeseries.access;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.ConfigurationException;

/** Opens configured connections on first use and keeps one per name until closed. */
@Slf4j
@Singleton
public class TimeseriesManager implements AutoCloseable {
  private final TimeseriesAccessConfig config;
  private final DriverRegistry driverRegistry;
  private final Map<String, TimeseriesConnection> connections = new ConcurrentHashMap<>();

  @Inject
  public TimeseriesManager(TimeseriesAccessConfig config, DriverRegistry driverRegistry) {
    this.config = config;
    this.driverRegistry = driverRegistry;
  }

  public TimeseriesConnection connection() {
    return connection(config.getDefaultConnection());
  }

  /**
   * @throws ConfigurationException if no connection is configured under {@code name} or its driver
   *     is not registered
   */
  public TimeseriesConnection connection(String name) {
    return connections.computeIfAbsent(name, this::open);
  }

  public List<String> getConnectionNames() {
    List<String> names = new ArrayList<>();
    config.getConnections().forEach(connection -> names.add(connection.getName()));
    return names;
  }

  private TimeseriesConnection open(String name) {
    ConnectionConfig connectionConfig =
        config
            .getConnection(name)
            .orElseThrow(
                () -> new ConfigurationException("No connection configured named " + name));
    log.info("Opening connection {} with driver {}", name, connectionConfig.getDriver());
    return new TimeseriesConnection(name, driverRegistry.createDriver(connectionConfig));
  }

  @Override
  public void close() {
    connections
        .values()
        .forEach(
            connection -> {
              try {
                connection.close();
              } catch (RuntimeException e) {
                log.error("Failed to close connection {}", connection.getName(), e);
              }
            });
    connections.clear();
  }
}
