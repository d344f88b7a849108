package org.timeseries.access;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.driver.Driver;

/**
 * Driver factories keyed by driver name. Factories contributed through Guice are registered at
 * construction, after which the registry may be extended until {@link #freeze()} is called.
 */
@Slf4j
@Singleton
public class DriverRegistry {
  private final Map<String, DriverFactory> factories = new TreeMap<>();
  private boolean frozen;

  public DriverRegistry() {}

  @Inject
  public DriverRegistry(Map<String, DriverFactory> factories) {
    factories.forEach(this::registerDriver);
    freeze();
  }

  public synchronized void registerDriver(String name, DriverFactory factory) {
    if (frozen) {
      throw new IllegalStateException("Driver registry is frozen, cannot register " + name);
    }
    if (factories.containsKey(name)) {
      throw new IllegalStateException("Driver already registered with name " + name);
    }
    log.debug("Registering driver {}", name);
    factories.put(name, factory);
  }

  public synchronized void freeze() {
    frozen = true;
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  public synchronized Optional<DriverFactory> getFactory(String name) {
    return Optional.ofNullable(factories.get(name));
  }

  public synchronized Set<String> getDriverNames() {
    return Set.copyOf(factories.keySet());
  }

  public Driver createDriver(ConnectionConfig config) {
    return getFactory(config.getDriver())
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "No driver registered with name " + config.getDriver()))
        .build(config);
  }
}
