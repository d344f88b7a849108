package org.timeseries.access.influxdb;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.timeseries.access.DriverFactory;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.driver.Driver;

@Singleton
class InfluxDbDriverFactory implements DriverFactory {
  private final Clock clock;

  @Inject
  InfluxDbDriverFactory(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Driver build(ConnectionConfig config) {
    return new InfluxDbDriver(InfluxDbConfig.from(config.getSettings()), clock);
  }
}
