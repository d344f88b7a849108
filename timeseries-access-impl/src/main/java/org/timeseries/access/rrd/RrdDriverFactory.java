package org.timeseries.access.rrd;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.timeseries.access.DriverFactory;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.driver.Driver;

@Singleton
class RrdDriverFactory implements DriverFactory {
  private final Clock clock;

  @Inject
  RrdDriverFactory(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Driver build(ConnectionConfig config) {
    return new RrdDriver(RrdConfig.from(config.getSettings()), clock);
  }
}
