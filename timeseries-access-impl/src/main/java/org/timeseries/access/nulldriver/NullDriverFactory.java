package org.timeseries.access.nulldriver;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.timeseries.access.DriverFactory;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.driver.Driver;

@Singleton
class NullDriverFactory implements DriverFactory {
  private final Clock clock;

  @Inject
  NullDriverFactory(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Driver build(ConnectionConfig config) {
    return new NullDriver(clock);
  }
}
