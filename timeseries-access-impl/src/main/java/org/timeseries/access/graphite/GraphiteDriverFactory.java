package org.timeseries.access.graphite;

import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.timeseries.access.DriverFactory;
import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.driver.Driver;

@Singleton
class GraphiteDriverFactory implements DriverFactory {
  private final Clock clock;

  @Inject
  GraphiteDriverFactory(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Driver build(ConnectionConfig config) {
    return new GraphiteDriver(GraphiteConfig.from(config.getSettings()), clock);
  }
}
