package org.timeseries.access;

import org.timeseries.access.TimeseriesAccessConfig.ConnectionConfig;
import org.timeseries.access.api.driver.Driver;

/** Creates a driver for one configured connection. */
public interface DriverFactory {
  Driver build(ConnectionConfig config);
}
