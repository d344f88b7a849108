package org.timeseries.access.influxdb;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;
import org.timeseries.access.DriverFactory;

public class InfluxDbModule extends AbstractModule {

  @Override
  protected void configure() {
    MapBinder.newMapBinder(binder(), String.class, DriverFactory.class)
        .addBinding(InfluxDbDriver.NAME)
        .to(InfluxDbDriverFactory.class);
  }
}
