package org.timeseries.access.rrd;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;
import org.timeseries.access.DriverFactory;

public class RrdModule extends AbstractModule {

  @Override
  protected void configure() {
    MapBinder.newMapBinder(binder(), String.class, DriverFactory.class)
        .addBinding(RrdDriver.NAME)
        .to(RrdDriverFactory.class);
  }
}
