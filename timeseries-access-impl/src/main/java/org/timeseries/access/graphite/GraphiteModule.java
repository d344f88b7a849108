package org.timeseries.access.graphite;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;
import org.timeseries.access.DriverFactory;

public class GraphiteModule extends AbstractModule {

  @Override
  protected void configure() {
    MapBinder.newMapBinder(binder(), String.class, DriverFactory.class)
        .addBinding(GraphiteDriver.NAME)
        .to(GraphiteDriverFactory.class);
  }
}
