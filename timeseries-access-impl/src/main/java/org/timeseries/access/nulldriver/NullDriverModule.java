package org.timeseries.access.nulldriver;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;
import org.timeseries.access.DriverFactory;

public class NullDriverModule extends AbstractModule {

  @Override
  protected void configure() {
    MapBinder.newMapBinder(binder(), String.class, DriverFactory.class)
        .addBinding(NullDriver.NAME)
        .to(NullDriverFactory.class);
  }
}
