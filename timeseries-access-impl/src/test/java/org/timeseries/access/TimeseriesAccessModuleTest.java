package org.timeseries.access;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.graph.GraphRepository;

public class TimeseriesAccessModuleTest {

  @Test
  public void testInjectorWiresDriversAndRepositories() {
    Injector injector =
        Guice.createInjector(
            new TimeseriesAccessModule(
                ConfigFactory.load().getConfig(TimeseriesAccessConfig.CONFIG_PATH_ROOT)));

    DriverRegistry registry = injector.getInstance(DriverRegistry.class);
    Assertions.assertEquals(
        Set.of("graphite", "influxdb", "null", "rrd"), registry.getDriverNames());
    Assertions.assertTrue(registry.isFrozen());
    Assertions.assertSame(registry, injector.getInstance(DriverRegistry.class));

    Assertions.assertTrue(injector.getInstance(MetricRepository.class).has("net.bytes"));
    Assertions.assertEquals(List.of("traffic"), injector.getInstance(GraphRepository.class).list());

    TimeseriesManager manager = injector.getInstance(TimeseriesManager.class);
    Assertions.assertEquals("primary", manager.connection().getName());
    Assertions.assertTrue(manager.connection().isConnected());
    manager.close();
  }
}
