package org.timeseries.access;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;
import com.typesafe.config.Config;
import java.time.Clock;
import javax.inject.Singleton;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.graph.ConfigGraphRepository;
import org.timeseries.access.graph.GraphRepository;
import org.timeseries.access.graphite.GraphiteModule;
import org.timeseries.access.influxdb.InfluxDbModule;
import org.timeseries.access.metric.ConfigMetricRepository;
import org.timeseries.access.nulldriver.NullDriverModule;
import org.timeseries.access.rrd.RrdModule;

public class TimeseriesAccessModule extends AbstractModule {

  private final TimeseriesAccessConfig config;
  private final Clock clock;

  public TimeseriesAccessModule(Config config) {
    this(new TimeseriesAccessConfig(config), Clock.systemUTC());
  }

  public TimeseriesAccessModule(TimeseriesAccessConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  @Override
  protected void configure() {
    bind(TimeseriesAccessConfig.class).toInstance(this.config);
    bind(Clock.class).toInstance(this.clock);
    MapBinder.newMapBinder(binder(), String.class, DriverFactory.class);
    bind(MetricRepository.class).to(ConfigMetricRepository.class).in(Singleton.class);
    bind(GraphRepository.class).to(ConfigGraphRepository.class).in(Singleton.class);
    install(new InfluxDbModule());
    install(new RrdModule());
    install(new GraphiteModule());
    install(new NullDriverModule());
  }
}
