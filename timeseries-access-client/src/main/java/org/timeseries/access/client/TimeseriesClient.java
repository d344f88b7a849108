package org.timeseries.access.client;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timeseries.access.BatchQueryExecutor;
import org.timeseries.access.TimeseriesAccessConfig;
import org.timeseries.access.TimeseriesAccessModule;
import org.timeseries.access.TimeseriesConnection;
import org.timeseries.access.TimeseriesManager;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.graph.GraphRepository;
import org.timeseries.access.graph.GraphService;
import org.timeseries.access.schema.LabelQueryBuilder;

/**
 * Entry point for applications. Wires drivers and catalogues from the {@code timeseries} block of
 * a configuration and hands out connections by name; unqualified calls go to the default one.
 */
public class TimeseriesClient implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(TimeseriesClient.class);

  private final TimeseriesManager manager;
  private final MetricRepository metrics;
  private final GraphRepository graphs;
  private final BatchQueryExecutor batchExecutor = new BatchQueryExecutor();

  TimeseriesClient(Injector injector) {
    this.manager = injector.getInstance(TimeseriesManager.class);
    this.metrics = injector.getInstance(MetricRepository.class);
    this.graphs = injector.getInstance(GraphRepository.class);
  }

  /** Reads {@code timeseries} from the application configuration on the classpath. */
  public static TimeseriesClient create() {
    return create(ConfigFactory.load());
  }

  /**
   * @param config a configuration holding a {@code timeseries} block, or the block itself
   */
  public static TimeseriesClient create(Config config) {
    Config timeseries =
        config.hasPath(TimeseriesAccessConfig.CONFIG_PATH_ROOT)
            ? config.getConfig(TimeseriesAccessConfig.CONFIG_PATH_ROOT)
            : config;
    TimeseriesClient client =
        new TimeseriesClient(Guice.createInjector(new TimeseriesAccessModule(timeseries)));
    LOG.info("Time-series client ready with connections {}", client.manager.getConnectionNames());
    return client;
  }

  public TimeseriesConnection connection() {
    return manager.connection();
  }

  public TimeseriesConnection connection(String name) {
    return manager.connection(name);
  }

  public Result query(Query query) {
    return connection().query(query);
  }

  public List<Result> queryAll(List<Query> queries) {
    return batchExecutor.executeAll(connection(), queries).blockingGet();
  }

  public WriteResult write(MetricSample sample) {
    return connection().write(sample);
  }

  public WriteResult writeBatch(List<MetricSample> samples) {
    return connection().writeBatch(samples);
  }

  public LabelQueryBuilder labels() {
    return connection().schema().labels();
  }

  public MetricRepository metrics() {
    return metrics;
  }

  /** Graphs rendered on the default connection. */
  public GraphService graphs() {
    return new GraphService(graphs, metrics, connection());
  }

  @Override
  public void close() {
    LOG.info("Closing time-series client");
    manager.close();
  }
}
