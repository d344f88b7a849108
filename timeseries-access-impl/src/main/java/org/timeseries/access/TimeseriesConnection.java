package org.timeseries.access;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.driver.Driver;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.schema.SchemaManager;

/**
 * A named, configured driver. Queries are compiled by the driver's builder, which runs the
 * capability gate, and then executed through the driver's adapter.
 */
@Slf4j
public class TimeseriesConnection implements AutoCloseable {
  private final String name;
  private final Driver driver;

  public TimeseriesConnection(String name, Driver driver) {
    this.name = name;
    this.driver = driver;
  }

  public String getName() {
    return name;
  }

  public Driver getDriver() {
    return driver;
  }

  public Capabilities getCapabilities() {
    return driver.getCapabilities();
  }

  /**
   * @throws org.timeseries.access.api.QueryException if the query cannot be compiled for this
   *     driver, before anything reaches the backend
   */
  public CompiledQuery compile(Query query) {
    CompiledQuery compiled = driver.getQueryBuilder().build(query);
    log.debug("Compiled query for {}: {}", name, compiled.getRawQuery());
    return compiled;
  }

  public Result execute(CompiledQuery query) {
    return driver.query(query);
  }

  public Result query(Query query) {
    return execute(compile(query));
  }

  public WriteResult write(MetricSample sample) {
    return driver.write(sample);
  }

  public WriteResult writeBatch(List<MetricSample> samples) {
    return driver.writeBatch(samples);
  }

  public SchemaManager schema() {
    return new SchemaManager(this);
  }

  public boolean connect() {
    return driver.connect();
  }

  public boolean isConnected() {
    return driver.isConnected();
  }

  @Override
  public void close() {
    log.info("Closing connection {}", name);
    driver.close();
  }
}
