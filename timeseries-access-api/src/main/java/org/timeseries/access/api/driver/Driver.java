package org.timeseries.access.api.driver;

import java.util.List;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.WriteResult;

/**
 * A backend: one connection adapter, one query builder and one fixed capability set. Drivers are
 * long-lived and own their transport until {@link #close()}.
 */
public interface Driver extends AutoCloseable {

  String getName();

  Capabilities getCapabilities();

  QueryBuilder<? extends CompiledQuery> getQueryBuilder();

  boolean connect();

  boolean isConnected();

  /**
   * Executes a query compiled by this driver's builder. Transport and parse failures are reported
   * in the returned result.
   */
  Result query(CompiledQuery query);

  WriteResult write(MetricSample sample);

  WriteResult writeBatch(List<MetricSample> samples);

  @Override
  void close();
}
