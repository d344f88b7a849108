package org.timeseries.access.api.metric;

import java.util.Collection;

public interface MetricRepository {

  /**
   * @throws UnknownMetricException if no metric is registered under {@code key}
   */
  MetricIdentifier get(String key);

  boolean has(String key);

  Collection<MetricIdentifier> all();

  void register(MetricIdentifier metric);
}
