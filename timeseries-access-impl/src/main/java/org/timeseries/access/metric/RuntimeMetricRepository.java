package org.timeseries.access.metric;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricRepository;
import org.timeseries.access.api.metric.UnknownMetricException;

/** In-memory catalogue keyed by {@link MetricIdentifier#key()}. */
public class RuntimeMetricRepository implements MetricRepository {
  private final Map<String, MetricIdentifier> metrics = new ConcurrentSkipListMap<>();

  public RuntimeMetricRepository() {}

  public RuntimeMetricRepository(Collection<MetricIdentifier> metrics) {
    metrics.forEach(this::register);
  }

  @Override
  public MetricIdentifier get(String key) {
    MetricIdentifier metric = metrics.get(key);
    if (metric == null) {
      throw new UnknownMetricException(key);
    }
    return metric;
  }

  @Override
  public boolean has(String key) {
    return metrics.containsKey(key);
  }

  @Override
  public Collection<MetricIdentifier> all() {
    return List.copyOf(metrics.values());
  }

  @Override
  public void register(MetricIdentifier metric) {
    metrics.put(metric.key(), metric);
  }
}
