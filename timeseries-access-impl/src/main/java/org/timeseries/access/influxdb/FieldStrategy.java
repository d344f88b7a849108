package org.timeseries.access.influxdb;

import org.timeseries.access.api.metric.MetricIdentifier;

/** How a metric identifier maps onto an Influx measurement and field. */
public enum FieldStrategy {
  /** Measurement is the metric key, the field is always {@code value}. */
  SINGLE {
    @Override
    public String measurement(MetricIdentifier metric) {
      return metric.key();
    }

    @Override
    public String field(MetricIdentifier metric) {
      return DEFAULT_FIELD;
    }
  },
  /** Measurement is the namespace, the field is the metric name. */
  NAMESPACED {
    @Override
    public String measurement(MetricIdentifier metric) {
      return metric.getNamespace().orElse(metric.key());
    }

    @Override
    public String field(MetricIdentifier metric) {
      return metric.getNamespace().isPresent() ? metric.getName() : DEFAULT_FIELD;
    }
  };

  public static final String DEFAULT_FIELD = "value";

  public abstract String measurement(MetricIdentifier metric);

  public abstract String field(MetricIdentifier metric);

  /** Inverse mapping used when naming parsed series. */
  public String metricName(String measurement, String field) {
    if (field == null || field.isEmpty() || DEFAULT_FIELD.equals(field)) {
      return measurement;
    }
    return measurement + "." + field;
  }
}
