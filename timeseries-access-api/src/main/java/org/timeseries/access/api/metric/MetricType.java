package org.timeseries.access.api.metric;

public enum MetricType {
  GAUGE,
  COUNTER
}
