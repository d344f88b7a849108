package org.timeseries.access.api.query;

public enum OperationType {
  RATE,
  DELTA,
  MATH,
  HISTOGRAM_QUANTILE,
  LABEL_JOIN
}
