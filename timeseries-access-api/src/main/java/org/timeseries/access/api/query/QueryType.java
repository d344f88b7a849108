package org.timeseries.access.api.query;

public enum QueryType {
  DATA,
  LABEL
}
