package org.timeseries.access.api.metric;

import org.timeseries.access.api.ValidationException;

public class UnknownMetricException extends ValidationException {

  public UnknownMetricException(String key) {
    super("Unknown metric: " + key);
  }
}
