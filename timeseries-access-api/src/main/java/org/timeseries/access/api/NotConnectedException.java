package org.timeseries.access.api;

public class NotConnectedException extends TimeseriesException {

  public NotConnectedException(String message) {
    super(message);
  }
}
