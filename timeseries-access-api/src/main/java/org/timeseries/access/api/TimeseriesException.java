package org.timeseries.access.api;

/** Base type of every error raised by the time-series access layer. */
public class TimeseriesException extends RuntimeException {

  public TimeseriesException(String message) {
    super(message);
  }

  public TimeseriesException(String message, Throwable cause) {
    super(message, cause);
  }
}
