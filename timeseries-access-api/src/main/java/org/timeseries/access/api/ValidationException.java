package org.timeseries.access.api;

/** Malformed input handed to a value-object constructor or factory. */
public class ValidationException extends TimeseriesException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
