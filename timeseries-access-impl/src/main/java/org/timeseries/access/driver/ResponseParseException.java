package org.timeseries.access.driver;

import org.timeseries.access.api.TimeseriesException;

/** A backend answered successfully but its payload could not be decoded. */
public class ResponseParseException extends TimeseriesException {

  public ResponseParseException(String message) {
    super(message);
  }

  public ResponseParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
