package org.timeseries.access.graph;

import org.timeseries.access.api.ValidationException;

public class InvalidGraphException extends ValidationException {

  public InvalidGraphException(String message) {
    super(message);
  }

  public InvalidGraphException(String message, Throwable cause) {
    super(message, cause);
  }
}
