package org.timeseries.access.api;

/**
 * Raised when a value cannot be resolved because the fields it was given are jointly
 * insufficient, or when connection configuration is missing or invalid.
 */
public class ConfigurationException extends TimeseriesException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
