package org.timeseries.access.schema;

import org.timeseries.access.TimeseriesConnection;

/** Schema discovery on one connection. */
public class SchemaManager {
  private final TimeseriesConnection connection;

  public SchemaManager(TimeseriesConnection connection) {
    this.connection = connection;
  }

  public LabelQueryBuilder labels() {
    return new LabelQueryBuilder(connection);
  }

  /**
   * Not defined for any backend yet.
   *
   * @throws UnsupportedOperationException always
   */
  public boolean metricExists(String metric) {
    throw new UnsupportedOperationException(
        "Checking whether metric '"
            + metric
            + "' exists is not defined; list metric names through labels() instead");
  }
}
