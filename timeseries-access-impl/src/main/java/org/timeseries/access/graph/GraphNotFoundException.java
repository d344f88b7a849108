package org.timeseries.access.graph;

import org.timeseries.access.api.ConfigurationException;

public class GraphNotFoundException extends ConfigurationException {

  public GraphNotFoundException(String id) {
    super("Graph not found: " + id);
  }
}
