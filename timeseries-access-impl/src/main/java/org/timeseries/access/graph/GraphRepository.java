package org.timeseries.access.graph;

import java.util.List;

public interface GraphRepository {

  /**
   * @throws GraphNotFoundException if no graph is known under {@code id}
   */
  GraphDefinition load(String id);

  /** Ids of every known graph, sorted. */
  List<String> list();

  void register(GraphDefinition graph);

  /** Re-reads definitions from the backing source, dropping runtime registrations. */
  void reload();
}
