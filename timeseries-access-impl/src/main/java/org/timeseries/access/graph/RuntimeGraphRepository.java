package org.timeseries.access.graph;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

public class RuntimeGraphRepository implements GraphRepository {
  private final Map<String, GraphDefinition> graphs = new ConcurrentSkipListMap<>();

  @Override
  public GraphDefinition load(String id) {
    GraphDefinition graph = graphs.get(id);
    if (graph == null) {
      throw new GraphNotFoundException(id);
    }
    return graph;
  }

  @Override
  public List<String> list() {
    return List.copyOf(graphs.keySet());
  }

  @Override
  public void register(GraphDefinition graph) {
    graphs.put(graph.getId(), graph);
  }

  /** Runtime graphs have no backing source, so this forgets every registration. */
  @Override
  public void reload() {
    graphs.clear();
  }

  protected void replaceAll(List<GraphDefinition> definitions) {
    graphs.clear();
    definitions.forEach(this::register);
  }
}
