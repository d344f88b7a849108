package org.timeseries.access.graph;

import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class GraphDefinition {
  @NonNull String id;
  @NonNull String title;

  @Getter(AccessLevel.NONE)
  String description;

  @Singular("series")
  List<SeriesDefinition> series;

  @Singular List<GraphVariable> variables;

  public Optional<String> getDescription() {
    return Optional.ofNullable(description);
  }

  public Optional<GraphVariable> getVariable(String name) {
    return variables.stream().filter(variable -> variable.getName().equals(name)).findFirst();
  }

  public GraphDefinition withVariables(List<GraphVariable> variables) {
    return toBuilder().clearVariables().variables(variables).build();
  }
}
