package org.timeseries.access.graph;

import java.util.Optional;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.labels.MatchType;

/**
 * A label a graph can be narrowed by at render time. Without declared operators only equality may
 * be bound.
 */
@Value
@Builder
public class GraphVariable {
  @NonNull String name;
  boolean required;

  @Getter(AccessLevel.NONE)
  String defaultValue;

  @Singular Set<MatchType> allowedOperators;

  public Optional<String> getDefaultValue() {
    return Optional.ofNullable(defaultValue);
  }

  public boolean allows(MatchType matchType) {
    return allowedOperators.isEmpty()
        ? matchType == MatchType.EQUAL
        : allowedOperators.contains(matchType);
  }
}
