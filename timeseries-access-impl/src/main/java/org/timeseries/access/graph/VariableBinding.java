package org.timeseries.access.graph;

import lombok.NonNull;
import lombok.Value;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.labels.MatchType;

/** A value supplied for a graph variable. */
@Value
public class VariableBinding {
  @NonNull String label;
  @NonNull MatchType matchType;
  String value;

  public static VariableBinding of(String label, String value) {
    return new VariableBinding(label, MatchType.EQUAL, value);
  }

  public static VariableBinding of(String label, MatchType matchType, String value) {
    return new VariableBinding(label, matchType, value);
  }

  /** A binding without a value leaves the variable unset. */
  public boolean hasValue() {
    return value != null;
  }

  LabelMatcher toMatcher() {
    return LabelMatcher.of(matchType, value);
  }
}
