package org.timeseries.access.influxdb;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;

/** Converts label filters into Flux predicate expressions over a row {@code r}. */
final class FilterToFluxConverter {

  private FilterToFluxConverter() {}

  static String condition(String label, LabelMatcher matcher) {
    String column = FluxSyntax.column(label);
    switch (matcher.getMatchType()) {
      case EQUAL:
        return column + " == " + FluxSyntax.string(matcher.getValue());
      case NOT_EQUAL:
        return column + " != " + FluxSyntax.string(matcher.getValue());
      case REGEX_MATCH:
        return column + " =~ " + FluxSyntax.regex(matcher.getValue());
      case REGEX_NO_MATCH:
        return column + " !~ " + FluxSyntax.regex(matcher.getValue());
      default:
        throw new IllegalArgumentException("Unhandled match type " + matcher.getMatchType());
    }
  }

  static List<String> conditions(LabelFilter filter) {
    List<String> conditions = new ArrayList<>();
    for (Map.Entry<String, LabelMatcher> entry : filter.getMatchers().entrySet()) {
      conditions.add(condition(entry.getKey(), entry.getValue()));
    }
    return conditions;
  }

  /** One {@code |> filter(...)} line per matcher, in label order. */
  static List<String> filterSteps(LabelFilter filter) {
    List<String> steps = new ArrayList<>();
    for (String condition : conditions(filter)) {
      steps.add("|> filter(fn: (r) => " + condition + ")");
    }
    return steps;
  }
}
