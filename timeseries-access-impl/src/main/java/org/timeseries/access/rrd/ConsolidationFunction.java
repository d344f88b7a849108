package org.timeseries.access.rrd;

import java.util.Optional;
import org.timeseries.access.api.query.Aggregation;

public enum ConsolidationFunction {
  AVERAGE,
  MIN,
  MAX,
  LAST;

  /** The consolidation function matching {@code aggregation}, if rrdtool has one. */
  public static Optional<ConsolidationFunction> of(Aggregation aggregation) {
    switch (aggregation) {
      case AVERAGE:
        return Optional.of(AVERAGE);
      case MINIMUM:
        return Optional.of(MIN);
      case MAXIMUM:
        return Optional.of(MAX);
      case LAST:
        return Optional.of(LAST);
      default:
        return Optional.empty();
    }
  }
}
