package org.timeseries.access.api.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/** Estimates a quantile from histogram buckets. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QuantileOperation implements Operation {
  double quantile;

  public static QuantileOperation of(double quantile) {
    if (!(quantile >= 0 && quantile <= 1)) {
      throw new ValidationException("Quantile must be within [0, 1]: " + quantile);
    }
    return new QuantileOperation(quantile);
  }

  @Override
  public OperationType getType() {
    return OperationType.HISTOGRAM_QUANTILE;
  }
}
