package org.timeseries.access.api.query;

import java.util.Locale;
import org.timeseries.access.api.ValidationException;

public enum Aggregation {
  AVERAGE,
  SUM,
  MINIMUM,
  MAXIMUM,
  LAST,
  MEDIAN,
  COUNT;

  public static Aggregation fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toUpperCase(Locale.ROOT);
      switch (normalized) {
        case "AVG":
        case "MEAN":
          return AVERAGE;
        case "MIN":
          return MINIMUM;
        case "MAX":
          return MAXIMUM;
        default:
          for (Aggregation aggregation : values()) {
            if (aggregation.name().equals(normalized)) {
              return aggregation;
            }
          }
      }
    }
    throw new ValidationException("Unknown aggregation: " + name);
  }
}
