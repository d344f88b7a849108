package org.timeseries.access.api.capability;

import java.util.Optional;
import org.timeseries.access.api.query.OperationType;

/** Optional driver features, each with the string key it is published under. */
public enum Capability {
  RATE("supportsRate", "rate"),
  HISTOGRAM("supportsHistogram", "histogram quantile"),
  LABEL_JOIN("supportsLabelJoin", "label join"),
  REGEX("supportsRegex", "regex matcher"),
  DELTA("supportsDelta", "delta"),
  MATH("supportsMath", "math"),
  AGGREGATION("supportsAggregation", "aggregation"),
  LABEL_DISCOVERY("supportsLabelDiscovery", "label discovery"),
  WRITE("supportsWrite", "write");

  private final String key;
  private final String feature;

  Capability(String key, String feature) {
    this.key = key;
    this.feature = feature;
  }

  public String getKey() {
    return key;
  }

  /** Human readable feature name used in error messages. */
  public String getFeature() {
    return feature;
  }

  public static Capability forOperation(OperationType type) {
    switch (type) {
      case RATE:
        return RATE;
      case DELTA:
        return DELTA;
      case MATH:
        return MATH;
      case HISTOGRAM_QUANTILE:
        return HISTOGRAM;
      case LABEL_JOIN:
        return LABEL_JOIN;
      default:
        throw new IllegalArgumentException("No capability mapped for operation " + type);
    }
  }

  public static Optional<Capability> fromKey(String key) {
    for (Capability capability : values()) {
      if (capability.key.equals(key)) {
        return Optional.of(capability);
      }
    }
    return Optional.empty();
  }
}
