package org.timeseries.access.api.metric;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.query.Aggregation;

/**
 * Identifies a series family: a name within an optional namespace, plus the label names series
 * of this family carry.
 */
@Value
@Builder(toBuilder = true)
public class MetricIdentifier {
  String namespace;
  @NonNull String name;
  String unit;
  @Builder.Default MetricType type = MetricType.GAUGE;
  @Singular List<String> labels;
  @Singular Set<Aggregation> aggregations;
  @Singular List<RetentionPolicy> retentionPolicies;

  /** Gauge identifier for a raw metric key, without namespace. */
  public static MetricIdentifier named(String key) {
    if (key == null || key.isBlank()) {
      throw new ValidationException("Metric name must not be empty");
    }
    return MetricIdentifier.builder().name(key).build();
  }

  public static MetricIdentifier of(String namespace, String name) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Metric name must not be empty");
    }
    return MetricIdentifier.builder().namespace(namespace).name(name).build();
  }

  public String key() {
    return namespace == null || namespace.isEmpty() ? name : namespace + "." + name;
  }

  public Optional<String> getNamespace() {
    return Optional.ofNullable(namespace).filter(value -> !value.isEmpty());
  }

  public Optional<String> getUnit() {
    return Optional.ofNullable(unit);
  }

  /** An empty aggregation set means the metric places no restriction. */
  public boolean supportsAggregation(Aggregation aggregation) {
    return aggregations.isEmpty() || aggregations.contains(aggregation);
  }

  @Override
  public String toString() {
    return key();
  }
}
