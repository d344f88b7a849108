package org.timeseries.access.influxdb;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.time.TimePrecision;

/** Renders samples as InfluxDB line protocol. */
public class LineProtocolFormatter {
  private final FieldStrategy fieldStrategy;
  private final TimePrecision precision;

  public LineProtocolFormatter(FieldStrategy fieldStrategy, TimePrecision precision) {
    this.fieldStrategy = fieldStrategy;
    this.precision = precision;
  }

  public String format(List<MetricSample> samples) {
    return samples.stream().map(this::format).collect(Collectors.joining("\n"));
  }

  public String format(MetricSample sample) {
    if (!Double.isFinite(sample.getValue())) {
      throw new ValidationException(
          "Cannot write non-finite value for " + sample.getMetric().key());
    }
    StringBuilder line =
        new StringBuilder(escapeMeasurement(fieldStrategy.measurement(sample.getMetric())));
    for (Map.Entry<String, String> tag : new TreeMap<>(sample.getLabels()).entrySet()) {
      // empty tag values are rejected by the server
      if (tag.getValue() == null || tag.getValue().isEmpty()) {
        continue;
      }
      line.append(',')
          .append(escapeTag(tag.getKey()))
          .append('=')
          .append(escapeTag(tag.getValue()));
    }
    line.append(' ')
        .append(escapeTag(fieldStrategy.field(sample.getMetric())))
        .append('=')
        .append(fieldValue(sample))
        .append(' ')
        .append(precision.fromInstant(sample.getTimestamp()));
    return line.toString();
  }

  private static String fieldValue(MetricSample sample) {
    if (sample.getMetric().getType() == MetricType.COUNTER && sample.isIntegral()) {
      return (long) sample.getValue() + "i";
    }
    return FluxSyntax.number(sample.getValue());
  }

  static String escapeMeasurement(String measurement) {
    return measurement.replace(",", "\\,").replace(" ", "\\ ");
  }

  static String escapeTag(String value) {
    return value.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
  }
}
