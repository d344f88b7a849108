package org.timeseries.access.influxdb;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import org.timeseries.access.api.ValidationException;

/** Literal rendering for Flux scripts. */
final class FluxSyntax {

  private FluxSyntax() {}

  static String string(String value) {
    return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }

  static String regex(String pattern) {
    return '/' + pattern.replace("/", "\\/") + '/';
  }

  static String time(Instant instant) {
    return "time(v: " + string(DateTimeFormatter.ISO_INSTANT.format(instant)) + ")";
  }

  /** Column access, {@code r["name"]}. */
  static String column(String name) {
    return "r[" + string(name) + "]";
  }

  /** Plain decimal float literal; Flux does not mix ints and floats in arithmetic. */
  static String number(double value) {
    if (!Double.isFinite(value)) {
      throw new ValidationException("Non-finite value cannot be rendered: " + value);
    }
    String plain = BigDecimal.valueOf(value).toPlainString();
    return plain.contains(".") ? plain : plain + ".0";
  }
}
