package org.timeseries.access.graphite;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.metric.MetricIdentifier;

/**
 * Dotted series layout shared by queries, writes and index parsing: {@code
 * <prefix>.<metric key>.<label>.<value>...} with labels sorted by name.
 */
public class GraphitePaths {
  private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_:-]");

  private final String prefix;

  public GraphitePaths(String prefix) {
    this.prefix = StringUtils.strip(prefix == null ? "" : prefix, ".");
  }

  public String base(MetricIdentifier metric) {
    return prefix.isEmpty() ? metric.key() : prefix + "." + metric.key();
  }

  public String path(MetricIdentifier metric, Map<String, String> labels) {
    StringBuilder path = new StringBuilder(base(metric));
    new TreeMap<>(labels)
        .forEach(
            (label, value) ->
                path.append('.').append(segment(label)).append('.').append(segment(value)));
    return path.toString();
  }

  /**
   * Labels encoded after {@code metric}'s base in {@code path}, if the path belongs to the metric
   * and carries complete label pairs.
   */
  public Optional<Map<String, String>> labels(MetricIdentifier metric, String path) {
    String base = base(metric);
    if (path.equals(base)) {
      return Optional.of(Map.of());
    }
    if (!path.startsWith(base + ".")) {
      return Optional.empty();
    }
    String[] parts = path.substring(base.length() + 1).split("\\.");
    if (parts.length % 2 != 0) {
      return Optional.empty();
    }
    Map<String, String> labels = new TreeMap<>();
    for (int i = 0; i < parts.length; i += 2) {
      labels.put(parts[i], parts[i + 1]);
    }
    return Optional.of(labels);
  }

  /**
   * Evaluates {@code filter} against labels parsed from a path. Label names and literal values are
   * compared in their {@link #segment} form, the way {@link #path} writes them.
   */
  public static boolean matches(Map<String, String> labels, LabelFilter filter) {
    return filter.getMatchers().entrySet().stream()
        .allMatch(entry -> stored(entry.getValue()).matches(labels.get(segment(entry.getKey()))));
  }

  private static LabelMatcher stored(LabelMatcher matcher) {
    switch (matcher.getMatchType()) {
      case EQUAL:
      case NOT_EQUAL:
        return LabelMatcher.of(matcher.getMatchType(), segment(matcher.getValue()));
      default:
        return matcher;
    }
  }

  /** Replaces characters that would break the dotted layout. */
  public static String segment(String value) {
    return UNSAFE.matcher(value).replaceAll("_");
  }
}
