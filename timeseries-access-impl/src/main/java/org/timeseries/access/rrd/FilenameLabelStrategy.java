package org.timeseries.access.rrd;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Value;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.metric.MetricIdentifier;

/**
 * Encodes labels in RRD file names: {@code <dir>/<namespace>/<name>/<k=v,k2=v2>.rrd}, keys sorted,
 * {@code _default.rrd} when there are no labels.
 */
public class FilenameLabelStrategy {
  static final String EXTENSION = ".rrd";
  static final String DEFAULT_FILE = "_default";
  private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9._-]");

  private final Path directory;

  public FilenameLabelStrategy(Path directory) {
    this.directory = directory;
  }

  public Path getDirectory() {
    return directory;
  }

  public Path metricDirectory(MetricIdentifier metric) {
    Path path = directory;
    if (metric.getNamespace().isPresent()) {
      path = path.resolve(sanitize(metric.getNamespace().get()));
    }
    return path.resolve(sanitize(metric.getName()));
  }

  public Path path(MetricIdentifier metric, Map<String, String> labels) {
    return metricDirectory(metric).resolve(fileName(labels));
  }

  public String fileName(Map<String, String> labels) {
    if (labels.isEmpty()) {
      return DEFAULT_FILE + EXTENSION;
    }
    return new TreeMap<>(labels)
            .entrySet().stream()
                .map(entry -> sanitize(entry.getKey()) + "=" + sanitize(entry.getValue()))
                .collect(Collectors.joining(","))
        + EXTENSION;
  }

  /** Labels encoded in {@code fileName}; empty for the default file or an unlabelled name. */
  public Map<String, String> parseLabels(String fileName) {
    String base =
        fileName.endsWith(EXTENSION)
            ? fileName.substring(0, fileName.length() - EXTENSION.length())
            : fileName;
    if (base.isEmpty() || DEFAULT_FILE.equals(base)) {
      return Collections.emptyMap();
    }
    Map<String, String> labels = new TreeMap<>();
    for (String pair : base.split(",")) {
      int separator = pair.indexOf('=');
      if (separator > 0) {
        labels.put(pair.substring(0, separator), pair.substring(separator + 1));
      }
    }
    return labels;
  }

  /**
   * Evaluates {@code filter} against labels parsed from a file name. Label names and literal
   * values are sanitized the way {@link #fileName} writes them; regex values are used as given.
   */
  public boolean matches(Map<String, String> labels, LabelFilter filter) {
    return filter.getMatchers().entrySet().stream()
        .allMatch(
            entry -> stored(entry.getValue()).matches(labels.get(sanitize(entry.getKey()))));
  }

  /** Files of {@code listing} stored directly in {@code metricDirectory}, not in a nested metric. */
  public List<RrdFile> metricFiles(String listing, Path metricDirectory) {
    return parseListing(listing, metricDirectory).stream()
        .filter(file -> metricDirectory.equals(file.getPath().getParent()))
        .collect(Collectors.toList());
  }

  /**
   * Parses an {@code rrdtool list --recursive} listing of {@code listed} into files. Lines that do
   * not name an {@code .rrd} file are skipped.
   */
  public List<RrdFile> parseListing(String listing, Path listed) {
    List<RrdFile> files = new ArrayList<>();
    for (String line : listing.split("\\R")) {
      String entry = line.trim();
      if (!entry.endsWith(EXTENSION)) {
        continue;
      }
      Path path = Path.of(entry);
      Path absolute = (path.isAbsolute() ? path : listed.resolve(path)).normalize();
      files.add(new RrdFile(absolute, parseLabels(absolute.getFileName().toString())));
    }
    return files;
  }

  /**
   * Metric key of a file under the base directory, derived from its parent folders:
   * {@code <dir>/net/bytes/x.rrd} is {@code net.bytes}.
   */
  public Optional<String> metricKey(RrdFile file) {
    Path parent = file.getPath().getParent();
    if (parent == null || !parent.startsWith(directory) || parent.equals(directory)) {
      return Optional.empty();
    }
    Path relative = directory.relativize(parent);
    List<String> parts = new ArrayList<>();
    relative.forEach(part -> parts.add(part.toString()));
    return Optional.of(String.join(".", parts));
  }

  private static LabelMatcher stored(LabelMatcher matcher) {
    switch (matcher.getMatchType()) {
      case EQUAL:
      case NOT_EQUAL:
        return LabelMatcher.of(matcher.getMatchType(), sanitize(matcher.getValue()));
      default:
        return matcher;
    }
  }

  static String sanitize(String part) {
    return UNSAFE.matcher(part).replaceAll("_");
  }

  @Value
  public static class RrdFile {
    Path path;
    Map<String, String> labels;
  }
}
