package org.timeseries.access.api.labels;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Collection;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/**
 * Set of label matchers keyed by label name, at most one per label. Matchers are kept sorted by
 * label name so that compiled output does not depend on insertion order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabelFilter {
  private static final LabelFilter EMPTY = new LabelFilter(ImmutableSortedMap.of());
  private static final String TYPE_KEY = "type";
  private static final String VALUE_KEY = "value";
  private static final String REGEX_SPECIAL_CHARS = "\\^$.|?*+()[]{}/";

  ImmutableSortedMap<String, LabelMatcher> matchers;

  public static LabelFilter empty() {
    return EMPTY;
  }

  public static LabelFilter match(String label, String value) {
    return of(label, LabelMatcher.equal(value));
  }

  public static LabelFilter of(String label, LabelMatcher matcher) {
    return EMPTY.with(label, matcher);
  }

  /**
   * Builds a filter from untyped input. Each entry maps a label name either to a plain string
   * (equality) or to a map holding {@code type} and {@code value}.
   *
   * @throws ValidationException on an unknown match type, a missing field or a blank label
   */
  public static LabelFilter fromArray(Map<String, ?> raw) {
    if (raw == null) {
      throw new ValidationException("Label filter input is required");
    }
    ImmutableSortedMap.Builder<String, LabelMatcher> builder = ImmutableSortedMap.naturalOrder();
    for (Entry<String, ?> entry : raw.entrySet()) {
      String label = validateLabel(entry.getKey());
      builder.put(label, toMatcher(label, entry.getValue()));
    }
    return new LabelFilter(builder.build());
  }

  public LabelFilter with(String label, LabelMatcher matcher) {
    validateLabel(label);
    if (matcher == null) {
      throw new ValidationException("Matcher for label '" + label + "' is required");
    }
    ImmutableSortedMap.Builder<String, LabelMatcher> builder = ImmutableSortedMap.naturalOrder();
    matchers.forEach(
        (existing, existingMatcher) -> {
          if (!existing.equals(label)) {
            builder.put(existing, existingMatcher);
          }
        });
    builder.put(label, matcher);
    return new LabelFilter(builder.build());
  }

  public LabelFilter withEqual(String label, String value) {
    return with(label, LabelMatcher.equal(value));
  }

  public LabelFilter withNotEqual(String label, String value) {
    return with(label, LabelMatcher.notEqual(value));
  }

  public LabelFilter withRegex(String label, String pattern) {
    return with(label, LabelMatcher.regex(pattern));
  }

  public LabelFilter withNotRegex(String label, String pattern) {
    return with(label, LabelMatcher.notRegex(pattern));
  }

  /** Set membership, expressed as an anchored alternation of literal values. */
  public LabelFilter withIn(String label, Collection<String> values) {
    return with(label, LabelMatcher.regex(alternation(label, values)));
  }

  public LabelFilter withNotIn(String label, Collection<String> values) {
    return with(label, LabelMatcher.notRegex(alternation(label, values)));
  }

  public LabelFilter merge(LabelFilter other) {
    LabelFilter merged = this;
    for (Entry<String, LabelMatcher> entry : other.matchers.entrySet()) {
      merged = merged.with(entry.getKey(), entry.getValue());
    }
    return merged;
  }

  public boolean isEmpty() {
    return matchers.isEmpty();
  }

  public boolean requiresRegex() {
    return matchers.values().stream().anyMatch(matcher -> matcher.getMatchType().isRegex());
  }

  /** True when every matcher accepts the corresponding value in {@code labels}. */
  public boolean matches(Map<String, String> labels) {
    return matchers.entrySet().stream()
        .allMatch(entry -> entry.getValue().matches(labels.get(entry.getKey())));
  }

  public static String escapeRegex(String literal) {
    StringBuilder escaped = new StringBuilder(literal.length());
    for (char c : literal.toCharArray()) {
      if (REGEX_SPECIAL_CHARS.indexOf(c) >= 0) {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private static String alternation(String label, Collection<String> values) {
    if (values == null || values.isEmpty()) {
      throw new ValidationException("Set membership on '" + label + "' needs at least one value");
    }
    return values.stream()
        .map(LabelFilter::escapeRegex)
        .collect(Collectors.joining("|", "^(", ")$"));
  }

  private static String validateLabel(String label) {
    if (label == null || label.isBlank()) {
      throw new ValidationException("Label name must not be empty");
    }
    return label;
  }

  private static LabelMatcher toMatcher(String label, Object raw) {
    if (raw instanceof LabelMatcher) {
      return (LabelMatcher) raw;
    }
    if (raw instanceof String) {
      return LabelMatcher.equal((String) raw);
    }
    if (raw instanceof Map) {
      Map<?, ?> fields = (Map<?, ?>) raw;
      Object type = fields.get(TYPE_KEY);
      Object value = fields.get(VALUE_KEY);
      if (type == null) {
        throw new ValidationException("Matcher for label '" + label + "' is missing 'type'");
      }
      if (value == null) {
        throw new ValidationException("Matcher for label '" + label + "' is missing 'value'");
      }
      return LabelMatcher.of(MatchType.fromTag(type.toString()), value.toString());
    }
    throw new ValidationException(
        "Unsupported matcher definition for label '" + label + "': " + raw);
  }

  @Override
  public String toString() {
    return matchers.entrySet().stream()
        .map(entry -> entry.getKey() + entry.getValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
