package org.timeseries.access.api.labels;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/** A single comparison rule applied to the value of one label. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabelMatcher {
  MatchType matchType;
  String value;

  /** Compiled form of {@code value} for regex matchers, null otherwise. */
  @EqualsAndHashCode.Exclude
  @Getter(AccessLevel.NONE)
  Pattern pattern;

  public static LabelMatcher of(MatchType matchType, String value) {
    if (matchType == null) {
      throw new ValidationException("Match type is required");
    }
    if (value == null) {
      throw new ValidationException("Matcher value is required");
    }
    Pattern pattern = null;
    if (matchType.isRegex()) {
      try {
        pattern = Pattern.compile(value);
      } catch (PatternSyntaxException e) {
        throw new ValidationException("Invalid regular expression: " + value, e);
      }
    }
    return new LabelMatcher(matchType, value, pattern);
  }

  public static LabelMatcher equal(String value) {
    return of(MatchType.EQUAL, value);
  }

  public static LabelMatcher notEqual(String value) {
    return of(MatchType.NOT_EQUAL, value);
  }

  public static LabelMatcher regex(String value) {
    return of(MatchType.REGEX_MATCH, value);
  }

  public static LabelMatcher notRegex(String value) {
    return of(MatchType.REGEX_NO_MATCH, value);
  }

  /** Evaluates this matcher against a label value; an absent label is the empty string. */
  public boolean matches(String candidate) {
    String actual = candidate == null ? "" : candidate;
    switch (matchType) {
      case EQUAL:
        return value.equals(actual);
      case NOT_EQUAL:
        return !value.equals(actual);
      case REGEX_MATCH:
        return pattern.matcher(actual).matches();
      case REGEX_NO_MATCH:
        return !pattern.matcher(actual).matches();
      default:
        throw new IllegalStateException("Unhandled match type " + matchType);
    }
  }

  @Override
  public String toString() {
    return matchType.getSymbol() + "\"" + value + "\"";
  }
}
