package org.timeseries.access.api.labels;

import java.util.Locale;
import org.timeseries.access.api.ValidationException;

public enum MatchType {
  EQUAL("=", "equals", "equal", "eq"),
  NOT_EQUAL("!=", "not_equals", "not_equal", "ne"),
  REGEX_MATCH("=~", "regex", "regex_match"),
  REGEX_NO_MATCH("!~", "not_regex", "regex_no_match");

  private final String symbol;
  private final String[] aliases;

  MatchType(String symbol, String... aliases) {
    this.symbol = symbol;
    this.aliases = aliases;
  }

  public String getSymbol() {
    return symbol;
  }

  public boolean isRegex() {
    return this == REGEX_MATCH || this == REGEX_NO_MATCH;
  }

  public boolean isNegated() {
    return this == NOT_EQUAL || this == REGEX_NO_MATCH;
  }

  /**
   * Resolves a match type from either its operator symbol ({@code =~}) or one of its word tags
   * ({@code regex}). Word tags are case-insensitive.
   *
   * @throws ValidationException if the tag is blank or unknown
   */
  public static MatchType fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      throw new ValidationException("Match type tag must not be empty");
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    for (MatchType type : values()) {
      if (type.symbol.equals(normalized)
          || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return type;
      }
      for (String alias : type.aliases) {
        if (alias.equals(normalized)) {
          return type;
        }
      }
    }
    throw new ValidationException("Unknown match type: " + tag);
  }
}
