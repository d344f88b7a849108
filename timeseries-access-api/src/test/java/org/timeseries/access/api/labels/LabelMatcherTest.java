package org.timeseries.access.api.labels;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ValidationException;

class LabelMatcherTest {

  @Test
  void testRegexMatcherIsReusableAcrossCandidates() {
    LabelMatcher matcher = LabelMatcher.regex("web-[0-9]+");

    assertTrue(matcher.matches("web-1"));
    assertTrue(matcher.matches("web-42"));
    assertFalse(matcher.matches("db-1"));
    assertFalse(matcher.matches(null));
    assertTrue(LabelMatcher.notRegex("web-[0-9]+").matches("db-1"));
  }

  @Test
  void testEqualityIgnoresCompiledPattern() {
    LabelMatcher first = LabelMatcher.regex("a|b");
    LabelMatcher second = LabelMatcher.regex("a|b");

    assertNotSame(first, second);
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertEquals("=~\"a|b\"", first.toString());
  }

  @Test
  void testAbsentLabelIsEmptyString() {
    assertTrue(LabelMatcher.equal("").matches(null));
    assertTrue(LabelMatcher.notEqual("a").matches(null));
    assertTrue(LabelMatcher.regex(".*").matches(null));
  }

  @Test
  void testInvalidRegexIsRejected() {
    assertThrows(ValidationException.class, () -> LabelMatcher.regex("(unclosed"));
    assertThrows(ValidationException.class, () -> LabelMatcher.equal(null));
  }
}
