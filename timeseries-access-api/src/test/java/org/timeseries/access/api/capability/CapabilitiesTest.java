package org.timeseries.access.api.capability;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CapabilitiesTest {

  @Test
  void testNoneDeclaresEveryFlagFalse() {
    Capabilities none = Capabilities.none();

    assertFalse(none.supportsRate());
    assertFalse(none.supportsHistogram());
    assertFalse(none.supportsLabelJoin());
    assertTrue(none.asMap().values().stream().noneMatch(Boolean::booleanValue));
  }

  @Test
  void testStringKeyedSurface() {
    Capabilities capabilities =
        Capabilities.builder()
            .support(Capability.RATE, Capability.LABEL_JOIN)
            .flag("supportsDownsampling", true)
            .build();

    assertTrue(capabilities.supports("supportsRate"));
    assertTrue(capabilities.supports("supportsLabelJoin"));
    assertFalse(capabilities.supports("supportsHistogram"));
    assertTrue(capabilities.supports("supportsDownsampling"));
    assertFalse(capabilities.supports("supportsTeleportation"));

    Map<String, Boolean> flags = capabilities.asMap();
    assertEquals(Boolean.TRUE, flags.get("supportsRate"));
    assertEquals(Boolean.FALSE, flags.get("supportsWrite"));
    assertEquals(Boolean.TRUE, flags.get("supportsDownsampling"));
  }

  @Test
  void testWellKnownKeysCannotBeAddedAsFlags() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Capabilities.builder().flag("supportsRate", true));
  }

  @Test
  void testValueEquality() {
    assertEquals(
        Capabilities.builder().support(Capability.MATH).build(),
        Capabilities.builder().support(Capability.MATH).build());
  }
}
