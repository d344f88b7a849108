package org.timeseries.access.api.capability;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

/**
 * Immutable feature set of a driver. Besides the well-known {@link Capability} flags a driver may
 * publish additional named flags; an unknown name is reported as unsupported.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Capabilities {
  private static final Capabilities NONE =
      new Capabilities(Collections.unmodifiableSet(EnumSet.noneOf(Capability.class)), Map.of());

  private final Set<Capability> supported;
  private final Map<String, Boolean> additional;

  public static Capabilities none() {
    return NONE;
  }

  public static Capabilities all() {
    return builder().supportAll().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean supportsRate() {
    return supports(Capability.RATE);
  }

  public boolean supportsHistogram() {
    return supports(Capability.HISTOGRAM);
  }

  public boolean supportsLabelJoin() {
    return supports(Capability.LABEL_JOIN);
  }

  public boolean supports(Capability capability) {
    return supported.contains(capability);
  }

  public boolean supports(String key) {
    return Capability.fromKey(key)
        .map(this::supports)
        .orElseGet(() -> additional.getOrDefault(key, false));
  }

  public Set<Capability> getSupported() {
    return supported;
  }

  /** String-keyed view of every well-known flag plus the additional ones. */
  public Map<String, Boolean> asMap() {
    Map<String, Boolean> flags = new LinkedHashMap<>();
    for (Capability capability : Capability.values()) {
      flags.put(capability.getKey(), supports(capability));
    }
    flags.putAll(additional);
    return Collections.unmodifiableMap(flags);
  }

  @Override
  public String toString() {
    return "Capabilities" + asMap();
  }

  public static class Builder {
    private final Set<Capability> supported = EnumSet.noneOf(Capability.class);
    private final ImmutableMap.Builder<String, Boolean> additional = ImmutableMap.builder();

    private Builder() {}

    public Builder support(Capability... capabilities) {
      Collections.addAll(supported, capabilities);
      return this;
    }

    public Builder supportAll() {
      supported.addAll(EnumSet.allOf(Capability.class));
      return this;
    }

    public Builder flag(String key, boolean value) {
      if (Capability.fromKey(key).isPresent()) {
        throw new IllegalArgumentException(key + " is a well-known capability, use support()");
      }
      additional.put(key, value);
      return this;
    }

    public Capabilities build() {
      return new Capabilities(
          Collections.unmodifiableSet(Sets.newEnumSet(supported, Capability.class)),
          additional.buildOrThrow());
    }
  }
}
