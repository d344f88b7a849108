package org.timeseries.access.nulldriver;

import java.time.Instant;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;

/** Marker query remembering only what is needed to shape an empty result. */
@Value
@Builder(builderClassName = "Builder")
public class NullQuery implements CompiledQuery {
  public static final String RAW_QUERY = "null";

  @NonNull QueryType queryType;

  @Getter(AccessLevel.NONE)
  Instant start;

  @Getter(AccessLevel.NONE)
  Instant end;

  @lombok.Builder.Default Resolution resolution = Resolution.auto();

  @Getter(AccessLevel.NONE)
  LabelQueryKind labelKind;

  public Optional<Instant> getStart() {
    return Optional.ofNullable(start);
  }

  public Optional<Instant> getEnd() {
    return Optional.ofNullable(end);
  }

  public Optional<LabelQueryKind> getLabelKind() {
    return Optional.ofNullable(labelKind);
  }

  @Override
  public String getRawQuery() {
    return RAW_QUERY;
  }
}
