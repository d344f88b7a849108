package org.timeseries.access.influxdb;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.time.TimePrecision;

/** A Flux script together with what is needed to shape its CSV answer into a result. */
@Value
@Builder(builderClassName = "Builder")
public class InfluxQuery implements CompiledQuery {
  @NonNull QueryType queryType;
  @NonNull String flux;
  @NonNull TimePrecision precision;
  @NonNull Instant start;
  @NonNull Instant end;
  @NonNull Resolution resolution;

  /** Set for label queries only. */
  @Getter(AccessLevel.NONE)
  LabelQueryKind labelKind;

  /** Yield name to user alias, for aliased streams. */
  @Singular Map<String, String> aliases;

  public Optional<LabelQueryKind> getLabelKind() {
    return Optional.ofNullable(labelKind);
  }

  @Override
  public String getRawQuery() {
    return flux;
  }
}
