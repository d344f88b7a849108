package org.timeseries.access.api.result;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;
import org.timeseries.access.api.query.LabelQueryKind;

/** Sorted, de-duplicated names or values returned by a label query. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabelResult implements Result {
  LabelQueryKind kind;
  List<String> values;

  @Getter(AccessLevel.NONE)
  String error;

  public static LabelResult of(LabelQueryKind kind, Collection<String> values) {
    return new LabelResult(kind, List.copyOf(new TreeSet<>(values)), null);
  }

  public static LabelResult failure(LabelQueryKind kind, String error) {
    return new LabelResult(kind, List.of(), error);
  }

  @Override
  public boolean hasData() {
    return !values.isEmpty();
  }

  @Override
  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }
}
