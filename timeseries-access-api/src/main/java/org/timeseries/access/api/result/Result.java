package org.timeseries.access.api.result;

import java.util.Optional;

/** Normalized outcome of executing a compiled query. */
public interface Result {

  boolean hasData();

  Optional<String> getError();

  default boolean isSuccess() {
    return getError().isEmpty();
  }
}
