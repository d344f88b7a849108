package org.timeseries.access.api.driver;

import org.timeseries.access.api.query.Query;

public interface QueryBuilder<T extends CompiledQuery> {

  /**
   * Compiles {@code query}. Equal queries compile to equal output.
   *
   * @throws org.timeseries.access.api.QueryException on malformed input or a capability gap
   */
  T build(Query query);
}
