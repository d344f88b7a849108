package org.timeseries.access.api.driver;

import org.timeseries.access.api.query.QueryType;

/**
 * Backend-specific executable form of a query, produced by a {@link QueryBuilder} and consumed
 * only by the driver that built it.
 */
public interface CompiledQuery {

  QueryType getQueryType();

  /** Text form of the compiled query, for logging and diagnostics. */
  String getRawQuery();
}
