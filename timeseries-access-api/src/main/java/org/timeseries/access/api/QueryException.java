package org.timeseries.access.api;

import java.util.Optional;
import org.timeseries.access.api.query.Query;

/** A query could not be compiled. Carries the offending query for diagnostics. */
public class QueryException extends TimeseriesException {
  private final transient Query query;

  public QueryException(Query query, String message) {
    super(message);
    this.query = query;
  }

  public QueryException(Query query, String message, Throwable cause) {
    super(message, cause);
    this.query = query;
  }

  public Optional<Query> getQuery() {
    return Optional.ofNullable(query);
  }
}
