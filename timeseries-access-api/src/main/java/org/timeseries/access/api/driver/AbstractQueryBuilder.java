package org.timeseries.access.api.driver;

import java.time.Clock;
import org.timeseries.access.api.QueryException;
import org.timeseries.access.api.TimeseriesException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.CapabilityGate;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.time.TimeRange;

/**
 * Runs the capability gate, then dispatches to the data or label compiler. Any other failure
 * raised while compiling is reported as a {@link QueryException} carrying the query.
 */
public abstract class AbstractQueryBuilder<T extends CompiledQuery> implements QueryBuilder<T> {
  private final Capabilities capabilities;
  private final Clock clock;

  protected AbstractQueryBuilder(Capabilities capabilities, Clock clock) {
    this.capabilities = capabilities;
    this.clock = clock;
  }

  @Override
  public final T build(Query query) {
    if (query == null) {
      throw new QueryException(null, "Query is required");
    }
    CapabilityGate.check(query, capabilities);
    try {
      switch (query.getQueryType()) {
        case DATA:
          return compileData((DataQuery) query);
        case LABEL:
          return compileLabels((LabelQuery) query);
        default:
          throw new QueryException(query, "Unhandled query type " + query.getQueryType());
      }
    } catch (QueryException e) {
      throw e;
    } catch (TimeseriesException | IllegalArgumentException e) {
      throw new QueryException(query, "Failed to compile query: " + e.getMessage(), e);
    }
  }

  protected abstract T compileData(DataQuery query);

  protected abstract T compileLabels(LabelQuery query);

  public Capabilities getCapabilities() {
    return capabilities;
  }

  /** Resolves {@code range} against this builder's clock, once per compilation. */
  protected TimeRange.Resolved resolve(TimeRange range) {
    return range.withClock(clock).resolve();
  }

  protected Clock getClock() {
    return clock;
  }
}
