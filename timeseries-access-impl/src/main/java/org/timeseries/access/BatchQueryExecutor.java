package org.timeseries.access;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.QueryException;
import org.timeseries.access.api.TimeseriesException;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.time.TimeRange;

/**
 * Runs independent queries on one connection, in order. A query that fails to compile or execute
 * yields a failed result in its own slot.
 */
@Slf4j
public class BatchQueryExecutor {

  public Single<List<Result>> executeAll(TimeseriesConnection connection, List<Query> queries) {
    return Observable.fromIterable(queries)
        .concatMapSingle(query -> execute(connection, query))
        .toList();
  }

  private Single<Result> execute(TimeseriesConnection connection, Query query) {
    return Single.fromCallable(() -> connection.query(query))
        .onErrorReturn(
            throwable -> {
              if (throwable instanceof TimeseriesException) {
                log.warn(
                    "Query in batch on {} failed: {}",
                    connection.getName(),
                    throwable.getMessage());
              } else {
                log.error("Unexpected failure in batch on {}", connection.getName(), throwable);
              }
              return failed(query, throwable);
            });
  }

  private static Result failed(Query query, Throwable throwable) {
    String error = throwable.getMessage() == null ? throwable.toString() : throwable.getMessage();
    if (query instanceof LabelQuery) {
      return LabelResult.failure(((LabelQuery) query).getKind(), error);
    }
    if (query instanceof DataQuery) {
      DataQuery dataQuery = (DataQuery) query;
      try {
        TimeRange.Resolved range = dataQuery.getTimeRange().resolve();
        return TimeSeriesResult.failure(
            error, range.getStart(), range.getEnd(), dataQuery.getResolution());
      } catch (TimeseriesException e) {
        return TimeSeriesResult.failure(error, null, null, dataQuery.getResolution());
      }
    }
    throw new QueryException(query, "Unhandled query type " + query.getClass().getSimpleName());
  }
}
