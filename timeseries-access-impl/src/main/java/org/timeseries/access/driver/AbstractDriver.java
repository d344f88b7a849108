package org.timeseries.access.driver;

import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.NotConnectedException;
import org.timeseries.access.api.UnsupportedFeatureException;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.capability.Capability;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.driver.Driver;
import org.timeseries.access.api.driver.QueryBuilder;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.WriteResult;

/**
 * Common driver plumbing: lazy connection, compiled-query type check, failed responses and parse
 * errors turned into failed results, and the write capability check.
 *
 * @param <Q> the compiled query type produced by this driver's builder
 */
@Slf4j
public abstract class AbstractDriver<Q extends CompiledQuery> implements Driver {
  private final String name;
  private final Capabilities capabilities;
  private final ConnectionAdapter adapter;
  private final QueryBuilder<Q> queryBuilder;
  private final Class<Q> queryType;
  private volatile boolean closed;

  protected AbstractDriver(
      String name,
      Capabilities capabilities,
      ConnectionAdapter adapter,
      QueryBuilder<Q> queryBuilder,
      Class<Q> queryType) {
    this.name = name;
    this.capabilities = capabilities;
    this.adapter = adapter;
    this.queryBuilder = queryBuilder;
    this.queryType = queryType;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Capabilities getCapabilities() {
    return capabilities;
  }

  @Override
  public QueryBuilder<Q> getQueryBuilder() {
    return queryBuilder;
  }

  @Override
  public boolean connect() {
    return adapter.connect();
  }

  @Override
  public boolean isConnected() {
    return adapter.isConnected();
  }

  @Override
  public final Result query(CompiledQuery compiledQuery) {
    if (!queryType.isInstance(compiledQuery)) {
      throw new IllegalArgumentException(
          String.format(
              "Driver %s cannot execute %s",
              name, compiledQuery == null ? "null" : compiledQuery.getClass().getSimpleName()));
    }
    Q query = queryType.cast(compiledQuery);
    ensureConnected();
    log.debug("Executing on {}: {}", name, query.getRawQuery());
    try {
      return execute(query);
    } catch (NotConnectedException e) {
      throw e;
    } catch (ResponseParseException e) {
      log.warn("Unable to parse response from {}: {}", name, e.getMessage());
      return failure(query, "Failed to parse response: " + e.getMessage());
    }
  }

  @Override
  public WriteResult write(MetricSample sample) {
    return writeBatch(List.of(sample));
  }

  @Override
  public final WriteResult writeBatch(List<MetricSample> samples) {
    if (!capabilities.supports(Capability.WRITE)) {
      throw new UnsupportedFeatureException(
          Capability.WRITE.getFeature(), null, "Driver " + name + " does not support writes");
    }
    if (samples.isEmpty()) {
      return WriteResult.success(0);
    }
    ensureConnected();
    return doWrite(samples);
  }

  @Override
  public void close() {
    closed = true;
    adapter.close();
  }

  protected ConnectionAdapter getAdapter() {
    return adapter;
  }

  /**
   * Maps a failed response to a failed result, and a successful one through {@code onSuccess}.
   */
  protected Result handleResponse(
      Q query, CommandResponse response, Function<String, Result> onSuccess) {
    if (!response.isSuccess()) {
      return failedResponse(query, response);
    }
    return onSuccess.apply(response.getData());
  }

  protected Result failedResponse(Q query, CommandResponse response) {
    String error = response.getError().orElse("Unknown error");
    log.warn("Query on {} failed: {} {}", name, error, response.getMetadata());
    return failure(query, error);
  }

  protected WriteResult handleWriteResponse(CommandResponse response, int written) {
    if (!response.isSuccess()) {
      String error = response.getError().orElse("Unknown error");
      log.warn("Write on {} failed: {}", name, error);
      return WriteResult.failure(error);
    }
    return WriteResult.success(written);
  }

  /** Failure of a sample-by-sample write after {@code persisted} samples were stored. */
  protected WriteResult handlePartialWrite(CommandResponse response, int persisted) {
    String error = response.getError().orElse("Unknown error");
    log.warn("Write on {} failed after {} samples: {}", name, persisted, error);
    return WriteResult.partial(error, persisted);
  }

  protected abstract Result execute(Q query);

  /** A failed result of the shape matching {@code query}. */
  protected abstract Result failure(Q query, String error);

  protected abstract WriteResult doWrite(List<MetricSample> samples);

  private void ensureConnected() {
    // after close() the adapter's reconnect policy decides
    if (!closed && !adapter.isConnected()) {
      adapter.connect();
    }
  }
}
