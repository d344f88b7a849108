package org.timeseries.access.nulldriver;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.driver.Driver;
import org.timeseries.access.api.driver.QueryBuilder;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;

/**
 * Discards everything. Declares no capabilities, answers every query with an empty result and
 * accepts every write.
 */
@Slf4j
public class NullDriver implements Driver {
  public static final String NAME = "null";
  public static final Capabilities CAPABILITIES = Capabilities.none();

  private final ConnectionAdapter adapter;
  private final NullQueryBuilder queryBuilder;
  private final Clock clock;

  public NullDriver(Clock clock) {
    this(new NullConnectionAdapter(), clock);
  }

  public NullDriver(ConnectionAdapter adapter, Clock clock) {
    this.adapter = adapter;
    this.queryBuilder = new NullQueryBuilder(CAPABILITIES, clock);
    this.clock = clock;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public Capabilities getCapabilities() {
    return CAPABILITIES;
  }

  @Override
  public QueryBuilder<NullQuery> getQueryBuilder() {
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
  public Result query(CompiledQuery query) {
    log.debug("Discarding query {}", query == null ? null : query.getRawQuery());
    if (query instanceof NullQuery) {
      NullQuery nullQuery = (NullQuery) query;
      if (nullQuery.getQueryType() == QueryType.LABEL && nullQuery.getLabelKind().isPresent()) {
        return LabelResult.of(nullQuery.getLabelKind().get(), List.of());
      }
      Instant now = clock.instant();
      return TimeSeriesResult.empty(
          nullQuery.getStart().orElse(now),
          nullQuery.getEnd().orElse(now),
          nullQuery.getResolution());
    }
    Instant now = clock.instant();
    return TimeSeriesResult.empty(now, now, Resolution.auto());
  }

  @Override
  public WriteResult write(MetricSample sample) {
    return writeBatch(List.of(sample));
  }

  @Override
  public WriteResult writeBatch(List<MetricSample> samples) {
    log.info("Discarding {} samples written to the null backend", samples.size());
    return WriteResult.success(samples.size());
  }

  @Override
  public void close() {
    adapter.close();
  }
}
