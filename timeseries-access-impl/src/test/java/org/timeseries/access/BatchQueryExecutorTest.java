package org.timeseries.access;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.query.DataQueryBuilder;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.time.TimeRange;
import org.timeseries.access.nulldriver.NullDriver;

public class BatchQueryExecutorTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-01T01:00:00Z"), ZoneOffset.UTC);

  @Test
  public void testFailuresStayInTheirSlot() {
    TimeseriesConnection connection = new TimeseriesConnection("test", new NullDriver(CLOCK));
    TimeRange range =
        TimeRange.between(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:30:00Z"));
    List<Query> queries =
        List.of(
            DataQueryBuilder.forPeriod(range).select("cpu.load").build(),
            DataQueryBuilder.forPeriod(range).select("net.bytes", s -> s.rate()).build(),
            LabelQuery.metricNames(),
            DataQueryBuilder.forPeriod(TimeRange.lastHours(1)).select("mem.used").build());

    List<Result> results = new BatchQueryExecutor().executeAll(connection, queries).blockingGet();

    Assertions.assertEquals(4, results.size());
    Assertions.assertTrue(results.get(0).isSuccess());

    TimeSeriesResult failedData = (TimeSeriesResult) results.get(1);
    Assertions.assertFalse(failedData.isSuccess());
    Assertions.assertTrue(failedData.getError().orElseThrow().contains("rate"));
    Assertions.assertEquals(range.getStart(), failedData.getStart());
    Assertions.assertEquals(range.getEnd(), failedData.getEnd());

    LabelResult failedLabels = (LabelResult) results.get(2);
    Assertions.assertFalse(failedLabels.isSuccess());
    Assertions.assertEquals(LabelQueryKind.METRIC_NAMES, failedLabels.getKind());

    TimeSeriesResult last = (TimeSeriesResult) results.get(3);
    Assertions.assertTrue(last.isSuccess());
    Assertions.assertEquals(CLOCK.instant(), last.getEnd());
  }

  @Test
  public void testEmptyBatch() {
    TimeseriesConnection connection = new TimeseriesConnection("test", new NullDriver(CLOCK));
    Assertions.assertTrue(
        new BatchQueryExecutor().executeAll(connection, List.of()).blockingGet().isEmpty());
  }
}
