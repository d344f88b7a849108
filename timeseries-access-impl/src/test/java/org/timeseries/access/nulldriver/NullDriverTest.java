package org.timeseries.access.nulldriver;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.NotConnectedException;
import org.timeseries.access.api.UnsupportedFeatureException;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.query.DataQueryBuilder;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.api.time.TimeRange;

public class NullDriverTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-01T01:00:00Z"), ZoneOffset.UTC);

  private NullConnectionAdapter adapter;
  private NullDriver driver;

  @BeforeEach
  public void setUp() {
    adapter = spy(new NullConnectionAdapter());
    driver = new NullDriver(adapter, CLOCK);
  }

  @Test
  public void testAlwaysConnected() {
    Assertions.assertTrue(driver.isConnected());
    Assertions.assertTrue(driver.connect());
    Assertions.assertEquals("null", driver.getName());
    Assertions.assertTrue(driver.getCapabilities().getSupported().isEmpty());
  }

  @Test
  public void testDataQueryGivesEmptyResultOverRange() {
    Result result =
        driver.query(
            driver
                .getQueryBuilder()
                .build(
                    DataQueryBuilder.forPeriod(TimeRange.lastHours(1)).select("cpu.load").build()));

    Assertions.assertTrue(result instanceof TimeSeriesResult);
    Assertions.assertTrue(result.isSuccess());
    Assertions.assertFalse(result.hasData());
    TimeSeriesResult series = (TimeSeriesResult) result;
    Assertions.assertEquals(Instant.parse("2024-01-01T00:00:00Z"), series.getStart());
    Assertions.assertEquals(Instant.parse("2024-01-01T01:00:00Z"), series.getEnd());
  }

  @Test
  public void testLabelQueryGivesEmptyLabelResult() {
    Result result =
        driver.query(
            NullQuery.builder()
                .queryType(QueryType.LABEL)
                .labelKind(LabelQueryKind.METRIC_NAMES)
                .build());

    Assertions.assertTrue(result instanceof LabelResult);
    Assertions.assertEquals(LabelQueryKind.METRIC_NAMES, ((LabelResult) result).getKind());
    Assertions.assertTrue(((LabelResult) result).getValues().isEmpty());
  }

  @Test
  public void testUndeclaredFeaturesFailBeforeTheAdapter() {
    UnsupportedFeatureException exception =
        Assertions.assertThrows(
            UnsupportedFeatureException.class,
            () ->
                driver
                    .getQueryBuilder()
                    .build(
                        DataQueryBuilder.forPeriod(TimeRange.lastHours(1))
                            .select("net.bytes", s -> s.rate())
                            .build()));
    Assertions.assertEquals("rate", exception.getFeature());
    Assertions.assertThrows(
        UnsupportedFeatureException.class,
        () -> driver.getQueryBuilder().build(LabelQuery.metricNames()));
    verify(adapter, never()).executeCommand(any(), any());
  }

  @Test
  public void testWritesAreAccepted() {
    MetricSample sample =
        MetricSample.builder()
            .metric(MetricIdentifier.named("cpu.load"))
            .value(0.5)
            .timestamp(CLOCK.instant())
            .build();

    WriteResult single = driver.write(sample);
    WriteResult batch = driver.writeBatch(List.of(sample, sample));

    Assertions.assertTrue(single.isSuccess());
    Assertions.assertEquals(1, single.getWritten());
    Assertions.assertEquals(2, batch.getWritten());
    verify(adapter, never()).executeCommand(any(), any());
  }

  @Test
  public void testCloseDisconnects() {
    driver.close();
    Assertions.assertFalse(driver.isConnected());
    Assertions.assertThrows(NotConnectedException.class, () -> adapter.executeCommand("x", ""));
  }
}
