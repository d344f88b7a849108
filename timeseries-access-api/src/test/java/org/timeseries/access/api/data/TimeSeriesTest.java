package org.timeseries.access.api.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.metric.MetricIdentifier;

class TimeSeriesTest {

  @Test
  void testStatisticsSkipGaps() {
    Instant t0 = Instant.ofEpochSecond(1_700_000_000L);
    TimeSeries series =
        TimeSeries.builder()
            .metric("net.bytes")
            .label("host", "a")
            .point(new DataPoint(t0, 2.0))
            .point(new DataPoint(t0.plusSeconds(60), null))
            .point(new DataPoint(t0.plusSeconds(120), 6.0))
            .build();

    assertEquals(2.0, series.min().getAsDouble());
    assertEquals(6.0, series.max().getAsDouble());
    assertEquals(4.0, series.avg().getAsDouble());
    assertEquals("net.bytes", series.getName());
  }

  @Test
  void testEmptySeriesHasNoStatistics() {
    TimeSeries series = TimeSeries.builder().metric("cpu").alias("load").build();

    assertFalse(series.min().isPresent());
    assertEquals("load", series.getName());
  }

  @Test
  void testIntegralSamples() {
    MetricSample integral =
        MetricSample.builder()
            .metric(MetricIdentifier.named("cpu"))
            .value(42)
            .timestamp(Instant.EPOCH)
            .build();

    assertTrue(integral.isIntegral());
    assertFalse(integral.toBuilder().value(0.5).build().isIntegral());
  }
}
