package org.timeseries.access.api.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.labels.MatchType;
import org.timeseries.access.api.time.TimePrecision;
import org.timeseries.access.api.time.TimeRange;

class DataQueryBuilderTest {

  @Test
  void testFluentQueryKeepsOperationOrder() {
    DataQuery query =
        DataQueryBuilder.forPeriod(TimeRange.lastHours(1))
            .resolution(Resolution.minutes(5))
            .select(
                "net.bytes",
                s ->
                    s.where("host", "a")
                        .rate()
                        .multiplyBy(8)
                        .aggregate(Aggregation.AVERAGE)
                        .as("bits"))
            .build();

    assertEquals(QueryType.DATA, query.getQueryType());
    assertEquals(TimePrecision.S, query.getPrecision());
    assertEquals(300L, query.getResolution().getSeconds().getAsLong());
    Stream stream = query.getStreams().get(0);
    assertEquals("net.bytes", stream.getMetric().key());
    assertEquals(
        List.of(OperationType.RATE, OperationType.MATH),
        List.of(stream.getPipeline().get(0).getType(), stream.getPipeline().get(1).getType()));
    assertEquals(MathOperation.of(MathOperator.MULTIPLY, 8), stream.getPipeline().get(1));
    assertEquals(List.of(Aggregation.AVERAGE), stream.getAggregations());
    assertEquals("bits", stream.getAlias().orElseThrow());
    assertEquals(MatchType.EQUAL, stream.getFilter().getMatchers().get("host").getMatchType());
  }

  @Test
  void testEqualQueriesCompareEqual() {
    TimeRange range = TimeRange.lastMinutes(10);
    DataQuery first = DataQueryBuilder.forPeriod(range).select("cpu", s -> s.delta()).build();
    DataQuery second = DataQueryBuilder.forPeriod(range).select("cpu", s -> s.delta()).build();

    assertEquals(first, second);
  }

  @Test
  void testQueryWithoutStreamsIsRejected() {
    assertThrows(
        ValidationException.class,
        () -> DataQueryBuilder.forPeriod(TimeRange.lastHours(1)).build());
  }

  @Test
  void testEveryOperationReportsItsType() {
    assertEquals(OperationType.RATE, BasicOperation.of(OperationType.RATE).getType());
    assertEquals(OperationType.MATH, MathOperation.of(MathOperator.ADD, 1).getType());
    assertEquals(OperationType.HISTOGRAM_QUANTILE, QuantileOperation.of(0.99).getType());
    assertEquals(
        OperationType.LABEL_JOIN, LabelJoinOperation.of("id", "-", List.of("a", "b")).getType());
  }

  @Test
  void testInvalidOperationsAreRejected() {
    assertThrows(ValidationException.class, () -> BasicOperation.of(OperationType.MATH));
    assertThrows(ValidationException.class, () -> MathOperation.of(MathOperator.DIVIDE, 0));
    assertThrows(ValidationException.class, () -> QuantileOperation.of(1.5));
    assertThrows(ValidationException.class, () -> Resolution.seconds(0));
  }

  @Test
  void testLabelQueryShapes() {
    LabelQuery values = LabelQuery.labelValues("host", List.of());

    assertEquals(LabelQueryKind.LABEL_VALUES, values.getKind());
    assertEquals("host", values.getLabel().orElseThrow());
    assertTrue(values.getTimeRange().isEmpty());
    assertTrue(LabelQuery.metricNames().getLabel().isEmpty());
    assertThrows(ValidationException.class, () -> LabelQuery.labelValues(" ", List.of()));
  }

  @Test
  void testAggregationNames() {
    assertEquals(Aggregation.AVERAGE, Aggregation.fromName("avg"));
    assertEquals(Aggregation.MAXIMUM, Aggregation.fromName("maximum"));
    assertThrows(ValidationException.class, () -> Aggregation.fromName("p99"));
  }
}
