package org.timeseries.access.graph;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.timeseries.access.TimeseriesConnection;
import org.timeseries.access.api.driver.CompiledQuery;
import org.timeseries.access.api.driver.Driver;
import org.timeseries.access.api.driver.QueryBuilder;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.labels.LabelMatcher;
import org.timeseries.access.api.labels.MatchType;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.query.Aggregation;
import org.timeseries.access.api.query.BasicOperation;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.OperationType;
import org.timeseries.access.api.query.Query;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.query.Resolution;
import org.timeseries.access.api.query.Stream;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.time.TimeRange;
import org.timeseries.access.metric.RuntimeMetricRepository;

public class GraphServiceTest {
  private static final TimeRange RANGE =
      TimeRange.between(
          Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T01:00:00Z"));

  private final RuntimeMetricRepository metrics =
      new RuntimeMetricRepository(
          List.of(
              MetricIdentifier.builder()
                  .namespace("net")
                  .name("bytes")
                  .type(MetricType.COUNTER)
                  .aggregation(Aggregation.AVERAGE)
                  .aggregation(Aggregation.MAXIMUM)
                  .build(),
              MetricIdentifier.named("cpu.load")));
  private final RuntimeGraphRepository graphs = new RuntimeGraphRepository();

  private Driver driver;
  private QueryBuilder<CompiledQuery> queryBuilder;
  private GraphService service;

  @BeforeEach
  @SuppressWarnings("unchecked")
  public void setUp() {
    driver = mock(Driver.class);
    queryBuilder = mock(QueryBuilder.class);
    doReturn(queryBuilder).when(driver).getQueryBuilder();
    CompiledQuery compiled = mock(CompiledQuery.class);
    when(compiled.getQueryType()).thenReturn(QueryType.DATA);
    when(queryBuilder.build(any())).thenReturn(compiled);
    when(driver.query(compiled))
        .thenReturn(TimeSeriesResult.empty(RANGE.getStart(), RANGE.getEnd(), Resolution.auto()));
    service = new GraphService(graphs, metrics, new TimeseriesConnection("test", driver));

    graphs.register(
        GraphDefinition.builder()
            .id("traffic")
            .title("Traffic")
            .series(
                SeriesDefinition.builder()
                    .metric("net.bytes")
                    .legend("in")
                    .filter(LabelFilter.match("direction", "in"))
                    .operation(BasicOperation.of(OperationType.RATE))
                    .build())
            .series(SeriesDefinition.builder().metric("cpu.load").build())
            .variable(GraphVariable.builder().name("host").required(true).build())
            .variable(
                GraphVariable.builder()
                    .name("if")
                    .defaultValue("eth0")
                    .allowedOperator(MatchType.EQUAL)
                    .allowedOperator(MatchType.REGEX_MATCH)
                    .build())
            .build());
  }

  @Test
  public void testRenderBindsVariablesIntoEveryStream() {
    TimeSeriesResult result =
        service.render("traffic", RANGE, List.of(VariableBinding.of("host", "web-1")));

    Assertions.assertTrue(result.isSuccess());
    DataQuery query = capturedQuery();
    Assertions.assertEquals(2, query.getStreams().size());

    Stream traffic = query.getStreams().get(0);
    Assertions.assertEquals("net.bytes", traffic.getMetric().key());
    Assertions.assertEquals(MetricType.COUNTER, traffic.getMetric().getType());
    Assertions.assertEquals("in", traffic.getAlias().orElseThrow());
    Assertions.assertEquals(List.of(Aggregation.AVERAGE), traffic.getAggregations());
    Assertions.assertEquals(
        LabelFilter.match("direction", "in").withEqual("host", "web-1").withEqual("if", "eth0"),
        traffic.getFilter());

    Stream load = query.getStreams().get(1);
    Assertions.assertEquals(
        LabelFilter.match("host", "web-1").withEqual("if", "eth0"), load.getFilter());
  }

  @Test
  public void testAllowedOperatorReplacesDefault() {
    service.render(
        "traffic",
        RANGE,
        List.of(
            VariableBinding.of("host", "web-1"),
            VariableBinding.of("if", MatchType.REGEX_MATCH, "eth.*"),
            VariableBinding.of("zone", "eu")));

    LabelFilter filter = capturedQuery().getStreams().get(1).getFilter();
    Assertions.assertEquals(LabelMatcher.regex("eth.*"), filter.getMatchers().get("if"));
    Assertions.assertFalse(filter.getMatchers().containsKey("zone"));
  }

  @Test
  public void testMissingRequiredVariable() {
    InvalidGraphException exception =
        Assertions.assertThrows(
            InvalidGraphException.class, () -> service.render("traffic", RANGE, List.of()));
    Assertions.assertEquals("Missing required variable 'host'", exception.getMessage());
    verify(driver, never()).query(any());
  }

  @Test
  public void testOperatorNotAllowed() {
    Assertions.assertThrows(
        InvalidGraphException.class,
        () ->
            service.render(
                "traffic",
                RANGE,
                List.of(VariableBinding.of("host", MatchType.REGEX_MATCH, "web-.*"))));
  }

  @Test
  public void testCounterWithoutRateIsRejected() {
    GraphDefinition graph =
        GraphDefinition.builder()
            .id("raw")
            .title("Raw counter")
            .series(SeriesDefinition.builder().metric("net.bytes").build())
            .build();

    InvalidGraphException exception =
        Assertions.assertThrows(
            InvalidGraphException.class,
            () -> service.render(graph, RANGE, List.of(), Resolution.auto()));
    Assertions.assertEquals(
        "Counter metric 'net.bytes' must be queried using rate", exception.getMessage());
  }

  @Test
  public void testUnsupportedAggregationIsRejected() {
    GraphDefinition graph =
        GraphDefinition.builder()
            .id("sum")
            .title("Summed")
            .series(
                SeriesDefinition.builder()
                    .metric("net.bytes")
                    .aggregation(Aggregation.SUM)
                    .operation(BasicOperation.of(OperationType.RATE))
                    .build())
            .build();

    Assertions.assertThrows(
        InvalidGraphException.class,
        () -> service.render(graph, RANGE, List.of(), Resolution.auto()));
  }

  @Test
  public void testUnknownMetricAndGraph() {
    GraphDefinition graph =
        GraphDefinition.builder()
            .id("missing")
            .title("Missing")
            .series(SeriesDefinition.builder().metric("disk.used").build())
            .build();

    Assertions.assertThrows(
        InvalidGraphException.class,
        () -> service.render(graph, RANGE, List.of(), Resolution.auto()));
    Assertions.assertThrows(
        GraphNotFoundException.class, () -> service.render("nope", RANGE, List.of()));
  }

  private DataQuery capturedQuery() {
    ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
    verify(queryBuilder).build(captor.capture());
    return (DataQuery) captor.getValue();
  }
}
