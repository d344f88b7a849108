package org.timeseries.access.rrd;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.data.TimeSeries;
import org.timeseries.access.api.labels.LabelFilter;
import org.timeseries.access.api.metric.MetricIdentifier;
import org.timeseries.access.api.metric.MetricType;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.DataQueryBuilder;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.api.time.TimeRange;

public class RrdDriverTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-01T01:00:00Z"), ZoneOffset.UTC);
  private static final String LIST = RrdCommandType.LIST.getCommand();
  private static final String XPORT = RrdCommandType.XPORT.getCommand();
  private static final String CREATE = RrdCommandType.CREATE.getCommand();
  private static final String UPDATE = RrdCommandType.UPDATE.getCommand();

  private final RrdConfig config = RrdConfig.builder().directory(Path.of("/var/rrd")).build();
  private ConnectionAdapter adapter;
  private RrdDriver driver;

  @BeforeEach
  public void setUp() {
    adapter = mock(ConnectionAdapter.class);
    when(adapter.isConnected()).thenReturn(true);
    driver = new RrdDriver(config, adapter, CLOCK);
  }

  @Test
  public void testMatchingFilesAreExportedAsOneSeries() throws IOException {
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(CommandResponse.success("host=a.rrd\nhost=a,if=eth0.rrd\nhost=b.rrd\n"));
    when(adapter.executeCommand(eq(XPORT), anyString()))
        .thenReturn(CommandResponse.success(read("rrd_xport.json")));

    Result result = driver.query(driver.getQueryBuilder().build(bytesForHostA()));

    Assertions.assertTrue(result.isSuccess());
    List<TimeSeries> series = ((TimeSeriesResult) result).getSeries();
    Assertions.assertEquals(1, series.size());
    Assertions.assertEquals("net.bytes", series.get(0).getMetric());
    Assertions.assertEquals(Optional.of("bits"), series.get(0).getAlias());
    Assertions.assertEquals(Map.of("host", "a"), series.get(0).getLabels());
    Assertions.assertEquals(3, series.get(0).getPoints().size());
    verify(adapter)
        .executeCommand(
            eq(XPORT),
            argThat(
                data ->
                    data.contains("DEF:s0f1=/var/rrd/net/bytes/host=a,if=eth0.rrd:value:AVERAGE")
                        && data.contains("s0f0,s0f1,ADDNAN")
                        && !data.contains("host=b")));
  }

  @Test
  public void testNoMatchingFilesGivesEmptyResult() {
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(CommandResponse.success("host=b.rrd\n"));

    Result result = driver.query(driver.getQueryBuilder().build(bytesForHostA()));

    Assertions.assertTrue(result.isSuccess());
    Assertions.assertFalse(result.hasData());
    verify(adapter, never()).executeCommand(eq(XPORT), anyString());
  }

  @Test
  public void testFilesOfNestedMetricsAreNotPartOfStream() {
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(
            CommandResponse.success("bytes/host=a.rrd\n/var/rrd/net/packets/_default.rrd\n"));

    Result result =
        driver.query(
            driver
                .getQueryBuilder()
                .build(DataQueryBuilder.forPeriod(TimeRange.lastHours(1)).select("net").build()));

    Assertions.assertTrue(result.isSuccess());
    Assertions.assertFalse(result.hasData());
    verify(adapter).executeCommand(LIST, "[\"--recursive\",\"/var/rrd/net\"]");
    verify(adapter, never()).executeCommand(eq(XPORT), anyString());
  }

  @Test
  public void testLabelValuesAreMatchedAsWritten() throws IOException {
    when(adapter.executeCommand(eq(CREATE), anyString())).thenReturn(CommandResponse.success(""));
    when(adapter.executeCommand(eq(UPDATE), anyString())).thenReturn(CommandResponse.success(""));
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(CommandResponse.success("host=a_b.rrd\nhost=a.rrd\n"));
    when(adapter.executeCommand(eq(XPORT), anyString()))
        .thenReturn(CommandResponse.success(read("rrd_xport.json")));

    driver.write(
        MetricSample.builder()
            .metric(MetricIdentifier.of("net", "bytes"))
            .label("host", "a b")
            .value(1)
            .timestamp(Instant.ofEpochSecond(1704067200L))
            .build());
    Result result =
        driver.query(
            driver
                .getQueryBuilder()
                .build(
                    DataQueryBuilder.forPeriod(TimeRange.lastHours(1))
                        .select(MetricIdentifier.of("net", "bytes"), s -> s.where("host", "a b"))
                        .build()));

    verify(adapter)
        .executeCommand(UPDATE, "[\"/var/rrd/net/bytes/host=a_b.rrd\",\"1704067200:1\"]");
    Assertions.assertTrue(result.isSuccess());
    Assertions.assertEquals(
        Map.of("host", "a_b"), ((TimeSeriesResult) result).getSeries().get(0).getLabels());
    verify(adapter)
        .executeCommand(
            eq(XPORT),
            argThat(data -> data.contains("host=a_b.rrd") && !data.contains("host=a.rrd")));
  }

  @Test
  public void testFailedListingFailsQuery() {
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(CommandResponse.failure("opening '/var/rrd/net': No such file"));

    Result result = driver.query(driver.getQueryBuilder().build(bytesForHostA()));

    Assertions.assertTrue(result.getError().orElseThrow().contains("No such file"));
    Assertions.assertEquals(
        Instant.parse("2024-01-01T00:00:00Z"), ((TimeSeriesResult) result).getStart());
  }

  @Test
  public void testLabelDiscoveryFromListing() {
    when(adapter.executeCommand(eq(LIST), anyString()))
        .thenReturn(
            CommandResponse.success(
                "/var/rrd/net/bytes/host=a,if=eth0.rrd\n"
                    + "/var/rrd/net/bytes/host=b.rrd\n"
                    + "/var/rrd/load/_default.rrd\n"
                    + "/var/rrd/stray.rrd\n"
                    + "README\n"));

    LabelResult metrics =
        (LabelResult) driver.query(driver.getQueryBuilder().build(LabelQuery.metricNames()));
    LabelResult names =
        (LabelResult)
            driver.query(
                driver
                    .getQueryBuilder()
                    .build(LabelQuery.labelNames(List.of(MetricIdentifier.of("net", "bytes")))));
    LabelResult values =
        (LabelResult)
            driver.query(
                driver
                    .getQueryBuilder()
                    .build(
                        LabelQuery.labelValues("host", List.of())
                            .withFilter(LabelFilter.match("if", "eth0"))));

    Assertions.assertEquals(List.of("load", "net.bytes"), metrics.getValues());
    Assertions.assertEquals(List.of("host", "if"), names.getValues());
    Assertions.assertEquals(List.of("a"), values.getValues());
  }

  @Test
  public void testWriteCreatesThenUpdates() {
    when(adapter.executeCommand(eq(CREATE), anyString()))
        .thenReturn(CommandResponse.failure("RRD file '/var/rrd/load/_default.rrd' exists"));
    when(adapter.executeCommand(eq(UPDATE), anyString())).thenReturn(CommandResponse.success(""));

    WriteResult result =
        driver.write(
            MetricSample.builder()
                .metric(MetricIdentifier.named("load"))
                .value(0.5)
                .timestamp(Instant.ofEpochSecond(1704067200L))
                .build());

    Assertions.assertTrue(result.isSuccess());
    Assertions.assertEquals(1, result.getWritten());
    verify(adapter)
        .executeCommand(UPDATE, "[\"/var/rrd/load/_default.rrd\",\"1704067200:0.5\"]");
  }

  @Test
  public void testFailedCreateStopsBatch() {
    when(adapter.executeCommand(eq(CREATE), anyString()))
        .thenReturn(CommandResponse.failure("permission denied"));

    WriteResult result =
        driver.write(
            MetricSample.builder()
                .metric(MetricIdentifier.named("load"))
                .value(1)
                .timestamp(Instant.ofEpochSecond(1704067200L))
                .build());

    Assertions.assertEquals(Optional.of("permission denied"), result.getError());
    verify(adapter, never()).executeCommand(eq(UPDATE), anyString());
  }

  @Test
  public void testFailureMidBatchReportsSamplesAlreadyWritten() {
    when(adapter.executeCommand(eq(CREATE), anyString())).thenReturn(CommandResponse.success(""));
    when(adapter.executeCommand(eq(UPDATE), anyString()))
        .thenReturn(CommandResponse.success(""))
        .thenReturn(CommandResponse.failure("illegal attempt to update using time 1704067200"));
    MetricSample first =
        MetricSample.builder()
            .metric(MetricIdentifier.named("load"))
            .value(1)
            .timestamp(Instant.ofEpochSecond(1704067200L))
            .build();

    WriteResult result =
        driver.writeBatch(
            List.of(
                first,
                first.toBuilder().label("host", "b").build(),
                first.toBuilder().label("host", "c").build()));

    Assertions.assertFalse(result.isSuccess());
    Assertions.assertEquals(1, result.getWritten());
    Assertions.assertTrue(result.getError().orElseThrow().contains("illegal attempt"));
  }

  @Test
  public void testCreateUsesDefaultRetention() {
    MetricIdentifier counter =
        MetricIdentifier.builder().namespace("net").name("bytes").type(MetricType.COUNTER).build();

    RrdCommand create = driver.create(Path.of("/var/rrd/net/bytes/_default.rrd"), counter);

    List<String> argv = create.argv();
    Assertions.assertEquals("/var/rrd/net/bytes/_default.rrd", argv.get(0));
    Assertions.assertEquals(List.of("--step", "300", "--no-overwrite"), argv.subList(1, 4));
    Assertions.assertEquals("DS:value:COUNTER:600:U:U", argv.get(4));
    Assertions.assertEquals("RRA:AVERAGE:0.5:1:2016", argv.get(5));
    Assertions.assertEquals("RRA:AVERAGE:0.5:12:1488", argv.get(6));
    Assertions.assertEquals("RRA:AVERAGE:0.5:288:366", argv.get(7));
    Assertions.assertEquals(5 + 4 * 3, argv.size());
  }

  @Test
  public void testUpdateValues() {
    MetricIdentifier counter =
        MetricIdentifier.builder().name("c").type(MetricType.COUNTER).build();
    MetricSample sample =
        MetricSample.builder()
            .metric(counter)
            .value(42)
            .timestamp(Instant.ofEpochSecond(100))
            .build();
    Path file = Path.of("/var/rrd/c/_default.rrd");

    Assertions.assertEquals("100:42", RrdDriver.update(file, sample).getArguments().get(0));
    Assertions.assertEquals(
        "100:U",
        RrdDriver.update(file, sample.toBuilder().value(Double.NaN).build())
            .getArguments()
            .get(0));
    Assertions.assertEquals(
        "100:2.25",
        RrdDriver.update(file, sample.toBuilder().value(2.25).build()).getArguments().get(0));
  }

  private static DataQuery bytesForHostA() {
    return DataQueryBuilder.forPeriod(TimeRange.lastHours(1))
        .select(MetricIdentifier.of("net", "bytes"), s -> s.where("host", "a").as("bits"))
        .build();
  }

  private String read(String fileName) throws IOException {
    URL fileUrl = RrdDriverTest.class.getClassLoader().getResource(fileName);
    return new String(Files.readAllBytes(Paths.get(fileUrl.getFile())));
  }
}
