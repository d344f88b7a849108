package org.timeseries.access.influxdb;

import java.time.Clock;
import java.util.List;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.data.MetricSample;
import org.timeseries.access.api.query.LabelQueryKind;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.result.LabelResult;
import org.timeseries.access.api.result.Result;
import org.timeseries.access.api.result.TimeSeriesResult;
import org.timeseries.access.api.result.WriteResult;
import org.timeseries.access.driver.AbstractDriver;

public class InfluxDbDriver extends AbstractDriver<InfluxQuery> {
  public static final String NAME = "influxdb";
  public static final Capabilities CAPABILITIES = Capabilities.all();

  private final InfluxResponseParser parser;
  private final LineProtocolFormatter formatter;

  public InfluxDbDriver(InfluxDbConfig config, Clock clock) {
    this(config, new InfluxHttpConnectionAdapter(config), clock);
  }

  public InfluxDbDriver(InfluxDbConfig config, ConnectionAdapter adapter, Clock clock) {
    super(
        NAME,
        CAPABILITIES,
        adapter,
        new InfluxQueryBuilder(config, CAPABILITIES, clock),
        InfluxQuery.class);
    this.parser = new InfluxResponseParser(config.getFieldStrategy());
    this.formatter = new LineProtocolFormatter(config.getFieldStrategy(), config.getPrecision());
  }

  @Override
  protected Result execute(InfluxQuery query) {
    return handleResponse(
        query,
        getAdapter().executeCommand(InfluxHttpConnectionAdapter.COMMAND_QUERY, query.getFlux()),
        csv -> {
          if (query.getQueryType() == QueryType.DATA) {
            return TimeSeriesResult.of(
                parser.parseSeries(csv, query.getAliases()),
                query.getStart(),
                query.getEnd(),
                query.getResolution());
          }
          LabelQueryKind kind = query.getLabelKind().orElseThrow();
          return LabelResult.of(
              kind, parser.parseValues(csv, kind == LabelQueryKind.LABEL_NAMES));
        });
  }

  @Override
  protected Result failure(InfluxQuery query, String error) {
    if (query.getQueryType() == QueryType.DATA) {
      return TimeSeriesResult.failure(
          error, query.getStart(), query.getEnd(), query.getResolution());
    }
    return LabelResult.failure(query.getLabelKind().orElseThrow(), error);
  }

  @Override
  protected WriteResult doWrite(List<MetricSample> samples) {
    return handleWriteResponse(
        getAdapter()
            .executeCommand(InfluxHttpConnectionAdapter.COMMAND_WRITE, formatter.format(samples)),
        samples.size());
  }
}
