package org.timeseries.access.nulldriver;

import java.time.Clock;
import org.timeseries.access.api.capability.Capabilities;
import org.timeseries.access.api.driver.AbstractQueryBuilder;
import org.timeseries.access.api.query.DataQuery;
import org.timeseries.access.api.query.LabelQuery;
import org.timeseries.access.api.query.QueryType;
import org.timeseries.access.api.time.TimeRange;

public class NullQueryBuilder extends AbstractQueryBuilder<NullQuery> {

  public NullQueryBuilder(Capabilities capabilities, Clock clock) {
    super(capabilities, clock);
  }

  @Override
  protected NullQuery compileData(DataQuery query) {
    TimeRange.Resolved range = resolve(query.getTimeRange());
    return NullQuery.builder()
        .queryType(QueryType.DATA)
        .start(range.getStart())
        .end(range.getEnd())
        .resolution(query.getResolution())
        .build();
  }

  @Override
  protected NullQuery compileLabels(LabelQuery query) {
    return NullQuery.builder().queryType(QueryType.LABEL).labelKind(query.getKind()).build();
  }
}
