package org.timeseries.access.api.query;

/** Backend-agnostic query tree; either a {@link DataQuery} or a {@link LabelQuery}. */
public interface Query {

  QueryType getQueryType();
}
