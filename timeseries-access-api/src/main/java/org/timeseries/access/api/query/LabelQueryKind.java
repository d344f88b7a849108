package org.timeseries.access.api.query;

public enum LabelQueryKind {
  METRIC_NAMES,
  LABEL_NAMES,
  LABEL_VALUES
}
