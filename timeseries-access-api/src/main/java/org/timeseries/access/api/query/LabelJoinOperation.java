package org.timeseries.access.api.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/** Writes the concatenation of several label values into a target label. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LabelJoinOperation implements Operation {
  String targetLabel;
  String separator;
  List<String> sourceLabels;

  public static LabelJoinOperation of(String targetLabel, String separator, List<String> sources) {
    if (targetLabel == null || targetLabel.isBlank()) {
      throw new ValidationException("Label join target is required");
    }
    if (sources == null || sources.isEmpty()) {
      throw new ValidationException("Label join needs at least one source label");
    }
    return new LabelJoinOperation(
        targetLabel, separator == null ? "" : separator, ImmutableList.copyOf(sources));
  }

  @Override
  public OperationType getType() {
    return OperationType.LABEL_JOIN;
  }
}
