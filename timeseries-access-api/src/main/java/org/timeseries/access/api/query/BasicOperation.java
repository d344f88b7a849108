package org.timeseries.access.api.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/** An operation without operands. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BasicOperation implements Operation {
  private static final BasicOperation RATE = new BasicOperation(OperationType.RATE);
  private static final BasicOperation DELTA = new BasicOperation(OperationType.DELTA);

  OperationType type;

  public static BasicOperation of(OperationType type) {
    if (type == null) {
      throw new ValidationException("Operation type is required");
    }
    switch (type) {
      case RATE:
        return RATE;
      case DELTA:
        return DELTA;
      default:
        throw new ValidationException("Operation " + type + " requires operands");
    }
  }

  public static BasicOperation rate() {
    return RATE;
  }

  public static BasicOperation delta() {
    return DELTA;
  }
}
