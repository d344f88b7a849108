package org.timeseries.access.api.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/** Applies {@code value <operator> operand} to every point. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MathOperation implements Operation {
  MathOperator operator;
  double value;

  public static MathOperation of(MathOperator operator, double value) {
    if (operator == null) {
      throw new ValidationException("Math operator is required");
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ValidationException("Math operand must be finite: " + value);
    }
    if (operator == MathOperator.DIVIDE && value == 0) {
      throw new ValidationException("Division by zero");
    }
    return new MathOperation(operator, value);
  }

  @Override
  public OperationType getType() {
    return OperationType.MATH;
  }
}
