package org.timeseries.access.api.query;

import org.timeseries.access.api.ValidationException;

public enum MathOperator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/");

  private final String symbol;

  MathOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public static MathOperator fromSymbol(String symbol) {
    for (MathOperator operator : values()) {
      if (operator.symbol.equals(symbol) || operator.name().equalsIgnoreCase(symbol)) {
        return operator;
      }
    }
    throw new ValidationException("Unknown math operator: " + symbol);
  }
}
