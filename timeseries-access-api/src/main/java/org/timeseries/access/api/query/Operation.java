package org.timeseries.access.api.query;

/**
 * One step of a stream's pipeline. The set of variants is closed: {@link BasicOperation}, {@link
 * MathOperation}, {@link QuantileOperation} and {@link LabelJoinOperation}. Compilers dispatch on
 * {@link #getType()}.
 */
public interface Operation {

  OperationType getType();
}
