package org.timeseries.access.api.result;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WriteResult {
  int written;

  @Getter(AccessLevel.NONE)
  String error;

  public static WriteResult success(int written) {
    return new WriteResult(written, null);
  }

  public static WriteResult failure(String error) {
    return new WriteResult(0, error);
  }

  /** A failed write that still persisted the first {@code written} samples. */
  public static WriteResult partial(String error, int written) {
    return new WriteResult(written, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }
}
