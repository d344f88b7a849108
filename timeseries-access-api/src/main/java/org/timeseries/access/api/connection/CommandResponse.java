package org.timeseries.access.api.connection;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

/** Outcome of a single adapter command. An error is present exactly when the command failed. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandResponse {
  boolean success;
  String data;
  Map<String, Object> metadata;

  @Getter(AccessLevel.NONE)
  String error;

  public static CommandResponse success(String data) {
    return success(data, Map.of());
  }

  public static CommandResponse success(String data, Map<String, ?> metadata) {
    return new CommandResponse(true, data == null ? "" : data, copy(metadata), null);
  }

  public static CommandResponse failure(String error) {
    return failure(error, Map.of());
  }

  public static CommandResponse failure(String error, Map<String, ?> metadata) {
    return new CommandResponse(
        false, "", copy(metadata), error == null || error.isEmpty() ? "Unknown error" : error);
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  private static Map<String, Object> copy(Map<String, ?> metadata) {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    if (metadata != null) {
      metadata.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              builder.put(key, value);
            }
          });
    }
    return builder.build();
  }
}
