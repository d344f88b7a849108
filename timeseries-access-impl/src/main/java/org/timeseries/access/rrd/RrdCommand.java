package org.timeseries.access.rrd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.timeseries.access.api.ValidationException;

/**
 * One rrdtool invocation. The argument vector is the optional target file, then options in
 * declaration order, then positional arguments.
 */
@Value
@Builder(toBuilder = true)
public class RrdCommand {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> ARGV_TYPE = new TypeReference<>() {};

  @NonNull RrdCommandType type;
  String target;
  @Singular List<String> options;
  @Singular List<String> arguments;

  public List<String> argv() {
    List<String> argv = new ArrayList<>();
    if (target != null) {
      argv.add(target);
    }
    argv.addAll(options);
    argv.addAll(arguments);
    return argv;
  }

  /** Single-line form, as sent to {@code rrdtool -}. */
  public String toLine() {
    List<String> parts = new ArrayList<>();
    parts.add(type.getCommand());
    argv().stream().map(RrdCommand::quote).forEach(parts::add);
    return String.join(" ", parts);
  }

  /** Argument vector as the JSON array carried in adapter command data. */
  public String toData() {
    return encodeArgv(argv());
  }

  public static String encodeArgv(List<String> argv) {
    try {
      return OBJECT_MAPPER.writeValueAsString(argv);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode rrdtool arguments", e);
    }
  }

  /**
   * @throws ValidationException if {@code data} is not a JSON array of strings
   */
  public static List<String> decodeArgv(String data) {
    if (data == null || data.isBlank()) {
      return List.of();
    }
    try {
      return OBJECT_MAPPER.readValue(data, ARGV_TYPE);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Invalid command arguments: expected JSON array", e);
    }
  }

  static String quote(String argument) {
    if (!argument.isEmpty() && argument.chars().noneMatch(c -> c == ' ' || c == '"')) {
      return argument;
    }
    return '"' + argument.replace("\"", "\\\"") + '"';
  }

  @Override
  public String toString() {
    return argv().stream().collect(Collectors.joining(" ", type.getCommand() + " ", ""));
  }
}
