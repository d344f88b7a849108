package org.timeseries.access;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import org.timeseries.access.api.ConfigurationException;

public class ConfigUtils {

  public static <T> Optional<T> optionallyGet(
      Config config, String path, BiFunction<Config, String, T> getter) {
    return config.hasPath(path)
        ? Optional.ofNullable(getter.apply(config, path))
        : Optional.empty();
  }

  public static String getString(Config config, String path, String defaultValue) {
    return optionallyGet(config, path, Config::getString).orElse(defaultValue);
  }

  public static int getInt(Config config, String path, int defaultValue) {
    return optionallyGet(config, path, Config::getInt).orElse(defaultValue);
  }

  public static Duration getDuration(Config config, String path, Duration defaultValue) {
    return optionallyGet(config, path, Config::getDuration).orElse(defaultValue);
  }

  /**
   * Reads an enum constant by name, ignoring case, so {@code mode = persistent} selects {@code
   * PERSISTENT}.
   *
   * @throws ConfigurationException if the value names no constant of {@code type}
   */
  public static <E extends Enum<E>> E getEnum(
      Config config, String path, Class<E> type, E defaultValue) {
    String value = getString(config, path, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
          "Invalid value '"
              + value
              + "' for '"
              + path
              + "', expected one of "
              + Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT),
          e);
    }
  }

  /**
   * @throws ConfigurationException if the path is absent or blank
   */
  public static String requireString(Config config, String path) {
    String value = optionallyGet(config, path, Config::getString).orElse("");
    if (value.isBlank()) {
      throw new ConfigurationException("Missing required setting '" + path + "'");
    }
    return value;
  }
}
