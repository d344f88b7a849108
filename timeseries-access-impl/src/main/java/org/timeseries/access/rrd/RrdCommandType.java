package org.timeseries.access.rrd;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import org.timeseries.access.api.ValidationException;

public enum RrdCommandType {
  CREATE,
  LIST,
  UPDATE,
  INFO,
  XPORT,
  DUMP,
  FETCH,
  GRAPH,
  LAST,
  FIRST,
  TUNE,
  RESIZE,
  FLUSHCACHED;

  /** Commands the rrdcached daemon understands. */
  public static final Set<RrdCommandType> RRDCACHED_SUPPORTED =
      Collections.unmodifiableSet(
          EnumSet.of(CREATE, UPDATE, FETCH, INFO, FIRST, LAST, LIST, FLUSHCACHED));

  /** The rrdtool sub-command name. */
  public String getCommand() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RrdCommandType fromCommand(String command) {
    for (RrdCommandType type : values()) {
      if (type.getCommand().equalsIgnoreCase(command)) {
        return type;
      }
    }
    throw new ValidationException("Unknown rrdtool command: " + command);
  }
}
