package org.timeseries.access.rrd;

import java.io.IOException;
import java.util.List;

/** Starts external processes; replaced in tests. */
@FunctionalInterface
public interface ProcessLauncher {
  ProcessLauncher DEFAULT = command -> new ProcessBuilder(command).start();

  Process start(List<String> command) throws IOException;
}
