package org.timeseries.access.rrd;

/** How commands reach rrdtool. */
public enum RrdMode {
  /** A new {@code rrdtool} process per command. */
  PROCESS,
  /** One long-lived {@code rrdtool -} process fed over stdin. */
  PERSISTENT,
  /** The rrdcached daemon over a unix or tcp socket. */
  RRDCACHED
}
