package org.timeseries.access.api.connection;

/** What an adapter does when a command arrives while it is disconnected. */
public enum ReconnectPolicy {
  /** Fail with {@link org.timeseries.access.api.NotConnectedException}. */
  NEVER,
  /** Attempt a single {@code connect()} and fail if it does not succeed. */
  ONCE
}
