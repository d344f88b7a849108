package org.timeseries.access.api.connection;

/**
 * Transport-neutral session with a backend. An adapter is either connected or disconnected;
 * commands are only accepted while connected, subject to {@link #getReconnectPolicy()}.
 */
public interface ConnectionAdapter extends AutoCloseable {

  /** Opens the session. Returns {@code false} when the backend cannot be reached. */
  boolean connect();

  /** Current state, without side effects. */
  boolean isConnected();

  /**
   * Runs one command. Transport failures are reported as a failed response rather than thrown.
   *
   * @throws org.timeseries.access.api.NotConnectedException if disconnected and reconnecting is
   *     not allowed or does not succeed
   */
  CommandResponse executeCommand(String command, String data);

  ReconnectPolicy getReconnectPolicy();

  @Override
  void close();
}
