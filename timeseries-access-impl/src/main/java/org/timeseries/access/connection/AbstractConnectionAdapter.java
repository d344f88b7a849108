package org.timeseries.access.connection;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.NotConnectedException;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ConnectionAdapter;
import org.timeseries.access.api.connection.ReconnectPolicy;

/**
 * Connected/disconnected state machine shared by all adapters. Commands are serialized through a
 * single lock, so a transport sees at most one in-flight command.
 */
@Slf4j
public abstract class AbstractConnectionAdapter implements ConnectionAdapter {
  private final ReentrantLock lock = new ReentrantLock();
  private final ReconnectPolicy reconnectPolicy;
  private volatile boolean connected;

  protected AbstractConnectionAdapter(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = reconnectPolicy;
  }

  @Override
  public final boolean connect() {
    lock.lock();
    try {
      if (isConnected()) {
        return true;
      }
      boolean opened;
      try {
        opened = doConnect();
      } catch (RuntimeException e) {
        log.error("Unexpected failure connecting to {}", describe(), e);
        opened = false;
      }
      connected = opened;
      if (opened) {
        log.info("Connected to {}", describe());
      } else {
        log.warn("Unable to connect to {}", describe());
      }
      return opened;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public final CommandResponse executeCommand(String command, String data) {
    lock.lock();
    try {
      if (!isConnected()) {
        if (reconnectPolicy == ReconnectPolicy.NEVER) {
          throw new NotConnectedException("Not connected to " + describe());
        }
        log.debug("Reconnecting to {} before '{}'", describe(), command);
        if (!connect()) {
          throw new NotConnectedException("Reconnect to " + describe() + " failed");
        }
      }
      log.debug("Executing '{}' on {}", command, describe());
      try {
        return doExecute(command, data == null ? "" : data);
      } catch (RuntimeException e) {
        log.error("Command '{}' failed on {}", command, describe(), e);
        return CommandResponse.failure(
            e.getMessage(), Map.of("exception", e.getClass().getName()));
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  @Override
  public final void close() {
    lock.lock();
    try {
      if (!connected) {
        return;
      }
      try {
        doClose();
      } catch (RuntimeException e) {
        log.warn("Error while closing {}", describe(), e);
      } finally {
        connected = false;
      }
      log.info("Closed connection to {}", describe());
    } finally {
      lock.unlock();
    }
  }

  /** Called by subclasses when the transport is no longer usable. */
  protected void markDisconnected() {
    connected = false;
  }

  protected abstract boolean doConnect();

  /** Runs one command on an open transport. Only called while holding the command lock. */
  protected abstract CommandResponse doExecute(String command, String data);

  protected abstract void doClose();

  /** Short human-readable target, for log lines and errors. */
  protected abstract String describe();
}
