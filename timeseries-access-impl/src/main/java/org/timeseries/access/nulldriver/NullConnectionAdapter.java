package org.timeseries.access.nulldriver;

import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/** Connected from construction until closed; every command succeeds with no data. */
public class NullConnectionAdapter extends AbstractConnectionAdapter {

  public NullConnectionAdapter() {
    super(ReconnectPolicy.NEVER);
    connect();
  }

  @Override
  protected boolean doConnect() {
    return true;
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    return CommandResponse.success("");
  }

  @Override
  protected void doClose() {}

  @Override
  protected String describe() {
    return "null backend";
  }
}
