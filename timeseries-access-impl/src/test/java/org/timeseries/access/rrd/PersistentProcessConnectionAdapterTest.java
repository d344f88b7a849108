package org.timeseries.access.rrd;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.connection.RetryPolicy;

public class PersistentProcessConnectionAdapterTest {
  @TempDir Path directory;

  @Test
  public void testCommandsShareOneProcess() {
    FakeProcess process =
        FakeProcess.running(
            "a.rrd\nb.rrd\nOK u:0.00 s:0.00 r:0.00\n"
                + "ERROR: opening 'x.rrd': No such file or directory\n");
    List<List<String>> invocations = new ArrayList<>();
    PersistentProcessConnectionAdapter adapter =
        new PersistentProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).retryPolicy(RetryPolicy.noRetry()).build(),
            command -> {
              invocations.add(command);
              return process;
            });

    CommandResponse listing = adapter.executeCommand("list", "[\"--recursive\",\"/var/rrd\"]");
    CommandResponse info = adapter.executeCommand("info", "[\"x.rrd\"]");

    Assertions.assertEquals("a.rrd\nb.rrd", listing.getData());
    Assertions.assertEquals(
        "opening 'x.rrd': No such file or directory", info.getError().orElseThrow());
    Assertions.assertEquals(List.of(List.of("rrdtool", "-")), invocations);
    Assertions.assertEquals("list --recursive /var/rrd\ninfo x.rrd\n", process.written());

    adapter.close();
    Assertions.assertFalse(adapter.isConnected());
    Assertions.assertTrue(process.written().endsWith("quit\n"));
  }

  @Test
  public void testArgumentsWithSpacesAreQuoted() {
    FakeProcess process = FakeProcess.running("OK u:0.00\n");
    PersistentProcessConnectionAdapter adapter =
        new PersistentProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).retryPolicy(RetryPolicy.noRetry()).build(),
            command -> process);

    adapter.executeCommand("info", RrdCommand.encodeArgv(List.of("/var/rrd/my file.rrd")));

    Assertions.assertEquals("info \"/var/rrd/my file.rrd\"\n", process.written());
  }

  @Test
  public void testClosedOutputDisconnects() {
    PersistentProcessConnectionAdapter adapter =
        new PersistentProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).retryPolicy(RetryPolicy.noRetry()).build(),
            command -> FakeProcess.running("partial\n"));

    CommandResponse response = adapter.executeCommand("list", "[]");

    Assertions.assertTrue(response.getError().orElseThrow().contains("closed its output"));
    Assertions.assertFalse(adapter.isConnected());
  }
}
