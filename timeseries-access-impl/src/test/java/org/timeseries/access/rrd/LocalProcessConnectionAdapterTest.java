package org.timeseries.access.rrd;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timeseries.access.api.NotConnectedException;
import org.timeseries.access.api.connection.CommandResponse;

public class LocalProcessConnectionAdapterTest {
  @TempDir Path directory;

  @Test
  public void testCommandRunsAsRrdtoolProcess() {
    List<List<String>> invocations = new ArrayList<>();
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).rrdtool("/usr/bin/rrdtool").build(),
            command -> {
              invocations.add(command);
              return FakeProcess.exited("a.rrd\n", "", 0);
            });

    Assertions.assertTrue(adapter.connect());
    CommandResponse response = adapter.executeCommand("list", "[\"--recursive\",\"/var/rrd\"]");

    Assertions.assertTrue(response.isSuccess());
    Assertions.assertEquals("a.rrd\n", response.getData());
    Assertions.assertEquals(0, response.getMetadata().get("exit_code"));
    Assertions.assertEquals(
        List.of(List.of("/usr/bin/rrdtool", "list", "--recursive", "/var/rrd")), invocations);
  }

  @Test
  public void testNonZeroExitReportsStderr() {
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).build(),
            command -> FakeProcess.exited("", "ERROR: opening 'x.rrd': No such file\n", 1));
    adapter.connect();

    CommandResponse response = adapter.executeCommand("info", "[\"x.rrd\"]");

    Assertions.assertEquals(
        "ERROR: opening 'x.rrd': No such file", response.getError().orElseThrow());
    Assertions.assertEquals(1, response.getMetadata().get("exit_code"));
  }

  @Test
  public void testCreatePreparesParentDirectory() {
    Path file = directory.resolve("net").resolve("bytes").resolve("_default.rrd");
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).build(),
            command -> FakeProcess.exited("", "", 0));
    adapter.connect();

    adapter.executeCommand("create", RrdCommand.encodeArgv(List.of(file.toString())));

    Assertions.assertTrue(Files.isDirectory(file.getParent()));
  }

  @Test
  public void testMissingBinaryFailsCommand() {
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).rrdtool("missing-rrdtool").build(),
            command -> {
              throw new IOException("No such file or directory");
            });
    adapter.connect();

    CommandResponse response = adapter.executeCommand("list", "[]");

    Assertions.assertTrue(
        response.getError().orElseThrow().startsWith("Unable to start missing-rrdtool"));
  }

  @Test
  public void testCommandsNeedExplicitConnect() {
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).build(),
            command -> FakeProcess.exited("", "", 0));

    Assertions.assertThrows(
        NotConnectedException.class, () -> adapter.executeCommand("list", "[]"));
  }

  @Test
  public void testInvalidArgumentsAreReportedAsFailure() {
    LocalProcessConnectionAdapter adapter =
        new LocalProcessConnectionAdapter(
            RrdConfig.builder().directory(directory).build(),
            command -> FakeProcess.exited("", "", 0));
    adapter.connect();

    CommandResponse response = adapter.executeCommand("list", "not json");

    Assertions.assertFalse(response.isSuccess());
    Assertions.assertTrue(response.getError().orElseThrow().contains("expected JSON array"));
  }
}
