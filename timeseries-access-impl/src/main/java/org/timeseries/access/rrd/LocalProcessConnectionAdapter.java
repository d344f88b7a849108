package org.timeseries.access.rrd;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/** Runs each command as its own {@code rrdtool <command> <args...>} process. */
@Slf4j
public class LocalProcessConnectionAdapter extends AbstractConnectionAdapter {
  private final RrdConfig config;
  private final ProcessLauncher launcher;

  public LocalProcessConnectionAdapter(RrdConfig config, ProcessLauncher launcher) {
    super(ReconnectPolicy.NEVER);
    this.config = config;
    this.launcher = launcher;
  }

  @Override
  protected boolean doConnect() {
    return RrdFiles.ensureDirectory(config.getDirectory());
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    List<String> args = RrdCommand.decodeArgv(data);
    if (RrdCommandType.CREATE.getCommand().equals(command) && !args.isEmpty()) {
      RrdFiles.ensureParent(Path.of(args.get(0)));
    }
    List<String> invocation = new ArrayList<>();
    invocation.add(config.getRrdtool());
    invocation.add(command);
    invocation.addAll(args);

    Process process;
    try {
      process = launcher.start(invocation);
    } catch (IOException e) {
      return CommandResponse.failure(
          "Unable to start " + config.getRrdtool() + ": " + e.getMessage(),
          Map.of("command", command, "exception", e.getClass().getName()));
    }
    CompletableFuture<String> stdout = read(process.getInputStream());
    CompletableFuture<String> stderr = read(process.getErrorStream());
    try {
      if (!process.waitFor(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        return CommandResponse.failure(
            "rrdtool " + command + " timed out after " + config.getTimeout(),
            Map.of("command", command));
      }
      String output = stdout.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
      String error = stderr.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        return CommandResponse.failure(
            (error.isBlank() ? output : error).trim(),
            Map.of("command", command, "exit_code", exitCode));
      }
      return CommandResponse.success(output, Map.of("command", command, "exit_code", exitCode));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      return CommandResponse.failure("Interrupted while running rrdtool " + command);
    } catch (ExecutionException | TimeoutException e) {
      process.destroyForcibly();
      return CommandResponse.failure(
          "Unable to read rrdtool output: " + e.getMessage(), Map.of("command", command));
    }
  }

  private static CompletableFuture<String> read(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
  }

  @Override
  protected void doClose() {}

  @Override
  protected String describe() {
    return "rrdtool (" + config.getRrdtool() + ") in " + config.getDirectory();
  }
}
