package org.timeseries.access.rrd;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/**
 * Keeps one {@code rrdtool -} process and feeds it a command per line. Each answer ends with a
 * line starting with {@code OK} or {@code ERROR:}.
 */
@Slf4j
public class PersistentProcessConnectionAdapter extends AbstractConnectionAdapter {
  private final RrdConfig config;
  private final ProcessLauncher launcher;

  private Process process;
  private Writer input;
  private BufferedReader output;
  private ExecutorService reader;

  public PersistentProcessConnectionAdapter(RrdConfig config, ProcessLauncher launcher) {
    super(ReconnectPolicy.ONCE);
    this.config = config;
    this.launcher = launcher;
  }

  @Override
  protected boolean doConnect() {
    if (!RrdFiles.ensureDirectory(config.getDirectory())) {
      return false;
    }
    return config.getRetryPolicy().run("Start " + config.getRrdtool() + " -", this::start);
  }

  private boolean start() {
    shutdown();
    try {
      process = launcher.start(List.of(config.getRrdtool(), "-"));
    } catch (IOException e) {
      log.debug("Unable to start {}: {}", config.getRrdtool(), e.getMessage());
      return false;
    }
    if (!process.isAlive()) {
      return false;
    }
    input = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
    output =
        new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    reader =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("rrdtool-reader-%d").build());
    return true;
  }

  @Override
  public boolean isConnected() {
    return super.isConnected() && process != null && process.isAlive();
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    List<String> args = RrdCommand.decodeArgv(data);
    if (RrdCommandType.CREATE.getCommand().equals(command) && !args.isEmpty()) {
      RrdFiles.ensureParent(Path.of(args.get(0)));
    }
    String line =
        args.stream()
            .map(RrdCommand::quote)
            .collect(Collectors.joining(" ", command + (args.isEmpty() ? "" : " "), "\n"));
    try {
      input.write(line);
      input.flush();
    } catch (IOException e) {
      terminate();
      return CommandResponse.failure(
          "Unable to write to rrdtool: " + e.getMessage(),
          Map.of("command", command, "exception", e.getClass().getName()));
    }

    Future<Answer> answer = reader.submit(this::readAnswer);
    try {
      Answer result = answer.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (result.error != null) {
        return CommandResponse.failure(result.error, Map.of("command", command));
      }
      return CommandResponse.success(result.output, Map.of("command", command));
    } catch (TimeoutException e) {
      answer.cancel(true);
      terminate();
      return CommandResponse.failure(
          "rrdtool " + command + " timed out after " + config.getTimeout(),
          Map.of("command", command));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      terminate();
      return CommandResponse.failure("Interrupted while running rrdtool " + command);
    } catch (ExecutionException e) {
      terminate();
      return CommandResponse.failure(
          "Unable to read rrdtool output: " + e.getCause().getMessage(),
          Map.of("command", command, "exception", e.getCause().getClass().getName()));
    }
  }

  private Answer readAnswer() throws IOException {
    List<String> lines = new ArrayList<>();
    String line;
    while ((line = output.readLine()) != null) {
      if (line.startsWith("OK")) {
        return new Answer(String.join("\n", lines), null);
      }
      if (line.startsWith("ERROR:")) {
        return new Answer("", line.substring("ERROR:".length()).trim());
      }
      lines.add(line);
    }
    throw new IOException("rrdtool process closed its output");
  }

  /** Kills the process; the adapter reconnects on the next command. */
  private void terminate() {
    markDisconnected();
    shutdown();
  }

  private void shutdown() {
    if (reader != null) {
      reader.shutdownNow();
    }
    if (process != null) {
      process.destroyForcibly();
    }
    process = null;
    input = null;
    output = null;
    reader = null;
  }

  @Override
  protected void doClose() {
    if (input != null) {
      try {
        input.write("quit\n");
        input.flush();
      } catch (IOException e) {
        log.debug("rrdtool process already gone: {}", e.getMessage());
      }
    }
    shutdown();
  }

  @Override
  protected String describe() {
    return "persistent rrdtool (" + config.getRrdtool() + ") in " + config.getDirectory();
  }

  private static class Answer {
    private final String output;
    private final String error;

    private Answer(String output, String error) {
      this.output = output;
      this.error = error;
    }
  }
}
