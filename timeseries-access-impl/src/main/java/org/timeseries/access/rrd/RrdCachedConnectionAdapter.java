package org.timeseries.access.rrd;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.ValidationException;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/**
 * Talks to rrdcached over its line protocol. Every answer starts with {@code <n> <message>}; a
 * negative {@code n} is an error, otherwise {@code n} data lines follow.
 */
@Slf4j
public class RrdCachedConnectionAdapter extends AbstractConnectionAdapter {
  private static final Pattern STATUS_LINE = Pattern.compile("^(-?\\d+)\\s+(.*)$");

  private final RrdConfig config;
  private final SocketAddress address;

  private SocketChannel channel;
  private Writer input;
  private BufferedReader output;
  private ExecutorService reader;

  public RrdCachedConnectionAdapter(RrdConfig config) {
    super(ReconnectPolicy.ONCE);
    this.config = config;
    this.address = parseAddress(config.getRrdcachedAddress());
  }

  static SocketAddress parseAddress(String address) {
    if (address == null || address.isBlank()) {
      throw new ConfigurationException("rrdcached address is required");
    }
    if (address.startsWith("unix:")) {
      return UnixDomainSocketAddress.of(address.substring("unix:".length()));
    }
    String tcp = address.startsWith("tcp:") ? address.substring("tcp:".length()) : address;
    int separator = tcp.lastIndexOf(':');
    if (separator < 0) {
      return UnixDomainSocketAddress.of(address);
    }
    try {
      return InetSocketAddress.createUnresolved(
          tcp.substring(0, separator), Integer.parseInt(tcp.substring(separator + 1)));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid rrdcached address: " + address, e);
    }
  }

  @Override
  protected boolean doConnect() {
    return config.getRetryPolicy().run("Connect to rrdcached " + address, this::open);
  }

  private boolean open() {
    shutdown();
    try {
      if (address instanceof UnixDomainSocketAddress) {
        channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        channel.connect(address);
      } else {
        InetSocketAddress inet = (InetSocketAddress) address;
        channel = SocketChannel.open(new InetSocketAddress(inet.getHostString(), inet.getPort()));
      }
    } catch (IOException e) {
      log.debug("Unable to connect to rrdcached at {}: {}", address, e.getMessage());
      shutdown();
      return false;
    }
    input = new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8);
    output =
        new BufferedReader(
            new InputStreamReader(Channels.newInputStream(channel), StandardCharsets.UTF_8));
    reader =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("rrdcached-reader-%d")
                .build());
    CommandResponse pong = send("PING", "PING");
    if (!pong.isSuccess()) {
      log.debug("rrdcached at {} did not answer PING: {}", address, pong.getError().orElse(""));
      shutdown();
      return false;
    }
    return true;
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    RrdCommandType type;
    try {
      type = RrdCommandType.fromCommand(command);
    } catch (ValidationException e) {
      return CommandResponse.failure(e.getMessage());
    }
    if (!RrdCommandType.RRDCACHED_SUPPORTED.contains(type)) {
      return CommandResponse.failure(
          "Command '" + command + "' is not supported by rrdcached", Map.of("command", command));
    }
    return send(command, toProtocol(type, RrdCommand.decodeArgv(data)));
  }

  static String toProtocol(RrdCommandType type, List<String> args) {
    List<String> parts = new ArrayList<>();
    parts.add(
        type == RrdCommandType.FLUSHCACHED
            ? "FLUSH"
            : type.getCommand().toUpperCase(Locale.ROOT));
    for (String arg : args) {
      parts.add(option(type, arg));
    }
    return String.join(" ", parts);
  }

  /** rrdcached spells some rrdtool options differently. */
  private static String option(RrdCommandType type, String arg) {
    if (type == RrdCommandType.LIST && "--recursive".equals(arg)) {
      return "RECURSIVE";
    }
    if (type == RrdCommandType.CREATE) {
      if ("--step".equals(arg)) {
        return "-s";
      }
      if ("--no-overwrite".equals(arg)) {
        return "-O";
      }
    }
    return arg;
  }

  private CommandResponse send(String command, String line) {
    try {
      input.write(line + "\n");
      input.flush();
    } catch (IOException e) {
      terminate();
      return CommandResponse.failure(
          "Unable to write to rrdcached: " + e.getMessage(),
          Map.of("command", command, "exception", e.getClass().getName()));
    }
    Future<CommandResponse> answer = reader.submit(() -> readAnswer(command, line));
    try {
      return answer.get(config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      answer.cancel(true);
      terminate();
      return CommandResponse.failure(
          "rrdcached " + command + " timed out after " + config.getTimeout(),
          Map.of("command", command));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      terminate();
      return CommandResponse.failure("Interrupted while waiting for rrdcached");
    } catch (ExecutionException e) {
      terminate();
      return CommandResponse.failure(
          "Unable to read rrdcached answer: " + e.getCause().getMessage(),
          Map.of("command", command, "exception", e.getCause().getClass().getName()));
    }
  }

  private CommandResponse readAnswer(String command, String line) throws IOException {
    String status = output.readLine();
    if (status == null) {
      throw new IOException("rrdcached closed the connection");
    }
    Matcher matcher = STATUS_LINE.matcher(status);
    if (!matcher.matches()) {
      return CommandResponse.failure("Invalid response from rrdcached: " + status);
    }
    int code = Integer.parseInt(matcher.group(1));
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("status_code", code);
    metadata.put("status_message", matcher.group(2));
    metadata.put("command", command);
    metadata.put("rrdcached_command", line);
    if (code < 0) {
      return CommandResponse.failure(matcher.group(2), metadata);
    }
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < code; i++) {
      String data = output.readLine();
      if (data == null) {
        throw new IOException(
            "rrdcached closed the connection after " + i + " of " + code + " lines");
      }
      lines.add(data);
    }
    return CommandResponse.success(String.join("\n", lines), metadata);
  }

  private void terminate() {
    markDisconnected();
    shutdown();
  }

  private void shutdown() {
    if (reader != null) {
      reader.shutdownNow();
    }
    if (channel != null) {
      try {
        channel.close();
      } catch (IOException e) {
        log.debug("Error closing rrdcached socket: {}", e.getMessage());
      }
    }
    channel = null;
    input = null;
    output = null;
    reader = null;
  }

  @Override
  protected void doClose() {
    if (input != null) {
      try {
        input.write("QUIT\n");
        input.flush();
      } catch (IOException e) {
        log.debug("rrdcached connection already gone: {}", e.getMessage());
      }
    }
    shutdown();
  }

  @Override
  protected String describe() {
    return "rrdcached at " + address;
  }
}
