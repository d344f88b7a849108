package org.timeseries.access.graphite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/**
 * Graphite-web over HTTP for {@code render} and {@code index}, carbon plaintext over TCP for
 * {@code write}.
 */
@Slf4j
public class GraphiteConnectionAdapter extends AbstractConnectionAdapter {
  public static final String COMMAND_RENDER = "render";
  public static final String COMMAND_INDEX = "index";
  public static final String COMMAND_WRITE = "write";

  private static final String VERSION_PATH = "version";
  private static final String INDEX_PATH = "metrics/index.json";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, List<String>>> PARAMETERS_TYPE =
      new TypeReference<>() {};

  private final GraphiteConfig config;
  private final OkHttpClient okHttpClient;
  private final SocketFactory socketFactory;

  public GraphiteConnectionAdapter(GraphiteConfig config) {
    this(
        config,
        new OkHttpClient.Builder().callTimeout(config.getTimeout()).build(),
        Socket::new);
  }

  public GraphiteConnectionAdapter(
      GraphiteConfig config, OkHttpClient okHttpClient, SocketFactory socketFactory) {
    super(ReconnectPolicy.ONCE);
    this.config = config;
    this.okHttpClient = okHttpClient;
    this.socketFactory = socketFactory;
  }

  /** Render parameters as carried in command data. */
  public static String encodeParameters(Map<String, List<String>> parameters) {
    try {
      return OBJECT_MAPPER.writeValueAsString(parameters);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode render parameters", e);
    }
  }

  @Override
  protected boolean doConnect() {
    return config.getRetryPolicy().run("Reach " + config.getWebUrl(), this::reachable);
  }

  // any HTTP answer means graphite-web is up
  private boolean reachable() {
    Request request = new Request.Builder().url(url(VERSION_PATH).build()).get().build();
    try (Response response = okHttpClient.newCall(request).execute()) {
      return true;
    } catch (IOException e) {
      log.debug("Graphite web at {} unreachable: {}", config.getWebUrl(), e.getMessage());
      return false;
    }
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    switch (command) {
      case COMMAND_RENDER:
        return render(data);
      case COMMAND_INDEX:
        return get(url(INDEX_PATH).build());
      case COMMAND_WRITE:
        return write(data);
      default:
        return CommandResponse.failure("Unknown command: " + command);
    }
  }

  private CommandResponse render(String data) {
    Map<String, List<String>> parameters;
    try {
      parameters = OBJECT_MAPPER.readValue(data, PARAMETERS_TYPE);
    } catch (JsonProcessingException e) {
      return CommandResponse.failure("Invalid render parameters: " + e.getOriginalMessage());
    }
    HttpUrl.Builder url = url(StringUtils.stripStart(config.getRenderPath(), "/"));
    parameters.forEach(
        (name, values) -> values.forEach(value -> url.addQueryParameter(name, value)));
    return get(url.build());
  }

  private CommandResponse get(HttpUrl url) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = okHttpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();
      Map<String, Object> metadata = Map.of("status_code", response.code());
      if (!response.isSuccessful()) {
        return CommandResponse.failure(
            StringUtils.isBlank(payload) ? "HTTP " + response.code() : payload, metadata);
      }
      return CommandResponse.success(payload, metadata);
    } catch (ConnectException | UnknownHostException e) {
      markDisconnected();
      return CommandResponse.failure(
          "Connection to " + config.getWebUrl() + " failed: " + e.getMessage(),
          Map.of("exception", e.getClass().getName()));
    } catch (InterruptedIOException e) {
      return CommandResponse.failure(
          "Request to " + config.getWebUrl() + " timed out",
          Map.of("exception", e.getClass().getName()));
    } catch (IOException e) {
      return CommandResponse.failure(
          "Request to " + config.getWebUrl() + " failed: " + e.getMessage(),
          Map.of("exception", e.getClass().getName()));
    }
  }

  private CommandResponse write(String lines) {
    String[] entries = lines.split("\n");
    try (Socket socket = socketFactory.create()) {
      int timeout = (int) config.getTimeout().toMillis();
      socket.connect(new InetSocketAddress(config.getHost(), config.getPort()), timeout);
      socket.setSoTimeout(timeout);
      Writer writer = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
      for (int i = 0; i < entries.length; i++) {
        writer.write(entries[i]);
        writer.write('\n');
        if ((i + 1) % config.getBatchSize() == 0) {
          writer.flush();
        }
      }
      writer.flush();
      return CommandResponse.success("", Map.of("lines", entries.length));
    } catch (IOException e) {
      return CommandResponse.failure(
          "Plaintext write to "
              + config.getHost()
              + ":"
              + config.getPort()
              + " failed: "
              + e.getMessage(),
          Map.of("exception", e.getClass().getName()));
    }
  }

  private HttpUrl.Builder url(String path) {
    return config.getWebUrl().newBuilder().addPathSegments(path);
  }

  @Override
  protected void doClose() {
    okHttpClient.dispatcher().executorService().shutdown();
    okHttpClient.connectionPool().evictAll();
  }

  @Override
  protected String describe() {
    return "Graphite at " + config.getWebUrl();
  }

  /** Creates unconnected sockets for plaintext writes. */
  @FunctionalInterface
  public interface SocketFactory {
    Socket create() throws IOException;
  }
}
