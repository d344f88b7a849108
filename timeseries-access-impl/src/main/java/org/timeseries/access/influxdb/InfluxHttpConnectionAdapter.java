package org.timeseries.access.influxdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.api.connection.ReconnectPolicy;
import org.timeseries.access.connection.AbstractConnectionAdapter;

/**
 * InfluxDB 2.x HTTP transport. Commands are {@code ping}, {@code health}, {@code query} (Flux
 * script as data) and {@code write} (line protocol as data).
 */
@Slf4j
public class InfluxHttpConnectionAdapter extends AbstractConnectionAdapter {
  public static final String COMMAND_PING = "ping";
  public static final String COMMAND_HEALTH = "health";
  public static final String COMMAND_QUERY = "query";
  public static final String COMMAND_WRITE = "write";

  private static final String PING_PATH = "ping";
  private static final String HEALTH_PATH = "health";
  private static final String QUERY_PATH = "api/v2/query";
  private static final String WRITE_PATH = "api/v2/write";
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  private static final MediaType TEXT = MediaType.parse("text/plain; charset=utf-8");
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final InfluxDbConfig config;
  private final OkHttpClient okHttpClient;

  public InfluxHttpConnectionAdapter(InfluxDbConfig config) {
    this(config, new OkHttpClient.Builder().callTimeout(config.getTimeout()).build());
  }

  public InfluxHttpConnectionAdapter(InfluxDbConfig config, OkHttpClient okHttpClient) {
    super(ReconnectPolicy.ONCE);
    this.config = config;
    this.okHttpClient = okHttpClient;
  }

  @Override
  protected boolean doConnect() {
    return config.getRetryPolicy().run("Ping " + config.getUrl(), this::ping);
  }

  private boolean ping() {
    Request request = new Request.Builder().url(url(PING_PATH).build()).get().build();
    try (Response response = okHttpClient.newCall(request).execute()) {
      return response.isSuccessful();
    } catch (IOException e) {
      log.debug("Ping to {} failed: {}", config.getUrl(), e.getMessage());
      return false;
    }
  }

  @Override
  protected CommandResponse doExecute(String command, String data) {
    Request request;
    switch (command) {
      case COMMAND_PING:
        request = new Request.Builder().url(url(PING_PATH).build()).get().build();
        break;
      case COMMAND_HEALTH:
        request = new Request.Builder().url(url(HEALTH_PATH).build()).get().build();
        break;
      case COMMAND_QUERY:
        request =
            authorized(
                    url(QUERY_PATH).addQueryParameter("org", config.getOrg()).build())
                .header("Accept", "application/csv")
                .post(RequestBody.create(queryBody(data), JSON))
                .build();
        break;
      case COMMAND_WRITE:
        request =
            authorized(
                    url(WRITE_PATH)
                        .addQueryParameter("org", config.getOrg())
                        .addQueryParameter("bucket", config.getBucket())
                        .addQueryParameter("precision", config.getPrecision().getTag())
                        .build())
                .post(RequestBody.create(data, TEXT))
                .build();
        break;
      default:
        return CommandResponse.failure("Unknown command: " + command);
    }
    return send(request);
  }

  private CommandResponse send(Request request) {
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
          "Connection to " + config.getUrl() + " failed: " + e.getMessage(),
          Map.of("exception", e.getClass().getName()));
    } catch (InterruptedIOException e) {
      return CommandResponse.failure(
          "Request to " + config.getUrl() + " timed out",
          Map.of("exception", e.getClass().getName()));
    } catch (IOException e) {
      return CommandResponse.failure(
          "Request to " + config.getUrl() + " failed: " + e.getMessage(),
          Map.of("exception", e.getClass().getName()));
    }
  }

  private Request.Builder authorized(HttpUrl url) {
    Request.Builder builder = new Request.Builder().url(url);
    if (StringUtils.isNotEmpty(config.getToken())) {
      builder.header("Authorization", "Token " + config.getToken());
    }
    return builder;
  }

  private HttpUrl.Builder url(String path) {
    return config.getUrl().newBuilder().addPathSegments(path);
  }

  static String queryBody(String flux) {
    ObjectNode body = OBJECT_MAPPER.createObjectNode();
    body.put("query", flux);
    body.put("type", "flux");
    ObjectNode dialect = body.putObject("dialect");
    dialect.put("header", true);
    dialect.putArray("annotations").add("datatype").add("group").add("default");
    try {
      return OBJECT_MAPPER.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize query body", e);
    }
  }

  @Override
  protected void doClose() {
    okHttpClient.dispatcher().executorService().shutdown();
    okHttpClient.connectionPool().evictAll();
  }

  @Override
  protected String describe() {
    return "InfluxDB at " + config.getUrl();
  }
}
