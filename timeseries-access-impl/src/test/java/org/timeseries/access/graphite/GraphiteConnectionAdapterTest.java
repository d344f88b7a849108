package org.timeseries.access.graphite;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.connection.RetryPolicy;

public class GraphiteConnectionAdapterTest {
  private MockWebServer mockWebServer;

  @BeforeEach
  public void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  public void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  public void testRenderSendsDecodedParameters() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(404));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));
    GraphiteConnectionAdapter adapter = new GraphiteConnectionAdapter(config(2003));
    Map<String, List<String>> parameters = new LinkedHashMap<>();
    parameters.put("target", List.of("servers.load", "servers.mem"));
    parameters.put("format", List.of("json"));

    CommandResponse response =
        adapter.executeCommand(
            GraphiteConnectionAdapter.COMMAND_RENDER,
            GraphiteConnectionAdapter.encodeParameters(parameters));

    Assertions.assertTrue(response.isSuccess());
    Assertions.assertEquals("[]", response.getData());
    // a 404 on /version still proves graphite-web answers
    Assertions.assertEquals("/graphite/version", mockWebServer.takeRequest().getPath());
    RecordedRequest render = mockWebServer.takeRequest();
    Assertions.assertEquals("/graphite/render", render.getRequestUrl().encodedPath());
    Assertions.assertEquals(
        List.of("servers.load", "servers.mem"),
        render.getRequestUrl().queryParameterValues("target"));
    Assertions.assertEquals("json", render.getRequestUrl().queryParameter("format"));
    adapter.close();
  }

  @Test
  public void testIndexAndErrors() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("[\"a.b\"]"));
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    GraphiteConnectionAdapter adapter = new GraphiteConnectionAdapter(config(2003));

    CommandResponse index = adapter.executeCommand(GraphiteConnectionAdapter.COMMAND_INDEX, "");
    CommandResponse failed = adapter.executeCommand(GraphiteConnectionAdapter.COMMAND_INDEX, "");
    CommandResponse invalid =
        adapter.executeCommand(GraphiteConnectionAdapter.COMMAND_RENDER, "target=x");

    Assertions.assertEquals("[\"a.b\"]", index.getData());
    Assertions.assertEquals("HTTP 500", failed.getError().orElseThrow());
    Assertions.assertEquals(500, failed.getMetadata().get("status_code"));
    Assertions.assertTrue(invalid.getError().orElseThrow().startsWith("Invalid render parameters"));
    mockWebServer.takeRequest();
    Assertions.assertEquals(
        "/graphite/metrics/index.json", mockWebServer.takeRequest().getPath());
    adapter.close();
  }

  @Test
  public void testPlaintextWrite() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    try (ServerSocket carbon = new ServerSocket(0)) {
      CompletableFuture<List<String>> received =
          CompletableFuture.supplyAsync(
              () -> {
                List<String> lines = new ArrayList<>();
                try (Socket socket = carbon.accept();
                    BufferedReader reader =
                        new BufferedReader(
                            new InputStreamReader(
                                socket.getInputStream(), StandardCharsets.UTF_8))) {
                  String line;
                  while ((line = reader.readLine()) != null) {
                    lines.add(line);
                  }
                } catch (IOException e) {
                  lines.add("error: " + e.getMessage());
                }
                return lines;
              });
      GraphiteConnectionAdapter adapter =
          new GraphiteConnectionAdapter(config(carbon.getLocalPort()));

      CommandResponse response =
          adapter.executeCommand(
              GraphiteConnectionAdapter.COMMAND_WRITE, "a.b 1 1704067200\na.c 2 1704067200");

      Assertions.assertTrue(response.isSuccess());
      Assertions.assertEquals(2, response.getMetadata().get("lines"));
      Assertions.assertEquals(
          List.of("a.b 1 1704067200", "a.c 2 1704067200"), received.get(5, TimeUnit.SECONDS));
      adapter.close();
    }
  }

  @Test
  public void testUnreachableCarbonFailsWrite() throws IOException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    int port;
    try (ServerSocket closed = new ServerSocket(0)) {
      port = closed.getLocalPort();
    }
    GraphiteConnectionAdapter adapter = new GraphiteConnectionAdapter(config(port));

    CommandResponse response =
        adapter.executeCommand(GraphiteConnectionAdapter.COMMAND_WRITE, "a.b 1 1704067200");

    Assertions.assertTrue(response.getError().orElseThrow().startsWith("Plaintext write to"));
    adapter.close();
  }

  @Test
  public void testUnreachableWebLeavesAdapterDisconnected() throws IOException {
    GraphiteConfig config = config(2003);
    mockWebServer.shutdown();
    GraphiteConnectionAdapter adapter =
        new GraphiteConnectionAdapter(config, new OkHttpClient(), Socket::new);

    Assertions.assertFalse(adapter.connect());
  }

  private GraphiteConfig config(int carbonPort) {
    return GraphiteConfig.builder()
        .host("127.0.0.1")
        .port(carbonPort)
        .webUrl(mockWebServer.url("/graphite/"))
        .renderPath("/render")
        .timeout(Duration.ofSeconds(2))
        .batchSize(1)
        .retryPolicy(RetryPolicy.noRetry())
        .build();
  }
}
