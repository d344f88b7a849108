package org.timeseries.access.rrd;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnixDomainSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.connection.CommandResponse;
import org.timeseries.access.connection.RetryPolicy;

public class RrdCachedConnectionAdapterTest {
  private final List<String> received = new CopyOnWriteArrayList<>();
  private ServerSocket serverSocket;

  @AfterEach
  public void tearDown() throws IOException {
    if (serverSocket != null) {
      serverSocket.close();
    }
  }

  @Test
  public void testAddressForms() {
    Assertions.assertEquals(
        UnixDomainSocketAddress.of("/run/rrdcached.sock"),
        RrdCachedConnectionAdapter.parseAddress("unix:/run/rrdcached.sock"));
    Assertions.assertEquals(
        UnixDomainSocketAddress.of("/run/rrdcached.sock"),
        RrdCachedConnectionAdapter.parseAddress("/run/rrdcached.sock"));
    InetSocketAddress tcp =
        (InetSocketAddress) RrdCachedConnectionAdapter.parseAddress("tcp:cache.local:42217");
    Assertions.assertEquals("cache.local", tcp.getHostString());
    Assertions.assertEquals(42217, tcp.getPort());
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> RrdCachedConnectionAdapter.parseAddress("cache.local:port"));
    Assertions.assertThrows(
        ConfigurationException.class, () -> RrdCachedConnectionAdapter.parseAddress(" "));
  }

  @Test
  public void testProtocolSpelling() {
    Assertions.assertEquals(
        "LIST RECURSIVE /var/rrd",
        RrdCachedConnectionAdapter.toProtocol(
            RrdCommandType.LIST, List.of("--recursive", "/var/rrd")));
    Assertions.assertEquals(
        "CREATE /var/rrd/a.rrd -s 300 -O DS:value:GAUGE:600:U:U",
        RrdCachedConnectionAdapter.toProtocol(
            RrdCommandType.CREATE,
            List.of(
                "/var/rrd/a.rrd", "--step", "300", "--no-overwrite", "DS:value:GAUGE:600:U:U")));
    Assertions.assertEquals(
        "FLUSH /var/rrd/a.rrd",
        RrdCachedConnectionAdapter.toProtocol(
            RrdCommandType.FLUSHCACHED, List.of("/var/rrd/a.rrd")));
  }

  @Test
  public void testStatusLinesAndDataLines() throws IOException {
    RrdCachedConnectionAdapter adapter = new RrdCachedConnectionAdapter(config(startServer()));

    CommandResponse listing = adapter.executeCommand("list", "[\"--recursive\",\"/var/rrd\"]");
    CommandResponse info = adapter.executeCommand("info", "[\"missing.rrd\"]");
    CommandResponse xport = adapter.executeCommand("xport", "[]");

    Assertions.assertTrue(listing.isSuccess());
    Assertions.assertEquals("a.rrd\nb.rrd", listing.getData());
    Assertions.assertEquals(2, listing.getMetadata().get("status_code"));
    Assertions.assertEquals("No such file: missing.rrd", info.getError().orElseThrow());
    Assertions.assertEquals(-1, info.getMetadata().get("status_code"));
    Assertions.assertTrue(xport.getError().orElseThrow().contains("not supported by rrdcached"));
    Assertions.assertEquals(
        List.of("PING", "LIST RECURSIVE /var/rrd", "INFO missing.rrd"), received);
    adapter.close();
  }

  @Test
  public void testUnreachableDaemon() throws IOException {
    ServerSocket closed = new ServerSocket(0);
    int port = closed.getLocalPort();
    closed.close();
    RrdCachedConnectionAdapter adapter = new RrdCachedConnectionAdapter(config(port));

    Assertions.assertFalse(adapter.connect());
  }

  private int startServer() throws IOException {
    serverSocket = new ServerSocket(0);
    Thread server =
        new Thread(
            () -> {
              try (Socket socket = serverSocket.accept();
                  BufferedReader reader =
                      new BufferedReader(
                          new InputStreamReader(
                              socket.getInputStream(), StandardCharsets.UTF_8));
                  Writer writer =
                      new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                  received.add(line);
                  if (line.equals("PING")) {
                    writer.write("0 PONG\n");
                  } else if (line.startsWith("LIST")) {
                    writer.write("2 entries\na.rrd\nb.rrd\n");
                  } else if (line.equals("QUIT")) {
                    break;
                  } else {
                    String file = line.substring(line.indexOf(' ') + 1);
                    writer.write("-1 No such file: " + file + "\n");
                  }
                  writer.flush();
                }
              } catch (IOException e) {
                received.add("server error: " + e.getMessage());
              }
            });
    server.setDaemon(true);
    server.start();
    return serverSocket.getLocalPort();
  }

  private static RrdConfig config(int port) {
    return RrdConfig.builder()
        .directory(Path.of("/var/rrd"))
        .mode(RrdMode.RRDCACHED)
        .rrdcachedAddress("tcp:127.0.0.1:" + port)
        .retryPolicy(RetryPolicy.noRetry())
        .build();
  }
}
