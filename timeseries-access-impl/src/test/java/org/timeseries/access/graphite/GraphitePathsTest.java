package org.timeseries.access.graphite;

import com.typesafe.config.ConfigFactory;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ConfigurationException;
import org.timeseries.access.api.metric.MetricIdentifier;

public class GraphitePathsTest {
  private static final MetricIdentifier CPU = MetricIdentifier.of("system", "cpu");

  @Test
  public void testPathLayout() {
    GraphitePaths paths = new GraphitePaths(".servers.");

    Assertions.assertEquals("servers.system.cpu", paths.base(CPU));
    Assertions.assertEquals(
        "servers.system.cpu.core.0.host.db-1_example_com",
        paths.path(CPU, Map.of("host", "db-1.example.com", "core", "0")));
    Assertions.assertEquals("system.cpu", new GraphitePaths(null).base(CPU));
  }

  @Test
  public void testLabelsFromPath() {
    GraphitePaths paths = new GraphitePaths("servers");

    Assertions.assertEquals(
        Optional.of(Map.of("core", "0", "host", "a")),
        paths.labels(CPU, "servers.system.cpu.core.0.host.a"));
    Assertions.assertEquals(Optional.of(Map.of()), paths.labels(CPU, "servers.system.cpu"));
    Assertions.assertEquals(Optional.empty(), paths.labels(CPU, "servers.system.cpu.core"));
    Assertions.assertEquals(Optional.empty(), paths.labels(CPU, "servers.system.cpuidle.x.y"));
  }

  @Test
  public void testConfig() {
    GraphiteConfig config =
        GraphiteConfig.from(
            ConfigFactory.parseString(
                "host = carbon.local\nweb-port = 8081\nprefix = servers\nbatch-size = 10"));

    Assertions.assertEquals("carbon.local", config.getHost());
    Assertions.assertEquals(2003, config.getPort());
    Assertions.assertEquals("http://carbon.local:8081/", config.getWebUrl().toString());
    Assertions.assertEquals("/render", config.getRenderPath());
    Assertions.assertEquals("servers", config.getPrefix());
    Assertions.assertEquals(10, config.getBatchSize());
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> GraphiteConfig.from(ConfigFactory.parseString("batch-size = 0")));
  }
}
