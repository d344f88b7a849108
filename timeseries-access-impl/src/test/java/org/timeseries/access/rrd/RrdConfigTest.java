package org.timeseries.access.rrd;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ConfigurationException;

public class RrdConfigTest {

  @Test
  public void testDefaults() {
    RrdConfig config = RrdConfig.from(ConfigFactory.parseString("directory = \"/var/rrd\""));

    Assertions.assertEquals(Path.of("/var/rrd"), config.getDirectory());
    Assertions.assertEquals(RrdMode.PROCESS, config.getMode());
    Assertions.assertEquals("rrdtool", config.getRrdtool());
    Assertions.assertEquals(300, config.getStep());
    Assertions.assertEquals(Duration.ofSeconds(10), config.getTimeout());
    Assertions.assertEquals(ConsolidationFunction.AVERAGE, config.getDefaultConsolidation());
    Assertions.assertEquals(3, config.getDefaultRetention().size());
  }

  @Test
  public void testExplicitSettings() {
    Config raw =
        ConfigFactory.parseString(
            "directory = \"/data/rrd\"\n"
                + "mode = persistent\n"
                + "rrdtool = \"/opt/bin/rrdtool\"\n"
                + "step = 60\n"
                + "timeout = 2s\n"
                + "default-consolidation = max\n"
                + "retry { max-attempts = 5 }");

    RrdConfig config = RrdConfig.from(raw);

    Assertions.assertEquals(RrdMode.PERSISTENT, config.getMode());
    Assertions.assertEquals("/opt/bin/rrdtool", config.getRrdtool());
    Assertions.assertEquals(60, config.getStep());
    Assertions.assertEquals(Duration.ofSeconds(2), config.getTimeout());
    Assertions.assertEquals(ConsolidationFunction.MAX, config.getDefaultConsolidation());
    Assertions.assertEquals(5, config.getRetryPolicy().getMaxAttempts());
  }

  @Test
  public void testInvalidSettings() {
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> RrdConfig.from(ConfigFactory.parseString("mode = PROCESS")));
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> RrdConfig.from(ConfigFactory.parseString("directory = \"/x\"\nmode = RRDCACHED")));
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> RrdConfig.from(ConfigFactory.parseString("directory = \"/x\"\nstep = 0")));
    Assertions.assertThrows(
        ConfigurationException.class,
        () -> RrdConfig.from(ConfigFactory.parseString("directory = \"/x\"\nmode = daemon")));
  }

  @Test
  public void testEnumSettingsIgnoreCase() {
    RrdConfig config =
        RrdConfig.from(
            ConfigFactory.parseString(
                "directory = \"/x\"\n"
                    + "mode = Rrdcached\n"
                    + "rrdcached = \"unix:/run/rrdcached.sock\"\n"
                    + "default-consolidation = LAST"));

    Assertions.assertEquals(RrdMode.RRDCACHED, config.getMode());
    Assertions.assertEquals(ConsolidationFunction.LAST, config.getDefaultConsolidation());
  }
}
