package org.timeseries.access.rrd;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.timeseries.access.api.ValidationException;

public class RrdCommandTest {

  @Test
  public void testArgvOrder() {
    RrdCommand command =
        RrdCommand.builder()
            .type(RrdCommandType.UPDATE)
            .argument("1704067200:1")
            .option("--template")
            .option("value")
            .target("/var/rrd/a b.rrd")
            .build();

    Assertions.assertEquals(
        List.of("/var/rrd/a b.rrd", "--template", "value", "1704067200:1"), command.argv());
    Assertions.assertEquals(
        "update \"/var/rrd/a b.rrd\" --template value 1704067200:1", command.toLine());
  }

  @Test
  public void testArgvTravelsAsJson() {
    RrdCommand command =
        RrdCommand.builder().type(RrdCommandType.LIST).option("--recursive").argument("/x").build();

    Assertions.assertEquals("[\"--recursive\",\"/x\"]", command.toData());
    Assertions.assertEquals(command.argv(), RrdCommand.decodeArgv(command.toData()));
    Assertions.assertEquals(List.of(), RrdCommand.decodeArgv(""));
    Assertions.assertThrows(ValidationException.class, () -> RrdCommand.decodeArgv("{}"));
  }

  @Test
  public void testQuoting() {
    Assertions.assertEquals("plain", RrdCommand.quote("plain"));
    Assertions.assertEquals("\"\"", RrdCommand.quote(""));
    Assertions.assertEquals("\"say \\\"hi\\\"\"", RrdCommand.quote("say \"hi\""));
  }

  @Test
  public void testCommandNames() {
    Assertions.assertEquals("flushcached", RrdCommandType.FLUSHCACHED.getCommand());
    Assertions.assertEquals(RrdCommandType.XPORT, RrdCommandType.fromCommand("XPORT"));
    Assertions.assertThrows(ValidationException.class, () -> RrdCommandType.fromCommand("rm"));
  }
}
