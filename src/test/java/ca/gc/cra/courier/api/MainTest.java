package ca.gc.cra.courier.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("COURIER command dispatcher"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: courier"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
  }

  @Test
  void helpAfterCommandReachesSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"SIMULATE", "--help"}));
    assertTrue(buffer.toString().contains("simulationTime=DUR"));
  }

  @Test
  void dispatchesClassifyWithRemainingArguments() {
    assertEquals(ExitCode.CONFIG_ERROR, Main.run(new String[] {"classify", "classes=Messi"}));
    assertTrue(buffer.toString().contains("usage: classify"));
  }

  @Test
  void dispatchesSweep() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"sweep"}));
    assertTrue(buffer.toString().contains("usage: sweep"));
  }
}
