package ca.gc.cra.courier.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @AfterEach
  void restore() {
    LoggingConfigurator.resetLogging();
  }

  @Test
  void verboseRaisesRootToDebugAndResetRestoresInfo() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    assertTrue(LoggingConfigurator.enableVerboseLogging());
    assertEquals(Level.DEBUG, root.getLevel());

    assertTrue(LoggingConfigurator.resetLogging());
    assertEquals(Level.INFO, root.getLevel());
  }
}
