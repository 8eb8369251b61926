package ca.gc.cra.courier.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.courier.validation.ConfigurationException;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @Test
  void mapsFailuresToCodes() {
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(new ConfigurationException("bad")));
    assertEquals(ExitCode.INVALID_ARGS, ExitCode.forFailure(new IllegalArgumentException("bad")));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new IOException("disk")));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new IllegalStateException("boom")));
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
