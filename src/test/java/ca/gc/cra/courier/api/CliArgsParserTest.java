package ca.gc.cra.courier.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"fragmentSize=512", " dataRate = 2Mbps ", "fallbackClass=", "otelResourceAttributes=a=b"});

    assertEquals("512", map.get("fragmentSize"));
    assertEquals("2Mbps", map.get("dataRate"));
    assertEquals("", map.get("fallbackClass"));
    assertEquals("a=b", map.get("otelResourceAttributes"));
    assertEquals("fragmentSize", map.keySet().iterator().next());
  }

  @Test
  void nullOrBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {" ", null}).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"fragmentSize"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=512"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"report=a\u0007b"}));
  }
}
