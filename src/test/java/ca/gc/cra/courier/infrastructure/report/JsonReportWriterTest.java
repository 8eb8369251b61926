package ca.gc.cra.courier.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.courier.application.pipeline.PayloadOutcome;
import ca.gc.cra.courier.application.pipeline.SimulationSummary;
import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowKey;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.net.Endpoint;
import ca.gc.cra.courier.domain.payload.PayloadState;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonReportWriterTest {
  private static final FlowKey FLOW =
      new FlowKey(new Endpoint("10.1.0.1", 49152), new Endpoint("10.1.1.2", 9));

  @TempDir
  Path dir;

  @Test
  void rendersRunPayloadsFlowsAndClasses() throws IOException {
    String json = new JsonReportWriter().toJson(summary());

    assertTrue(json.startsWith("{\"schemaVersion\":1,"), json);
    assertTrue(json.contains("\"run\":{\"horizonNanos\":10000000000,\"eventsExecuted\":120,\"payloads\":2,"
        + "\"dropped\":1,\"interrupted\":0,\"inconsistencies\":0}"), json);
    assertTrue(json.contains("\"label\":\"messi-0\""), json);
    assertTrue(json.contains("\"reason\":\"DROPPED\",\"boundTo\":null"), json);
    assertTrue(json.contains("\"flow\":\"" + FLOW + "\""), json);
    assertTrue(json.contains("\"source\":\"10.1.0.1:49152\",\"destination\":\"10.1.1.2:9\""), json);
    assertTrue(json.contains("\"class\":\"MESSI\""), json);
  }

  @Test
  void undefinedMetricsAreWrittenAsNull() throws IOException {
    String json = new JsonReportWriter().toJson(summary());

    assertTrue(json.contains("\"classifiedAs\":\"RONALDO\",\"score\":null"), json);
    assertTrue(json.contains("\"meanDelayNanos\":null"), json);
  }

  @Test
  void writesParsableFileCreatingParentDirectories() throws IOException {
    Path target = dir.resolve("reports/run.json");

    new JsonReportWriter().write(summary(), target);

    String content = Files.readString(target, StandardCharsets.UTF_8);
    int payloadObjects = 0;
    try (JsonParser parser = new JsonFactory().createParser(content)) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.FIELD_NAME && "tag".equals(parser.currentName())) {
          payloadObjects++;
        }
      }
    }
    assertEquals(2, payloadObjects);
  }

  private static SimulationSummary summary() {
    FlowStatistics flow = new FlowStatistics(FLOW, 49, 49, 50_000, 50_000, 3_700_000.0, 4_000_000.0, 0.0);
    PayloadOutcome delivered = new PayloadOutcome(0, "messi-0", 50_000, DestinationClass.MESSI, 0.0,
        BindingDecision.Reason.MATCHED, DestinationClass.MESSI, PayloadState.COMPLETED, 49, 49, 0, false, flow);
    PayloadOutcome dropped = new PayloadOutcome(1, "ronaldo-0", 50_000, DestinationClass.RONALDO,
        Double.POSITIVE_INFINITY, BindingDecision.Reason.DROPPED, null, PayloadState.COMPLETED, 0, 0, 0, false, null);
    Map<DestinationClass, ClassStatistics> classes = new EnumMap<>(DestinationClass.class);
    classes.put(DestinationClass.MESSI,
        new ClassStatistics(DestinationClass.MESSI, 1, 1, 49, 49, 3_700_000.0, 4_000_000.0, 0.0));
    classes.put(DestinationClass.NEYMAR,
        new ClassStatistics(DestinationClass.NEYMAR, 0, 0, 0, 0, Double.NaN, Double.NaN, Double.NaN));
    return new SimulationSummary(10_000_000_000L, 120, 1, 0, List.of(delivered, dropped), List.of(flow), classes);
  }
}
