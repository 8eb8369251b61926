package ca.gc.cra.courier.api;

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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SummaryPrinterTest {

  @Test
  void rendersFlowBlockPerFlow() {
    FlowKey key = new FlowKey(new Endpoint("10.1.0.1", 49152), new Endpoint("10.1.3.2", 9));
    FlowStatistics flow = new FlowStatistics(key, 100, 95, 102_400, 97_280, 4_500_000.0, 1_234_567.0, 0.05);
    PayloadOutcome outcome = new PayloadOutcome(0, "neymar-0", 102_400, DestinationClass.NEYMAR, 12.5,
        BindingDecision.Reason.MATCHED, DestinationClass.NEYMAR, PayloadState.COMPLETED, 100, 100, 2, false, flow);
    Map<DestinationClass, ClassStatistics> classes = new EnumMap<>(DestinationClass.class);
    classes.put(DestinationClass.NEYMAR,
        new ClassStatistics(DestinationClass.NEYMAR, 1, 1, 100, 95, 4_500_000.0, 1_234_567.0, 0.05));

    List<String> lines = SummaryPrinter.render(
        new SimulationSummary(10_000_000_000L, 300, 0, 0, List.of(outcome), List.of(flow), classes));

    assertEquals("=== SIMULATION RESULTS ===", lines.get(0));
    assertTrue(lines.contains("Simulation time: 10.000 s"));
    assertTrue(lines.contains(
        "#0 neymar-0 (102400 bytes): Neymar score 12.50 -> Neymar [MATCHED], 100/100 fragments, 2 backpressure retries"));
    assertTrue(lines.contains("Flow 1 (" + key + ")"));
    assertTrue(lines.contains("  Tx Packets: 100"));
    assertTrue(lines.contains("  Rx Packets: 95"));
    assertTrue(lines.contains("  Throughput: 1.235 Mbps"));
    assertTrue(lines.contains("  Mean Delay: 4.500 ms"));
    assertTrue(lines.contains("  Packet Loss Ratio: 5.00%"));
    assertTrue(lines.contains(
        "Neymar: assigned 1, flows 1, tx 100, rx 95, mean delay 4.500 ms, throughput 1.235 Mbps, loss 5.00%"));
  }

  @Test
  void droppedPayloadHasNoDestination() {
    PayloadOutcome dropped = new PayloadOutcome(3, "img.png", 10, DestinationClass.UNRESOLVED,
        Double.POSITIVE_INFINITY, BindingDecision.Reason.DROPPED, null, PayloadState.COMPLETED, 0, 0, 0, false, null);

    List<String> lines = SummaryPrinter.render(
        new SimulationSummary(1_000_000_000L, 1, 1, 0, List.of(dropped), List.of(), Map.of()));

    assertTrue(lines.contains("#3 img.png (10 bytes): Unknown -> no destination [DROPPED], 0/0 fragments"));
    assertTrue(lines.contains("Payloads: 1 submitted, 1 completed, 1 dropped, 0 interrupted"));
  }

  @Test
  void undefinedValuesPrintAsNotAvailable() {
    assertEquals("n/a", SummaryPrinter.millis(Double.NaN));
    assertEquals("n/a", SummaryPrinter.mbps(Double.NaN));
    assertEquals("n/a", SummaryPrinter.percent(Double.NaN));
    assertEquals("0.00%", SummaryPrinter.percent(0.0));
  }
}
