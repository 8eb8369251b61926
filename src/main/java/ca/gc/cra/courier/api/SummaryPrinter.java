package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pipeline.PayloadOutcome;
import ca.gc.cra.courier.application.pipeline.SimulationSummary;
import ca.gc.cra.courier.config.Units;
import ca.gc.cra.courier.domain.flow.ClassStatistics;
import ca.gc.cra.courier.domain.flow.FlowStatistics;
import ca.gc.cra.courier.domain.payload.PayloadState;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link SimulationSummary} as the human-readable results block printed by {@code simulate}, and a set of
 * sweep results as one comparison table.
 *
 * <p>Undefined statistics print as {@code n/a}. Throughput is reported in Mbps (10^6 bits per second).</p>
 */
final class SummaryPrinter {
  static final String NOT_AVAILABLE = "n/a";

  private SummaryPrinter() {}

  static List<String> render(SimulationSummary summary) {
    List<String> lines = new ArrayList<>();
    lines.add("=== SIMULATION RESULTS ===");
    lines.add(format("Simulation time: %.3f s", summary.horizonNanos() / 1e9));
    lines.add("Events executed: " + summary.eventsExecuted());
    lines.add(format("Payloads: %d submitted, %d completed, %d dropped, %d interrupted",
        summary.payloads().size(),
        summary.countInState(PayloadState.COMPLETED),
        summary.droppedCount(),
        summary.interruptedCount()));
    lines.add("Stats inconsistencies: " + summary.inconsistencyCount());

    lines.add("");
    lines.add("--- Payloads ---");
    for (PayloadOutcome p : summary.payloads()) {
      lines.add(payloadLine(p));
    }

    lines.add("");
    lines.add("--- Flow Statistics ---");
    int index = 1;
    for (FlowStatistics flow : summary.flows()) {
      lines.add("Flow " + index++ + " (" + flow.key() + ")");
      lines.add("  Tx Packets: " + flow.sent());
      lines.add("  Rx Packets: " + flow.received());
      lines.add("  Throughput: " + mbps(flow.throughputBps()));
      lines.add("  Mean Delay: " + millis(flow.meanDelayNanos()));
      lines.add("  Packet Loss Ratio: " + percent(flow.lossRatio()));
    }

    lines.add("");
    lines.add("--- Class Statistics ---");
    for (ClassStatistics cls : summary.classes().values()) {
      lines.add(format("%s: assigned %d, flows %d, tx %d, rx %d, mean delay %s, throughput %s, loss %s",
          cls.destinationClass().displayName(),
          cls.assigned(),
          cls.flows(),
          cls.sent(),
          cls.received(),
          millis(cls.meanDelayNanos()),
          mbps(cls.throughputBps()),
          percent(cls.lossRatio())));
    }
    return lines;
  }

  static List<String> renderSweep(List<SweepCli.SweepResult> results) {
    List<String> lines = new ArrayList<>();
    lines.add("=== SCENARIO COMPARISON ===");
    lines.add(format("%-16s %8s %10s %10s %9s %9s %9s %8s %8s %12s %14s %8s",
        "Scenario", "Fragment", "Data rate", "Link delay", "Payloads", "Completed", "Dropped", "Tx", "Rx",
        "Mean delay", "Throughput", "Loss"));
    for (SweepCli.SweepResult result : results) {
      SimulationSummary summary = result.summary();
      lines.add(format("%-16s %8d %10s %10s %9d %9d %9d %8d %8d %12s %14s %8s",
          result.scenario().name(),
          result.config().fragmentSize(),
          Units.formatRate(result.config().dataRateBps()),
          millis(result.config().linkDelayNanos()),
          summary.payloads().size(),
          summary.countInState(PayloadState.COMPLETED),
          summary.droppedCount(),
          summary.totalSent(),
          summary.totalReceived(),
          millis(summary.meanFlowDelayNanos()),
          mbps(summary.meanFlowThroughputBps()),
          percent(summary.meanFlowLossRatio())));
    }
    return lines;
  }

  private static String payloadLine(PayloadOutcome p) {
    String classified;
    if (p.classifiedAs() == null) {
      classified = "unclassified";
    } else if (!p.classifiedAs().isNamed()) {
      classified = p.classifiedAs().displayName();
    } else {
      classified = format("%s score %.2f", p.classifiedAs().displayName(), p.score());
    }
    String route = p.boundTo() == null ? "no destination" : p.boundTo().displayName();
    StringBuilder sb = new StringBuilder();
    sb.append('#').append(p.tag()).append(' ').append(p.label())
        .append(" (").append(p.length()).append(" bytes): ")
        .append(classified).append(" -> ").append(route);
    if (p.reason() != null) {
      sb.append(" [").append(p.reason()).append(']');
    }
    sb.append(", ").append(p.fragmentsSent()).append('/').append(p.fragmentsPlanned()).append(" fragments");
    if (p.backpressureEvents() > 0) {
      sb.append(", ").append(p.backpressureEvents()).append(" backpressure retries");
    }
    if (p.interrupted()) {
      sb.append(", interrupted");
    }
    return sb.toString();
  }

  static String mbps(double bitsPerSecond) {
    return Double.isFinite(bitsPerSecond) ? format("%.3f Mbps", bitsPerSecond / 1e6) : NOT_AVAILABLE;
  }

  static String millis(double nanos) {
    return Double.isFinite(nanos) ? format("%.3f ms", nanos / 1e6) : NOT_AVAILABLE;
  }

  static String percent(double ratio) {
    return Double.isFinite(ratio) ? format("%.2f%%", ratio * 100.0) : NOT_AVAILABLE;
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
