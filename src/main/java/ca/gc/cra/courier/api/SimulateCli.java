package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pacing.FragmentPacer;
import ca.gc.cra.courier.application.pipeline.SimulationSummary;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.config.CompositionRoot;
import ca.gc.cra.courier.config.SimulationConfig;
import ca.gc.cra.courier.config.Units;
import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.infrastructure.metrics.ExporterSettings;
import ca.gc.cra.courier.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.courier.infrastructure.report.JsonReportWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code simulate} subcommand: classifies payloads, paces their fragments over simulated links,
 * and prints delivery statistics.
 *
 * @since 0.1.0
 */
public final class SimulateCli {
  private static final Logger log = LoggerFactory.getLogger(SimulateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: simulate [config=PATH] [classes=A,B,...] [fragmentSize=N] [dataRate=RATE] [linkRate=RATE] "
          + "[linkDelay=DUR] [simulationTime=DUR] [confidenceThreshold=X] [fallbackClass=CLASS] "
          + "[imageDir=PATH] [report=PATH] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      COURIER simulate

      Usage:
        simulate [key=value ...] [--dry-run] [--verbose]

      Payloads:
        classes=MESSI,RONALDO,...  Active destination classes (default all five)
        imageSize=N                Synthetic payload size in bytes (default 50000)
        imagesPerClass=N           Synthetic payloads per class (default 1)
        imageDir=PATH              Load .jpg/.jpeg/.png files instead of synthetic payloads

      Classification:
        confidenceThreshold=X      Accept results whose distance is below X (default 100.0)
        fallbackClass=CLASS        Class receiving low-confidence and unknown payloads (default none: drop)
        classifierScript=C:S,...   Replay fixed results, e.g. MESSI:12.5,UNRESOLVED

      Pacing and links:
        fragmentSize=N             Fragment payload size in bytes (default 1024)
        dataRate=RATE              Pacing rate, e.g. 1Mbps (default 1Mbps)
        linkRate=RATE              Link bandwidth (default 5Mbps)
        linkDelay=DUR              Propagation delay, e.g. 2ms (default 2ms)
        linkQueueBytes=N           Transmit queue limit per link (default 65536)
        lossRate=P                 Frame loss probability 0..1 (default 0)
        seed=N                     Loss generator seed (default 1)
        backpressureRetry=DUR      Retry delay after a full queue (default: one frame time)

      Timing:
        startTime=DUR              Start of the first payload (default 2s)
        stagger=DUR                Offset between payload starts (default 500ms)
        simulationTime=DUR         Run horizon (default 10s)

      Output:
        report=PATH                Write a JSON report
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        config=PATH                YAML file with common/simulate sections
        --dry-run                  Print the plan without running
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private SimulateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the simulate command and returns its exit code.
   *
   * @param args arguments following the subcommand name
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    Map<String, String> effective;
    SimulationConfig config;
    ExporterSettings exporter;
    try {
      effective = ConfigCliUtils.effectiveConfig("simulate", input, log);
      config = SimulationConfig.fromMap(effective);
      exporter = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.forFailure(ex);
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (config.dryRun()) {
      return printDryRunPlan(config);
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(exporter)) {
      SimulationSummary summary = simulate(config, metrics);
      CliPrinter.printLines(SummaryPrinter.render(summary));
      if (config.report().isPresent()) {
        Path report = config.report().get();
        new JsonReportWriter().write(summary, report);
        CliPrinter.println("Report written to " + report);
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Simulation configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Simulation I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in simulation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Loads payloads and executes one isolated run.
   *
   * @param config validated configuration
   * @param metrics metrics sink
   * @return run summary
   * @throws IOException if payloads cannot be loaded
   */
  static SimulationSummary simulate(SimulationConfig config, MetricsPort metrics) throws IOException {
    CompositionRoot root = new CompositionRoot(config, metrics);
    List<Payload> payloads = root.payloadSource().load();
    log.info("Simulating {} payloads over {} classes: fragmentSize={}, dataRate={}, linkRate={}, horizon={}ns",
        payloads.size(), config.classes().size(), config.fragmentSize(), Units.formatRate(config.dataRateBps()),
        Units.formatRate(config.linkRateBps()), config.simulationTimeNanos());
    return root.simulationRun().execute(payloads);
  }

  private static ExitCode printDryRunPlan(SimulationConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("COURIER simulate dry-run");
    lines.add("  fragmentSize=" + config.fragmentSize() + " bytes");
    lines.add("  dataRate=" + Units.formatRate(config.dataRateBps()));
    lines.add("  link=" + Units.formatRate(config.linkRateBps()) + ", delay " + config.linkDelayNanos()
        + "ns, queue " + config.linkQueueBytes() + " bytes, loss " + config.lossRate());
    lines.add("  confidenceThreshold=" + config.confidenceThreshold() + ", fallbackClass="
        + config.fallbackClass().map(DestinationClass::name).orElse("<none>"));
    lines.add("  simulationTime=" + config.simulationTimeNanos() + "ns, startTime=" + config.startTimeNanos()
        + "ns, stagger=" + config.staggerNanos() + "ns");
    for (DestinationClass cls : config.classes()) {
      lines.add("  destination " + cls.name() + " -> " + config.endpointFor(cls));
    }
    try {
      CompositionRoot root = new CompositionRoot(config);
      FragmentPacer pacer = new FragmentPacer(config.fragmentSize(), config.dataRateBps(), MetricsPort.NO_OP);
      for (Payload payload : root.payloadSource().load()) {
        lines.add("  payload #" + payload.tag() + " " + payload.label() + ": " + payload.length() + " bytes, "
            + pacer.fragmentCount(payload.length()) + " fragments");
      }
    } catch (IOException ex) {
      log.error("Unable to load payloads for dry-run", ex);
      return ExitCode.IO_ERROR;
    }
    lines.add("Dry-run complete. Remove --dry-run to simulate.");
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }
}
