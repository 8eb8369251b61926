package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.pipeline.SimulationSummary;
import ca.gc.cra.courier.config.ConfigMerger;
import ca.gc.cra.courier.config.DefaultsForMode;
import ca.gc.cra.courier.config.Scenario;
import ca.gc.cra.courier.config.SimulationConfig;
import ca.gc.cra.courier.config.Units;
import ca.gc.cra.courier.config.YamlConfigLoader;
import ca.gc.cra.courier.infrastructure.metrics.ExporterSettings;
import ca.gc.cra.courier.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.courier.infrastructure.report.JsonReportWriter;
import ca.gc.cra.courier.logging.LoggingConfigurator;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code sweep} subcommand: runs every scenario of a YAML file as its own isolated simulation
 * and prints the results side by side.
 *
 * <p>Each scenario gets a fresh composition root, so no scheduler, transport, or statistics state is shared between
 * runs. All scenarios are validated before the first one runs.</p>
 *
 * @since 0.1.0
 */
public final class SweepCli {
  private static final Logger log = LoggerFactory.getLogger(SweepCli.class);
  private static final String SUMMARY_USAGE =
      "usage: sweep config=PATH [scenarios=A,B,...] [reportDir=PATH] [key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      COURIER sweep

      Usage:
        sweep config=PATH [key=value ...] [--dry-run] [--verbose]

      Runs each scenario defined in the YAML file as an independent simulate run. Scenarios live under a
      'scenarios' mapping (name -> simulate keys) or in top-level 'scenario_<name>' sections, and override the
      common and simulate sections. Keys given on the command line override every scenario.

      Options:
        config=PATH                YAML file with common/simulate sections and scenarios (required)
        scenarios=A,B,...          Run only the named scenarios, in the given order
        reportDir=PATH             Write one JSON report per scenario as PATH/<scenario>.json
        --dry-run                  List the scenarios and their settings without running
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Scenario keys:
        Any simulate key (see simulate --help). simulation_time, image_size, packet_size, data_rate and delay
        are accepted as aliases of simulationTime, imageSize, fragmentSize, dataRate and linkDelay.
      """;

  private SweepCli() {}

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
   * Executes the sweep command and returns its exit code.
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

    List<ResolvedScenario> resolved;
    Optional<Path> reportDir;
    ExporterSettings exporter;
    try {
      Map<String, String> cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      String configPath = ConfigCliUtils.extractConfigPath(cli);
      if (configPath == null) {
        throw new IllegalArgumentException("sweep requires config=PATH");
      }
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      Set<String> selected = parseSelection(cli.remove("scenarios"));
      reportDir = Optional.ofNullable(cli.remove("reportDir")).filter(v -> !v.isBlank()).map(Path::of);
      if (input.verbose() || ConfigCliUtils.parseBoolean(cli, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for sweep");
      }

      Map<String, String> base = YamlConfigLoader.load(yamlPath, "simulate").orElse(Map.of());
      List<Scenario> scenarios = select(YamlConfigLoader.loadScenarios(yamlPath), selected, yamlPath);
      Map<String, String> baseEffective = ConfigMerger.buildEffectiveConfig(
          "simulate", Optional.of(base), cli, DefaultsForMode.asFlatMap("simulate"), log::warn);
      exporter = TelemetryConfigurator.configureMetrics(baseEffective);
      resolved = new ArrayList<>(scenarios.size());
      for (Scenario scenario : scenarios) {
        resolved.add(new ResolvedScenario(scenario, scenario.toConfig(base, cli, log::warn)));
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sweep configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.forFailure(ex);
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      CliPrinter.printLines(planLines(resolved));
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(exporter)) {
      List<SweepResult> results = new ArrayList<>(resolved.size());
      int index = 1;
      for (ResolvedScenario entry : resolved) {
        log.info("Scenario {} ({}/{}): {}", entry.scenario().name(), index++, resolved.size(),
            entry.scenario().description().isEmpty() ? "no description" : entry.scenario().description());
        SimulationSummary summary = SimulateCli.simulate(entry.config(), metrics);
        results.add(new SweepResult(entry.scenario(), entry.config(), summary));
      }
      CliPrinter.printLines(SummaryPrinter.renderSweep(results));
      if (reportDir.isPresent()) {
        JsonReportWriter writer = new JsonReportWriter();
        for (SweepResult result : results) {
          writer.write(result.summary(), reportDir.get().resolve(result.scenario().name() + ".json"));
        }
        CliPrinter.println("Reports written to " + reportDir.get());
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Sweep configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Sweep I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in sweep", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Set<String> parseSelection(String raw) {
    Set<String> names = new LinkedHashSet<>();
    if (raw == null) {
      return names;
    }
    Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(names::add);
    return names;
  }

  private static List<Scenario> select(List<Scenario> all, Set<String> selected, Path source) {
    if (all.isEmpty()) {
      throw new ConfigurationException("No scenarios defined in " + source);
    }
    if (selected.isEmpty()) {
      return all;
    }
    Map<String, Scenario> byName = new LinkedHashMap<>();
    all.forEach(s -> byName.put(s.name(), s));
    List<Scenario> out = new ArrayList<>(selected.size());
    for (String name : selected) {
      Scenario scenario = byName.get(name);
      if (scenario == null) {
        throw new ConfigurationException("Unknown scenario " + name + "; defined: " + byName.keySet());
      }
      out.add(scenario);
    }
    return out;
  }

  private static List<String> planLines(List<ResolvedScenario> resolved) {
    List<String> lines = new ArrayList<>();
    lines.add("COURIER sweep dry-run: " + resolved.size() + " scenarios");
    for (ResolvedScenario entry : resolved) {
      SimulationConfig config = entry.config();
      String description = entry.scenario().description();
      lines.add("  " + entry.scenario().name() + (description.isEmpty() ? "" : ": " + description));
      lines.add("    fragmentSize=" + config.fragmentSize() + ", dataRate=" + Units.formatRate(config.dataRateBps())
          + ", linkRate=" + Units.formatRate(config.linkRateBps()) + ", linkDelay=" + config.linkDelayNanos()
          + "ns, imageSize=" + config.imageSize() + ", simulationTime=" + config.simulationTimeNanos() + "ns");
    }
    lines.add("Dry-run complete. Remove --dry-run to run the sweep.");
    return lines;
  }

  private record ResolvedScenario(Scenario scenario, SimulationConfig config) {}

  /**
   * Outcome of one scenario of a sweep.
   *
   * @param scenario scenario that was run
   * @param config resolved configuration
   * @param summary run results
   */
  record SweepResult(Scenario scenario, SimulationConfig config, SimulationSummary summary) {}
}
