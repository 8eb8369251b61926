package ca.gc.cra.courier.api;

import ca.gc.cra.courier.application.port.ClassifierPort;
import ca.gc.cra.courier.application.port.MetricsPort;
import ca.gc.cra.courier.application.routing.BindingDecision;
import ca.gc.cra.courier.application.routing.ClassifierBinding;
import ca.gc.cra.courier.config.ClassifyConfig;
import ca.gc.cra.courier.config.CompositionRoot;
import ca.gc.cra.courier.domain.classify.ClassificationResult;
import ca.gc.cra.courier.domain.payload.Payload;
import ca.gc.cra.courier.infrastructure.payload.DirectoryPayloadSource;
import ca.gc.cra.courier.logging.Logs;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code classify} subcommand: classifies every image in a directory and prints the binding
 * decision for each, without simulating delivery.
 *
 * @since 0.1.0
 */
public final class ClassifyCli {
  private static final Logger log = LoggerFactory.getLogger(ClassifyCli.class);
  private static final String SUMMARY_USAGE =
      "usage: classify imageDir=PATH [classes=A,B,...] [confidenceThreshold=X] [fallbackClass=CLASS] "
          + "[classifierScript=C:S,...] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      COURIER classify

      Usage:
        classify imageDir=./images [options]

      Required:
        imageDir=PATH              Directory of .jpg/.jpeg/.png files

      Optional:
        classes=MESSI,RONALDO,...  Active destination classes (default all five)
        confidenceThreshold=X      Accept results whose distance is below X (default 100.0)
        fallbackClass=CLASS        Class receiving low-confidence and unknown images
        classifierScript=C:S,...   Replay fixed results instead of pattern matching
        config=PATH                YAML file with common/classify sections
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ClassifyCli() {}

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
   * Executes the classify command and returns its exit code.
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

    ClassifyConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("classify", input, log);
      config = ClassifyConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid classify configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.forFailure(ex);
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      List<Payload> payloads = new DirectoryPayloadSource(config.imageDir()).load();
      ClassifierPort classifier = CompositionRoot.classifier(config.classifierScript(), config.classes());
      ClassifierBinding binding = CompositionRoot.binding(config, MetricsPort.NO_OP);
      for (Payload payload : payloads) {
        CliPrinter.println(describe(payload, binding.decide(classifySafely(classifier, payload))));
      }
      CliPrinter.printf("Classified %d images: %d dropped", payloads.size(), binding.droppedCount());
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Classify configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read images from {}", config.imageDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in classify", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ClassificationResult classifySafely(ClassifierPort classifier, Payload payload) {
    try {
      ClassificationResult result = classifier.classify(payload.data());
      return result == null ? ClassificationResult.unresolved() : result;
    } catch (RuntimeException ex) {
      log.warn("Could not classify image {}: {}", Logs.truncate(payload.label(), 128), ex.getMessage());
      return ClassificationResult.unresolved();
    }
  }

  static String describe(Payload payload, BindingDecision decision) {
    ClassificationResult result = decision.classification();
    String classified = result.isUnresolved()
        ? result.destinationClass().displayName()
        : String.format(Locale.ROOT, "%s (score %.2f)", result.destinationClass().displayName(), result.score());
    String route = decision.route()
        .map(d -> d.destinationClass().displayName() + " at " + d.endpoint())
        .orElse("dropped");
    return payload.label() + ": " + classified + " -> " + route + " [" + decision.reason() + "]";
  }
}
