package ca.gc.cra.courier.config;

import static ca.gc.cra.courier.config.ConfigValues.optionalString;
import static ca.gc.cra.courier.config.ConfigValues.parseDouble;
import static ca.gc.cra.courier.config.ConfigValues.required;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed configuration of the {@code classify} command.
 *
 * @param imageDir directory of images to classify
 * @param classes active destination classes
 * @param confidenceThreshold classifier distance threshold
 * @param fallbackClass optional fallback class
 * @param classifierScript optional scripted classifier results
 * @since 0.1.0
 */
public record ClassifyConfig(
    Path imageDir,
    List<DestinationClass> classes,
    double confidenceThreshold,
    Optional<DestinationClass> fallbackClass,
    Optional<String> classifierScript) {

  /**
   * Validates the configuration.
   *
   * @throws ConfigurationException if the threshold is invalid
   */
  public ClassifyConfig {
    Objects.requireNonNull(imageDir, "imageDir");
    classes = List.copyOf(classes);
    Objects.requireNonNull(fallbackClass, "fallbackClass");
    Objects.requireNonNull(classifierScript, "classifierScript");
    if (!Double.isFinite(confidenceThreshold) || confidenceThreshold <= 0) {
      throw new ConfigurationException("confidenceThreshold must be a positive number (was " + confidenceThreshold + ")");
    }
  }

  /**
   * Builds a configuration from a flat key/value map.
   *
   * @param args merged configuration
   * @return validated configuration
   * @throws ConfigurationException if {@code imageDir} is missing or a value is invalid
   */
  public static ClassifyConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    List<DestinationClass> classes = ConfigValues.parseClasses(args.get("classes"));
    return new ClassifyConfig(
        Path.of(required(args, "imageDir")),
        classes,
        parseDouble(args, "confidenceThreshold"),
        ConfigValues.parseFallback(args.get("fallbackClass"), classes),
        optionalString(args.get("classifierScript")));
  }
}
