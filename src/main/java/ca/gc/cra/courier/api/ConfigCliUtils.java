package ca.gc.cra.courier.api;

import ca.gc.cra.courier.config.ConfigMerger;
import ca.gc.cra.courier.config.DefaultsForMode;
import ca.gc.cra.courier.config.YamlConfigLoader;
import ca.gc.cra.courier.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers that merge CLI arguments with YAML and embedded defaults for a subcommand.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Resolves the effective configuration of a subcommand.
   *
   * <p>Precedence is CLI &gt; YAML ({@code config=PATH}) &gt; defaults. {@code --dry-run} is equivalent to
   * {@code dryRun=true}. Verbose logging is enabled when {@code --verbose} or {@code verbose=true} is present.</p>
   *
   * @param mode subcommand name
   * @param input parsed arguments (subcommand name already removed)
   * @param log logger receiving precedence warnings
   * @return immutable effective configuration
   * @throws IllegalArgumentException if an argument is malformed, the YAML file is missing or invalid, or a value
   *     fails validation ({@link ca.gc.cra.courier.validation.ConfigurationException})
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, CliInput input, Logger log) throws IOException {
    Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    String configPath = extractConfigPath(kv);

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
    if (input.verbose() || parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }
    return effective;
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
