package ca.gc.cra.courier.config;

import ca.gc.cra.courier.validation.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked for keys that are overridden by the CLI or unknown to the mode
   * @return immutable merged configuration map
   * @throws ConfigurationException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(entry.getKey()) && warn != null) {
        warn.accept("Ignoring unknown YAML key for " + mode + ": " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String imageDir = trim(effective.get("imageDir"));
    String script = trim(effective.get("classifierScript"));
    if ("classify".equalsIgnoreCase(mode) && imageDir.isEmpty()) {
      throw new ConfigurationException("imageDir is required for classify");
    }
    if ("simulate".equalsIgnoreCase(mode) && !script.isEmpty() && !imageDir.isEmpty()) {
      throw new ConfigurationException("classifierScript cannot be combined with imageDir");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
