package ca.gc.cra.courier.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads COURIER configuration from a YAML document and flattens sections into simple key/value maps.
 *
 * <p>The {@code common} section applies to every mode and is overlaid by the section named after the mode. Nested
 * mappings flatten to dotted keys; sequences of scalars (for example {@code classes: [MESSI, NEYMAR]}) flatten to
 * comma-separated values.</p>
 */
public final class YamlConfigLoader {
  private static final String SCENARIO_PREFIX = "scenario_";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode ({@code simulate} or {@code classify})
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, Object> root = readRoot(path);
    Map<String, String> flattened = new LinkedHashMap<>();
    Object commonSection = findSection(root, "common");
    if (commonSection != null) {
      flatten(asMap(commonSection, "common"), "", flattened);
    }
    Object modeSection = findSection(root, normalizedMode);
    if (modeSection != null) {
      flatten(asMap(modeSection, normalizedMode), "", flattened);
    }
    return Optional.of(Map.copyOf(flattened));
  }

  /**
   * Loads the named scenarios of a sweep in document order.
   *
   * <p>Scenarios come from the {@code scenarios} mapping (name to overrides) and from top-level sections whose name
   * starts with {@code scenario_}. Each scenario is flattened like a mode section.</p>
   *
   * @param path location of the YAML configuration
   * @return scenarios; empty when the file does not exist or defines none
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid or a name repeats
   */
  public static List<Scenario> loadScenarios(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return List.of();
    }
    Map<String, Object> root = readRoot(path);
    Map<String, Map<String, String>> byName = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      String key = entry.getKey().trim();
      if (key.equalsIgnoreCase("scenarios")) {
        if (entry.getValue() == null) {
          continue;
        }
        for (Map.Entry<String, Object> scenario : asMap(entry.getValue(), "scenarios").entrySet()) {
          addScenario(byName, scenario.getKey().trim(), scenario.getValue());
        }
      } else if (key.toLowerCase(Locale.ROOT).startsWith(SCENARIO_PREFIX)) {
        addScenario(byName, key, entry.getValue());
      }
    }
    List<Scenario> scenarios = new ArrayList<>(byName.size());
    byName.forEach((name, values) -> scenarios.add(Scenario.of(name, values)));
    return List.copyOf(scenarios);
  }

  private static void addScenario(Map<String, Map<String, String>> byName, String name, Object section) {
    Map<String, String> values = new LinkedHashMap<>();
    if (section != null) {
      flatten(asMap(section, name), "", values);
    }
    if (byName.putIfAbsent(name, values) != null) {
      throw new IllegalArgumentException("Scenario " + name + " is defined more than once");
    }
  }

  private static Map<String, Object> readRoot(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Map.of();
      }
      return asMap(document, "root");
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joiner = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequence for key " + key + " must contain scalars only");
      }
      joiner.add(item == null ? "" : item.toString());
    }
    return joiner.toString();
  }
}
