package ca.gc.cra.courier.config;

import ca.gc.cra.courier.validation.ConfigurationException;
import ca.gc.cra.courier.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * One named entry of a {@code sweep}: a set of {@code simulate} keys that override the base configuration.
 *
 * <p>The keys {@code simulation_time}, {@code image_size}, {@code packet_size}, {@code data_rate}, and {@code delay}
 * are accepted as aliases of {@code simulationTime}, {@code imageSize}, {@code fragmentSize}, {@code dataRate}, and
 * {@code linkDelay}. A bare number for a duration is seconds.</p>
 *
 * @param name scenario name, unique within a sweep; letters, digits, {@code .}, {@code _}, and {@code -}
 * @param description free text; empty when absent
 * @param overrides {@code simulate} keys set by the scenario
 * @since 0.1.0
 */
public record Scenario(String name, String description, Map<String, String> overrides) {
  private static final Map<String, String> ALIASES = Map.of(
      "simulation_time", "simulationTime",
      "image_size", "imageSize",
      "packet_size", "fragmentSize",
      "data_rate", "dataRate",
      "delay", "linkDelay");

  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");

  /**
   * Validates the name and copies the overrides.
   *
   * @throws ConfigurationException if the name is blank or uses other characters
   */
  public Scenario {
    name = Strings.requireNonBlank("scenario name", name);
    if (!NAME.matcher(name).matches()) {
      throw new ConfigurationException("Scenario name '" + name + "' may only use letters, digits, '.', '_' and '-'");
    }
    description = Objects.requireNonNull(description, "description").trim();
    overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides"));
  }

  /**
   * Builds a scenario from a flattened YAML section, resolving aliases and extracting {@code description}.
   *
   * @param name scenario name
   * @param values flattened section
   * @return scenario
   */
  public static Scenario of(String name, Map<String, String> values) {
    Map<String, String> overrides = new LinkedHashMap<>();
    String description = "";
    for (Map.Entry<String, String> entry : values.entrySet()) {
      String key = entry.getKey();
      if (key.equals("description")) {
        description = entry.getValue();
        continue;
      }
      overrides.put(ALIASES.getOrDefault(key, key), entry.getValue());
    }
    return new Scenario(name, description, overrides);
  }

  /**
   * Resolves the configuration of this scenario. Precedence is CLI &gt; scenario &gt; base YAML &gt; defaults.
   *
   * @param baseYaml flattened {@code common} and {@code simulate} sections
   * @param cli CLI overrides
   * @param warn receives warnings about unknown or overridden keys
   * @return validated configuration
   * @throws ConfigurationException if a value is invalid; the message names the scenario
   */
  public SimulationConfig toConfig(Map<String, String> baseYaml, Map<String, String> cli, Consumer<String> warn) {
    Map<String, String> yaml = new LinkedHashMap<>(baseYaml);
    yaml.putAll(overrides);
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          "simulate", Optional.of(yaml), cli, DefaultsForMode.asFlatMap("simulate"), warn);
      return SimulationConfig.fromMap(effective);
    } catch (ConfigurationException ex) {
      throw new ConfigurationException("Scenario " + name + ": " + ex.getMessage(), ex);
    }
  }
}
