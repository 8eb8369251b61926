package ca.gc.cra.courier.config;

import ca.gc.cra.courier.domain.classify.DestinationClass;
import ca.gc.cra.courier.validation.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed accessors over flat configuration maps, shared by the mode-specific config records.
 */
final class ConfigValues {
  private ConfigValues() {
    // Utility
  }

  static String required(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(key + " is required");
    }
    return value.trim();
  }

  static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static Optional<Path> optionalPath(String value) {
    return optionalString(value).map(Path::of);
  }

  static int parseInt(Map<String, String> args, String key) {
    String raw = required(args, key);
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  static long parseLong(Map<String, String> args, String key) {
    String raw = required(args, key);
    try {
      return Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  static double parseDouble(Map<String, String> args, String key) {
    String raw = required(args, key);
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(key + " must be a number (was '" + raw + "')", ex);
    }
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  static List<DestinationClass> parseClasses(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigurationException("classes must name at least one destination class");
    }
    EnumSet<DestinationClass> seen = EnumSet.noneOf(DestinationClass.class);
    List<DestinationClass> classes = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      DestinationClass cls = parseClass("classes", token);
      if (!seen.add(cls)) {
        throw new ConfigurationException("classes lists " + cls + " more than once");
      }
      classes.add(cls);
    }
    if (classes.isEmpty()) {
      throw new ConfigurationException("classes must name at least one destination class");
    }
    return List.copyOf(classes);
  }

  static Optional<DestinationClass> parseFallback(String raw, List<DestinationClass> classes) {
    Optional<String> value = optionalString(raw);
    if (value.isEmpty()) {
      return Optional.empty();
    }
    DestinationClass cls = parseClass("fallbackClass", value.get());
    if (!classes.contains(cls)) {
      throw new ConfigurationException("fallbackClass " + cls + " is not among the active classes " + classes);
    }
    return Optional.of(cls);
  }

  private static DestinationClass parseClass(String key, String token) {
    DestinationClass cls;
    try {
      cls = DestinationClass.fromString(token);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(key + ": " + ex.getMessage(), ex);
    }
    if (!cls.isNamed()) {
      throw new ConfigurationException(key + " cannot use " + cls);
    }
    return cls;
  }
}
