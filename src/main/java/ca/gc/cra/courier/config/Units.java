package ca.gc.cra.courier.config;

import ca.gc.cra.courier.validation.ConfigurationException;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses rate and duration literals such as {@code 1Mbps} and {@code 500ms}.
 *
 * <p>Rates accept {@code bps}, {@code Kbps}, {@code Mbps}, and {@code Gbps} (decimal multiples, case-insensitive);
 * a bare number is bits per second. Durations accept {@code ns}, {@code us}, {@code ms}, and {@code s}; a bare
 * number is seconds. Fractional values are allowed and rounded down to whole units.</p>
 *
 * @since 0.1.0
 */
public final class Units {
  private static final Pattern LITERAL = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*([A-Za-z]*)\\s*$");

  private Units() {
    // Utility
  }

  /**
   * Parses a rate.
   *
   * @param name configuration key for diagnostics
   * @param raw literal
   * @return bits per second
   * @throws ConfigurationException if the literal is malformed or the unit unknown
   */
  public static long parseRate(String name, String raw) {
    Matcher m = match(name, raw);
    long multiplier = switch (m.group(2).toLowerCase(Locale.ROOT)) {
      case "", "bps" -> 1L;
      case "kbps" -> 1_000L;
      case "mbps" -> 1_000_000L;
      case "gbps" -> 1_000_000_000L;
      default -> throw new ConfigurationException(name + " has unknown rate unit '" + m.group(2) + "'");
    };
    return scale(name, m.group(1), multiplier);
  }

  /**
   * Parses a duration.
   *
   * @param name configuration key for diagnostics
   * @param raw literal
   * @return nanoseconds
   * @throws ConfigurationException if the literal is malformed or the unit unknown
   */
  public static long parseDurationNanos(String name, String raw) {
    Matcher m = match(name, raw);
    long multiplier = switch (m.group(2).toLowerCase(Locale.ROOT)) {
      case "ns" -> 1L;
      case "us" -> 1_000L;
      case "ms" -> 1_000_000L;
      case "", "s" -> 1_000_000_000L;
      default -> throw new ConfigurationException(name + " has unknown duration unit '" + m.group(2) + "'");
    };
    return scale(name, m.group(1), multiplier);
  }

  /**
   * Renders a rate for display.
   *
   * @param bitsPerSecond rate
   * @return literal such as {@code 1Mbps} or {@code 1500Kbps}
   */
  public static String formatRate(long bitsPerSecond) {
    if (bitsPerSecond % 1_000_000_000L == 0) {
      return bitsPerSecond / 1_000_000_000L + "Gbps";
    }
    if (bitsPerSecond % 1_000_000L == 0) {
      return bitsPerSecond / 1_000_000L + "Mbps";
    }
    if (bitsPerSecond % 1_000L == 0) {
      return bitsPerSecond / 1_000L + "Kbps";
    }
    return bitsPerSecond + "bps";
  }

  private static Matcher match(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigurationException(name + " must not be blank");
    }
    Matcher m = LITERAL.matcher(raw);
    if (!m.matches()) {
      throw new ConfigurationException(name + " is not a valid literal: '" + raw + "'");
    }
    return m;
  }

  private static long scale(String name, String number, long multiplier) {
    try {
      return new BigDecimal(number).multiply(BigDecimal.valueOf(multiplier)).longValueExact();
    } catch (ArithmeticException ex) {
      BigDecimal scaled = new BigDecimal(number).multiply(BigDecimal.valueOf(multiplier));
      if (scaled.signum() >= 0 && scaled.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
        return scaled.longValue();
      }
      throw new ConfigurationException(name + " is out of range: " + number, ex);
    }
  }
}
