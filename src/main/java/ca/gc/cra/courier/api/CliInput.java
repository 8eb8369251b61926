package ca.gc.cra.courier.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Raw CLI arguments split into flags ({@code --dry-run}) and {@code key=value} pairs.
 *
 * <p>Help ({@code --help}, {@code -h}, {@code help}) and verbose ({@code --verbose}, {@code -v}, {@code --debug})
 * aliases are normalized to their long form.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments in order.
   *
   * @return arguments intended for the subcommand name and {@code key=value} parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether help output was requested.
   *
   * @return {@code true} when a help alias was present
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when a verbose alias was present
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all normalized flags.
   *
   * @return lowercase flags
   */
  public Set<String> flags() {
    return flags;
  }
}
