package ca.gc.cra.courier.api;

import ca.gc.cra.courier.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * COURIER CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: courier <simulate|sweep|classify> [options]";
  private static final String HELP_TEXT = """
      COURIER command dispatcher

      Usage:
        courier <command> [options]

      Commands:
        simulate    Classify payloads and simulate paced delivery (simulate --help for details)
        sweep       Run the scenarios of a YAML file as separate simulations and compare them
        classify    Classify a directory of images and print binding decisions

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "simulate" -> SimulateCli.run(delegateArgs);
      case "sweep" -> SweepCli.run(delegateArgs);
      case "classify" -> ClassifyCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags may precede or follow the command name; everything except the name itself is forwarded.
  private static String[] delegateArgs(String[] args, String commandToken) {
    boolean skipped = false;
    String[] out = new String[args.length - 1];
    int i = 0;
    for (String arg : args) {
      if (!skipped && arg != null && arg.trim().equals(commandToken)) {
        skipped = true;
        continue;
      }
      if (i < out.length) {
        out[i++] = arg;
      }
    }
    return Arrays.copyOf(out, i);
  }
}
