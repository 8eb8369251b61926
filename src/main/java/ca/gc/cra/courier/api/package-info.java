/**
 * <strong>Purpose:</strong> Command-line entry points for the {@code simulate}, {@code sweep}, and {@code classify}
 * subcommands.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments, merges them with YAML and defaults, and maps failures
 * to {@link ca.gc.cra.courier.api.ExitCode} values.
 * <p><strong>Output:</strong> Results go to stdout through {@link ca.gc.cra.courier.api.CliPrinter}; logs go to
 * stderr.
 *
 * @since 0.1.0
 */
package ca.gc.cra.courier.api;
