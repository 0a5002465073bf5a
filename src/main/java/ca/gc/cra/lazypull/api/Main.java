package ca.gc.cra.lazypull.api;

import ca.gc.cra.lazypull.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * lazypull CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: lazypull <generate|show> [options]";
  private static final String HELP_TEXT = """
      lazypull daemon configuration tool

      Usage:
        lazypull <command> [options]

      Commands:
        generate    Supplement a template for an image and write the daemon config
        show        Print the redacted form of a template

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
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    CliInput input = CliInput.parse(raw);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    int commandIndex = Arrays.asList(raw).indexOf(remainder[0]);
    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = commandIndex < 0
        ? Arrays.copyOfRange(remainder, 1, remainder.length)
        : Arrays.copyOfRange(raw, commandIndex + 1, raw.length);

    return switch (command) {
      case "generate" -> GenerateCli.run(delegateArgs);
      case "show" -> ShowCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
