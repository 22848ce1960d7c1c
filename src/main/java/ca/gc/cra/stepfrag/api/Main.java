package ca.gc.cra.stepfrag.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * STEPFRAG CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: stepfrag <convert|profile> [options]";
  private static final String HELP_TEXT = """
      STEPFRAG command dispatcher

      Usage:
        stepfrag <command> [options]

      Commands:
        convert     Convert an exchange file into a fragments artifact (convert --help for details)
        profile     Print a preflight report for an exchange file (profile --help for details)

      Global flags:
        --help      Show this message (or the command's help when given after a command)
        --verbose   Enable DEBUG logging
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
   * <p>The first argument that is not a flag names the command; every other argument is passed through.</p>
   *
   * @param args dispatcher arguments
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (command == null && arg != null && !arg.isBlank() && !arg.trim().startsWith("-")) {
          command = arg.trim().toLowerCase(Locale.ROOT);
        } else if (arg != null) {
          delegate.add(arg);
        }
      }
    }
    if (command == null) {
      if (CliInput.parse(args).help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case "convert" -> ConvertCli.run(delegateArgs);
      case "profile" -> ProfileCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
