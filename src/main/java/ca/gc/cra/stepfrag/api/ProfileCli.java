package ca.gc.cra.stepfrag.api;

import ca.gc.cra.stepfrag.config.CompositionRoot;
import ca.gc.cra.stepfrag.config.ProfileConfig;
import ca.gc.cra.stepfrag.domain.profile.FileProfile;
import ca.gc.cra.stepfrag.infrastructure.report.ProfileReportFormatter;
import ca.gc.cra.stepfrag.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the preflight report on one exchange file.
 *
 * @since 0.1.0
 */
public final class ProfileCli {
  private static final Logger log = LoggerFactory.getLogger(ProfileCli.class);
  private static final String SUMMARY_USAGE = "usage: profile in=PATH [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      STEPFRAG profile

      Usage:
        profile in=./model.ifc

      Prints size, size tier, header validity, declared schema, encoding check,
      memory recommendations and the estimated RAM compared with the current max heap.
      Only the first 1024 bytes of the file are read.

      Options:
        in=PATH      Exchange file to inspect (required)
        config=PATH  YAML file with common/profile sections
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private ProfileCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new, new ProfileReportFormatter());
  }

  static ExitCode run(String[] args, Supplier<CompositionRoot> roots, ProfileReportFormatter formatter) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for profile CLI");
    }

    ProfileConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("profile", kv, log);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = ProfileConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid profile arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CompositionRoot root = roots.get();
    try {
      FileProfile profile = root.fileProfiler().profile(config.input());
      CliPrinter.printLines(formatter.format(profile));
      return ExitCode.SUCCESS;
    } catch (NoSuchFileException ex) {
      log.error("Input file not found: {}", config.input());
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Unable to profile {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } finally {
      try {
        root.close();
      } catch (Exception ex) {
        log.warn("Failed to release telemetry resources", ex);
      }
    }
  }
}
