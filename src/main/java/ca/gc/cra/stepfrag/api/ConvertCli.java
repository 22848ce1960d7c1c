package ca.gc.cra.stepfrag.api;

import ca.gc.cra.stepfrag.application.convert.ConversionOrchestrator;
import ca.gc.cra.stepfrag.config.CompositionRoot;
import ca.gc.cra.stepfrag.config.ConvertConfig;
import ca.gc.cra.stepfrag.domain.convert.ConversionResult;
import ca.gc.cra.stepfrag.infrastructure.report.ResultLineFormatter;
import ca.gc.cra.stepfrag.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for converting one exchange file into a fragments artifact.
 *
 * <p>Stdout carries exactly one {@value ResultLineFormatter#MARKER} line once a conversion has been attempted;
 * it is always the last line written.</p>
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final Set<String> KNOWN_FLAGS = Set.of("--preflight");
  private static final String SUMMARY_USAGE =
      "usage: convert in=PATH [out=PATH] [config=PATH] [fragmentExtension=.frag] [chunkBytes=N] "
          + "[compressionLevel=0..9] [--preflight] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--verbose]";
  private static final String HELP_TEXT = """
      STEPFRAG convert

      Usage:
        convert in=./model.ifc [out=./model.frag] [options]

      Required:
        in=PATH                    ISO-10303-21 exchange file to convert

      Optional:
        out=PATH                   Artifact path (default: input directory, extension replaced)
        config=PATH                YAML file with common/convert sections
        fragmentExtension=.frag    Extension used when out is not given
        chunkBytes=N               Bytes per parser read (default 65536)
        compressionLevel=0..9      DEFLATE level (default 6)
        --preflight                Profile the input first and log memory advisories
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Output:
        The last stdout line is CONVERSION_RESULT_JSON: {...}; exit status is 0 on success, 1 otherwise.
        Logs are written to stderr.
      """;

  private ConvertCli() {}

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
    return run(args, CompositionRoot::new);
  }

  /**
   * Executes the convert command.
   *
   * @param args raw CLI arguments
   * @param roots supplies the composition root once arguments are valid
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, Supplier<CompositionRoot> roots) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert CLI");
    }
    for (String flag : input.unknownFlags(KNOWN_FLAGS)) {
      log.warn("Ignoring unknown flag {}", flag);
    }

    ConvertConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      if (input.hasFlag("--preflight")) {
        kv.put("preflight", "true");
      }
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("convert", kv, log);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      String exporter = TelemetryConfigurator.configureMetrics(effective);
      config = ConvertConfig.fromMap(effective);
      log.debug("Configured convert: in={}, out={}, chunkBytes={}, compressionLevel={}, metricsExporter={}",
          config.input(), config.resolveOutput(), config.chunkBytes(), config.compressionLevel(), exporter);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid convert arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CompositionRoot root = roots.get();
    try {
      if (config.preflight()) {
        preflight(root, config.input());
      }
      ConversionOrchestrator orchestrator = root.conversionOrchestrator(config.parserSettings());
      ConversionResult result = orchestrator.convert(config.input(), config.resolveOutput());
      CliPrinter.println(new ResultLineFormatter().format(result));
      return result.success() ? ExitCode.SUCCESS : ExitCode.FAILURE;
    } finally {
      closeRoot(root);
    }
  }

  private static void preflight(CompositionRoot root, Path input) {
    try {
      root.fileProfiler().profile(input);
    } catch (IOException ex) {
      log.warn("Preflight could not profile {}: {}", input, ex.toString());
    }
  }

  private static void closeRoot(CompositionRoot root) {
    try {
      root.close();
    } catch (Exception ex) {
      log.warn("Failed to release telemetry resources", ex);
    }
  }
}
