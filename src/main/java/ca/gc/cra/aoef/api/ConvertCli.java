package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.config.CompositionRoot;
import ca.gc.cra.aoef.config.ConvertConfig;
import ca.gc.cra.aoef.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.aoef.logging.LoggingConfigurator;
import ca.gc.cra.aoef.validation.Paths;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code aoef convert}: loads an AOEF file and saves a normalized copy.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final String SUMMARY_USAGE =
      "usage: convert in=FILE.json out=FILE.json [expect=TYPE] [audioDir=DIR] [outAudioDir=DIR] "
          + "[pretty=true|false] [--allow-overwrite] [config=FILE.yaml]";
  private static final String HELP_TEXT = """
      AOEF convert

      Usage:
        convert in=./export.json out=./normalized.json [options]

      Required:
        in=PATH                  Source AOEF file (.json)
        out=PATH                 Destination AOEF file (.json); parent directories are created

      Optional:
        expect=TYPE              Fail unless collection_type is TYPE
        audioDir=DIR             Resolve recording paths in the source against DIR
        outAudioDir=DIR          Write recording paths relative to DIR (default audioDir)
        pretty=true|false        Indent the output (default false)
        --allow-overwrite        Replace an existing output file
        config=PATH              YAML file with common/convert sections
        logLevel=LEVEL           Root log level (default INFO)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ConvertCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    MetricsPort metrics = MetricsPort.NO_OP;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("convert", CliArgsParser.toMap(input.keyValueArgs()), log);
      LoggingConfigurator.applyLevel(effective.get("logLevel"));
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      ConvertConfig config = ConvertConfig.fromMap(effective);
      boolean allowOverwrite = config.allowOverwrite() || input.hasFlag("--allow-overwrite");
      Paths.validateReadableJson("in", config.input());
      Paths.validateWritableJson("out", config.output(), allowOverwrite);
      config.audioDir().ifPresent(dir -> Paths.validateDirectory("audioDir", dir));
      metrics = TelemetryConfigurator.createMetrics(TelemetryConfigurator.settings(effective));

      log.info("Converting {} -> {} (audioDir={}, outAudioDir={})",
          config.input(), config.output(), config.audioDir().orElse(null), config.outAudioDir().orElse(null));
      CompositionRoot root = new CompositionRoot(metrics, new SystemClockAdapter());
      AoefDocument written = root.convertUseCase(config).convert(config);
      CliPrinter.println("Wrote " + written.data().kind().tag() + " " + written.data().uuid() + " to "
          + config.output());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      ExitCode code = CliFailures.handle("convert", ex, log);
      if (code == ExitCode.INVALID_ARGS) {
        CliPrinter.println(SUMMARY_USAGE);
      }
      return code;
    } finally {
      TelemetryConfigurator.shutdown(metrics);
    }
  }
}
