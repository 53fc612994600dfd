package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.application.pipeline.InspectReport;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.config.CompositionRoot;
import ca.gc.cra.aoef.config.InspectConfig;
import ca.gc.cra.aoef.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.aoef.logging.LoggingConfigurator;
import ca.gc.cra.aoef.validation.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code aoef inspect}: prints the envelope and per-table record counts of an AOEF file.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: inspect in=FILE.json [expect=TYPE] [verify=true|false] [config=FILE.yaml]";
  private static final String HELP_TEXT = """
      AOEF inspect

      Usage:
        inspect in=./annotations.json [options]

      Required:
        in=PATH                  AOEF file to inspect (.json)

      Optional:
        expect=TYPE              Fail unless collection_type is TYPE (for example dataset)
        verify=true|false        Rebuild the collection to check every reference (default true)
        config=PATH              YAML file with common/inspect sections
        logLevel=LEVEL           Root log level (default INFO)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private InspectCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    MetricsPort metrics = MetricsPort.NO_OP;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig("inspect", CliArgsParser.toMap(input.keyValueArgs()), log);
      LoggingConfigurator.applyLevel(effective.get("logLevel"));
      if (input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      InspectConfig config = InspectConfig.fromMap(effective);
      Paths.validateReadableJson("in", config.input());
      metrics = TelemetryConfigurator.createMetrics(TelemetryConfigurator.settings(effective));

      CompositionRoot root = new CompositionRoot(metrics, new SystemClockAdapter());
      InspectReport report = root.inspectUseCase().inspect(config);
      CliPrinter.printLines(render(config, report).toArray(String[]::new));
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      ExitCode code = CliFailures.handle("inspect", ex, log);
      if (code == ExitCode.INVALID_ARGS) {
        CliPrinter.println(SUMMARY_USAGE);
      }
      return code;
    } finally {
      TelemetryConfigurator.shutdown(metrics);
    }
  }

  static List<String> render(InspectConfig config, InspectReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("AOEF file    : " + config.input());
    lines.add(" Version     : " + report.version());
    lines.add(" Type        : " + report.kind().tag());
    lines.add(" UUID        : " + report.uuid());
    lines.add(" Created on  : " + report.createdOn());
    lines.add(" Verified    : " + (report.verified() ? "yes" : "no (verify=false)"));
    if (report.tableCounts().isEmpty()) {
      lines.add(" Tables      : <none>");
    } else {
      lines.add(" Tables:");
      report.tableCounts().forEach((table, count) ->
          lines.add(String.format("   %-24s %d", table, count)));
    }
    return lines;
  }
}
