package ca.gc.cra.lazypull.api;

import ca.gc.cra.lazypull.application.redact.ConfigRedactor;
import ca.gc.cra.lazypull.config.daemon.DaemonConfig;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigException;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigFactory;
import ca.gc.cra.lazypull.config.settings.SnapshotterSettings;
import ca.gc.cra.lazypull.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the redacted form of a daemon configuration template.
 *
 * @since 0.1.0
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE =
      "usage: show template=PATH [driver=fusedev|fscache] [config=YAML]";

  private ShowCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    SnapshotterSettings settings;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      settings = ConfigCliUtils.resolveSettings(kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid show arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read settings file", ex);
      return ExitCode.IO_ERROR;
    }
    if (settings.template().isEmpty()) {
      log.error("show requires template=");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      DaemonConfig config = DaemonConfigFactory.create(settings.fsDriver(), settings.template().get());
      CliPrinter.println(ConfigRedactor.redactedString(config));
      return ExitCode.SUCCESS;
    } catch (DaemonConfigException ex) {
      log.error("Unable to load daemon config: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
  }
}
