package ca.gc.cra.lazypull.api;

import ca.gc.cra.lazypull.application.redact.ConfigRedactor;
import ca.gc.cra.lazypull.application.supplement.DaemonConfigSupplementer;
import ca.gc.cra.lazypull.application.supplement.MountRequest;
import ca.gc.cra.lazypull.config.daemon.DaemonConfig;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigException;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigFactory;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigs;
import ca.gc.cra.lazypull.config.settings.CompositionRoot;
import ca.gc.cra.lazypull.config.settings.SnapshotterSettings;
import ca.gc.cra.lazypull.infrastructure.auth.LabelKeychainProvider;
import ca.gc.cra.lazypull.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.lazypull.logging.LoggingConfigurator;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the runtime daemon configuration for one image: loads the template, supplements it with
 * registry host, mirrors and credentials, writes the full document for the daemon and prints the
 * redacted form.
 *
 * @since 0.1.0
 */
public final class GenerateCli {
  private static final Logger log = LoggerFactory.getLogger(GenerateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: generate template=PATH image=REF out=PATH [driver=fusedev|fscache] [snapshotId=ID] "
          + "[bootstrap=PATH] [vpc=true|false] [mirrorsDir=PATH] [dockerConfig=PATH] "
          + "[pullUsername=USER] [pullSecret=SECRET] [config=YAML]";
  private static final String HELP_TEXT = """
      lazypull generate

      Usage:
        generate template=./nydusd-config.json image=docker.io/library/busybox:latest out=./runtime.json

      Required:
        image=REF               Image reference being mounted
        out=PATH                Destination of the full configuration read by the daemon
        template=PATH           JSON template (or daemon.nydusd_config in config=YAML)

      Optional:
        driver=fusedev|fscache  Filesystem driver (default fusedev)
        snapshotId=ID           Snapshot identifier (fscache blob id)
        bootstrap=PATH          Bootstrap metadata path (fscache)
        vpc=true|false          Use the registry's private-network endpoint
        mirrorsDir=PATH         Mirrors root holding <host>/hosts.yaml
        dockerConfig=PATH       Docker client config.json used for credentials
        pullUsername=USER       Pull credentials passed as snapshot labels
        pullSecret=SECRET
        config=YAML             Settings file (CLI values take precedence)
        --verbose               Enable DEBUG logging
        --help                  Show this message
      """;

  private GenerateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for generate CLI");
    }

    Map<String, String> kv;
    SnapshotterSettings settings;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      settings = ConfigCliUtils.resolveSettings(kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid generate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read settings file", ex);
      return ExitCode.IO_ERROR;
    }

    String image = kv.get("image");
    String out = kv.get("out");
    if (image == null || out == null || settings.template().isEmpty()) {
      log.error("generate requires image=, out= and template=");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MountRequest request = new MountRequest(
        image,
        kv.getOrDefault("snapshotId", ""),
        ConfigCliUtils.parseBoolean(kv, "vpc"),
        labels(kv),
        params(kv));

    CompositionRoot root = new CompositionRoot(
        settings, new OpenTelemetryMetricsAdapter(GlobalOpenTelemetry.get()));
    DaemonConfigSupplementer supplementer = root.supplementer();
    Path template = settings.template().get();
    Path target = Path.of(out);
    try {
      DaemonConfig config = DaemonConfigFactory.create(settings.fsDriver(), template);
      supplementer.supplement(config, request);
      DaemonConfigs.dumpToFile(config, target);
      log.info("Wrote {} daemon config for {} to {}", settings.fsDriver().id(), image, target);
      CliPrinter.println(ConfigRedactor.redactedString(config));
      return ExitCode.SUCCESS;
    } catch (DaemonConfigException ex) {
      log.error("Unable to generate daemon config: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to write daemon config to {}", target, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while generating daemon config", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, String> labels(Map<String, String> kv) {
    Map<String, String> labels = new LinkedHashMap<>();
    if (kv.containsKey("pullUsername")) {
      labels.put(LabelKeychainProvider.USERNAME_LABEL, kv.get("pullUsername"));
    }
    if (kv.containsKey("pullSecret")) {
      labels.put(LabelKeychainProvider.SECRET_LABEL, kv.get("pullSecret"));
    }
    return labels;
  }

  private static Map<String, String> params(Map<String, String> kv) {
    String bootstrap = kv.get("bootstrap");
    return bootstrap == null ? Map.of() : Map.of(DaemonConfig.PARAM_BOOTSTRAP, bootstrap);
  }
}
