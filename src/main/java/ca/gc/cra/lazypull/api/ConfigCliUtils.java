package ca.gc.cra.lazypull.api;

import ca.gc.cra.lazypull.config.settings.SettingsMerger;
import ca.gc.cra.lazypull.config.settings.SnapshotterSettings;
import ca.gc.cra.lazypull.config.settings.SnapshotterSettingsLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers mixing CLI arguments with the YAML settings file.
 */
final class ConfigCliUtils {
  /** CLI argument name to settings key. */
  static final Map<String, String> SETTINGS_ALIASES = Map.of(
      "driver", SnapshotterSettings.FS_DRIVER,
      "template", SnapshotterSettings.NYDUSD_CONFIG,
      "mirrorsDir", SnapshotterSettings.MIRRORS_CONFIG_DIR,
      "dockerConfig", SnapshotterSettings.DOCKER_CONFIG);

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Resolves the effective settings from the optional {@code config=} file and the CLI aliases.
   * Consumed alias keys are removed from {@code args}.
   *
   * @throws IllegalArgumentException when the settings file is missing or invalid
   * @throws IOException when the settings file cannot be read
   */
  static SnapshotterSettings resolveSettings(Map<String, String> args, Logger log) throws IOException {
    String configPath = extractConfigPath(args);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = SnapshotterSettingsLoader.load(yamlPath);
    }
    Map<String, String> cli = new LinkedHashMap<>();
    for (Map.Entry<String, String> alias : SETTINGS_ALIASES.entrySet()) {
      String value = args.remove(alias.getKey());
      if (value != null) {
        cli.put(alias.getValue(), value);
      }
    }
    Map<String, String> effective = SettingsMerger.buildEffectiveSettings(
        yaml, cli, SnapshotterSettings.defaults(), log::warn);
    return SnapshotterSettings.fromMap(effective);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
