package ca.gc.cra.lazypull.config.settings;

import ca.gc.cra.lazypull.config.daemon.FsDriver;
import ca.gc.cra.lazypull.config.daemon.UnsupportedDriverException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges settings from defaults, YAML and CLI with precedence CLI &gt; YAML &gt; defaults.
 *
 * @since 0.1.0
 */
public final class SettingsMerger {

  private SettingsMerger() {}

  /**
   * Builds the effective flat settings.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI overrides already expressed as settings keys (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveSettings(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String driver = effective.get(SnapshotterSettings.FS_DRIVER);
    if (driver != null && !driver.isBlank()) {
      try {
        FsDriver.fromId(driver);
      } catch (UnsupportedDriverException ex) {
        throw new IllegalArgumentException(SnapshotterSettings.FS_DRIVER + ": " + ex.getMessage(), ex);
      }
    }
  }
}
