package ca.gc.cra.lazypull.config.settings;

import ca.gc.cra.lazypull.config.daemon.FsDriver;
import ca.gc.cra.lazypull.config.daemon.UnsupportedDriverException;
import ca.gc.cra.lazypull.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective settings of the configuration subsystem after merging defaults,
 * the YAML settings file and CLI overrides.
 * <p><strong>Keys:</strong></p>
 * <ul>
 *   <li>{@code daemon.fs_driver}: {@code fusedev} (default) or {@code fscache};</li>
 *   <li>{@code daemon.nydusd_config}: JSON template for the daemon configuration;</li>
 *   <li>{@code daemon.mirrors_config_dir}: optional mirrors root;</li>
 *   <li>{@code auth.docker_config}: optional Docker client {@code config.json}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param fsDriver filesystem driver of the daemon
 * @param nydusdConfig template path; may be {@code null} for commands that take it elsewhere
 * @param mirrorsConfigDir mirrors root; {@code null} when mirrors are not configured
 * @param dockerConfig Docker client configuration; {@code null} when not configured
 * @since 0.1.0
 */
public record SnapshotterSettings(
    FsDriver fsDriver,
    Path nydusdConfig,
    Path mirrorsConfigDir,
    Path dockerConfig) {

  public static final String FS_DRIVER = "daemon.fs_driver";
  public static final String NYDUSD_CONFIG = "daemon.nydusd_config";
  public static final String MIRRORS_CONFIG_DIR = "daemon.mirrors_config_dir";
  public static final String DOCKER_CONFIG = "auth.docker_config";

  public SnapshotterSettings {
    Objects.requireNonNull(fsDriver, "fsDriver");
  }

  /**
   * Embedded defaults in flat-key form.
   *
   * @return immutable defaults
   */
  public static Map<String, String> defaults() {
    return Map.of(FS_DRIVER, FsDriver.FUSEDEV.id());
  }

  /**
   * Binds a merged flat map.
   *
   * @param effective merged settings
   * @return settings
   * @throws IllegalArgumentException when the driver is unsupported or a path is malformed
   */
  public static SnapshotterSettings fromMap(Map<String, String> effective) {
    Objects.requireNonNull(effective, "effective");
    String driverId = effective.getOrDefault(FS_DRIVER, FsDriver.FUSEDEV.id());
    FsDriver driver;
    try {
      driver = FsDriver.fromId(driverId);
    } catch (UnsupportedDriverException ex) {
      throw new IllegalArgumentException(FS_DRIVER + ": " + ex.getMessage(), ex);
    }
    return new SnapshotterSettings(
        driver,
        optionalPath(effective, NYDUSD_CONFIG).orElse(null),
        optionalPath(effective, MIRRORS_CONFIG_DIR).orElse(null),
        optionalPath(effective, DOCKER_CONFIG).orElse(null));
  }

  /**
   * @return template path, if configured
   */
  public Optional<Path> template() {
    return Optional.ofNullable(nydusdConfig);
  }

  private static Optional<Path> optionalPath(Map<String, String> effective, String key) {
    String value = Strings.trimToNull(effective.get(key));
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(value));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }
}
