package ca.gc.cra.lazypull.config.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lazypull.config.daemon.FsDriver;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SettingsMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = SettingsMerger.buildEffectiveSettings(
        Optional.of(Map.of(SnapshotterSettings.FS_DRIVER, "fscache",
            SnapshotterSettings.NYDUSD_CONFIG, "/yaml/template.json")),
        Map.of(SnapshotterSettings.NYDUSD_CONFIG, "/cli/template.json"),
        SnapshotterSettings.defaults(),
        warnings::add);

    assertEquals("fscache", effective.get(SnapshotterSettings.FS_DRIVER));
    assertEquals("/cli/template.json", effective.get(SnapshotterSettings.NYDUSD_CONFIG));
    assertEquals(List.of("CLI overrides YAML for key: daemon.nydusd_config"), warnings);
  }

  @Test
  void defaultsApplyWhenNothingElseIsSet() {
    SnapshotterSettings settings = SnapshotterSettings.fromMap(SettingsMerger.buildEffectiveSettings(
        Optional.empty(), Map.of(), SnapshotterSettings.defaults(), null));

    assertEquals(FsDriver.FUSEDEV, settings.fsDriver());
    assertNull(settings.mirrorsConfigDir());
    assertEquals(Optional.empty(), settings.template());
  }

  @Test
  void unsupportedDriverIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SettingsMerger.buildEffectiveSettings(
        Optional.empty(), Map.of(SnapshotterSettings.FS_DRIVER, "blockdev"), Map.of(), null));
  }

  @Test
  void bindsPaths() {
    SnapshotterSettings settings = SnapshotterSettings.fromMap(Map.of(
        SnapshotterSettings.FS_DRIVER, "fscache",
        SnapshotterSettings.NYDUSD_CONFIG, " /etc/template.json ",
        SnapshotterSettings.MIRRORS_CONFIG_DIR, "/etc/mirrors",
        SnapshotterSettings.DOCKER_CONFIG, ""));

    assertEquals(FsDriver.FSCACHE, settings.fsDriver());
    assertEquals(Path.of("/etc/template.json"), settings.nydusdConfig());
    assertEquals(Path.of("/etc/mirrors"), settings.mirrorsConfigDir());
    assertNull(settings.dockerConfig());
  }
}
