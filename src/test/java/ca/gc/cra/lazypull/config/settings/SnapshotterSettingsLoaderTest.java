package ca.gc.cra.lazypull.config.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotterSettingsLoaderTest {

  @TempDir Path tempDir;

  @Test
  void flattensNestedSections() throws IOException {
    Path yaml = tempDir.resolve("lazypull.yaml");
    Files.writeString(yaml, """
        daemon:
          fs_driver: fscache
          nydusd_config: /etc/lazypull/nydusd-config.json
          mirrors_config_dir: /etc/lazypull/mirrors
        auth:
          docker_config: /root/.docker/config.json
        """);

    Map<String, String> map = SnapshotterSettingsLoader.load(yaml).orElseThrow();

    assertEquals("fscache", map.get("daemon.fs_driver"));
    assertEquals("/etc/lazypull/nydusd-config.json", map.get("daemon.nydusd_config"));
    assertEquals("/etc/lazypull/mirrors", map.get("daemon.mirrors_config_dir"));
    assertEquals("/root/.docker/config.json", map.get("auth.docker_config"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(SnapshotterSettingsLoader.load(tempDir.resolve("missing.yaml")).isPresent());
  }

  @Test
  void emptyFileYieldsEmptySettings() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), SnapshotterSettingsLoader.load(yaml).orElseThrow());
  }

  @Test
  void listRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, "- daemon\n");

    assertThrows(IllegalArgumentException.class, () -> SnapshotterSettingsLoader.load(yaml));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("arrays.yaml");
    Files.writeString(yaml, "daemon:\n  fs_driver: [fusedev]\n");

    assertThrows(IllegalArgumentException.class, () -> SnapshotterSettingsLoader.load(yaml));
  }
}
