package ca.gc.cra.lazypull.config.daemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lazypull.testutil.TemplateFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MirrorsConfigLoaderTest {

  @TempDir Path root;

  @Test
  void loadsMirrorsInFileOrder() throws IOException {
    TemplateFixtures.writeMirrors(root, "registry.example.com", """
        mirrors:
          - host: https://mirror-b.example.com
            headers:
              X-Origin: lazypull
            health_check_interval: 5
            failure_limit: 3
            ping_url: https://mirror-b.example.com/v2
          - host: https://mirror-a.example.com
        """);

    List<MirrorConfig> mirrors = MirrorsConfigLoader.load(root, "registry.example.com");

    assertEquals(2, mirrors.size());
    MirrorConfig first = mirrors.get(0);
    assertEquals("https://mirror-b.example.com", first.host());
    assertEquals(Map.of("X-Origin", "lazypull"), first.headers());
    assertEquals(5, first.healthCheckInterval());
    assertEquals(3, first.failureLimit());
    assertEquals("https://mirror-b.example.com/v2", first.pingUrl());
    assertEquals(MirrorConfig.of("https://mirror-a.example.com"), mirrors.get(1));
  }

  @Test
  void fallsBackToDefaultDirectory() throws IOException {
    TemplateFixtures.writeMirrors(root, MirrorsConfigLoader.DEFAULT_HOST_DIR, """
        mirrors:
          - host: https://fallback.example.com
        """);

    List<MirrorConfig> mirrors = MirrorsConfigLoader.load(root, "index.docker.io");

    assertEquals(List.of(MirrorConfig.of("https://fallback.example.com")), mirrors);
  }

  @Test
  void nothingConfiguredYieldsEmptyList() throws IOException {
    assertTrue(MirrorsConfigLoader.load(root, "registry.example.com").isEmpty());
    assertTrue(MirrorsConfigLoader.load(null, "registry.example.com").isEmpty());
  }

  @Test
  void missingRootIsReported() {
    Path missing = root.resolve("not-there");

    assertThrows(NoSuchFileException.class, () -> MirrorsConfigLoader.load(missing, "registry.example.com"));
  }

  @Test
  void rootThatIsAFileIsReported() throws IOException {
    Path file = Files.writeString(root.resolve("mirrors.yaml"), "mirrors: []");

    assertThrows(NotDirectoryException.class, () -> MirrorsConfigLoader.load(file, "registry.example.com"));
  }

  @Test
  void hostWithPortIsAPlainDirectoryName() throws IOException {
    TemplateFixtures.writeMirrors(root, "localhost:5000", """
        mirrors:
          - host: http://127.0.0.1:5001
        """);

    assertEquals(1, MirrorsConfigLoader.load(root, "localhost:5000").size());
  }

  @Test
  void pathTraversalHostIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> MirrorsConfigLoader.load(root, "../etc"));
    assertThrows(IllegalArgumentException.class, () -> MirrorsConfigLoader.load(root, ".."));
  }

  @Test
  void mirrorWithoutHostIsRejected() throws IOException {
    TemplateFixtures.writeMirrors(root, "registry.example.com", """
        mirrors:
          - ping_url: https://mirror.example.com/v2
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> MirrorsConfigLoader.load(root, "registry.example.com"));
    assertTrue(ex.getMessage().contains("mirrors[0].host"));
  }

  @Test
  void failureLimitAboveRangeIsRejected() throws IOException {
    TemplateFixtures.writeMirrors(root, "registry.example.com", """
        mirrors:
          - host: https://mirror.example.com
            failure_limit: 300
        """);

    assertThrows(IllegalArgumentException.class, () -> MirrorsConfigLoader.load(root, "registry.example.com"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    TemplateFixtures.writeMirrors(root, "registry.example.com", "mirrors: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> MirrorsConfigLoader.load(root, "registry.example.com"));
  }
}
