package ca.gc.cra.lazypull.infrastructure.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lazypull.config.daemon.ImageReferenceException;
import ca.gc.cra.lazypull.domain.registry.ImageReference;
import org.junit.jupiter.api.Test;

class DockerImageReferenceParserTest {
  private static final String DIGEST =
      "sha256:0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

  private final DockerImageReferenceParser parser = new DockerImageReferenceParser();

  @Test
  void fullyQualifiedReference() throws ImageReferenceException {
    ImageReference ref = parser.parse("docker.io/library/busybox:latest");

    assertEquals(new ImageReference("docker.io", "library/busybox", "latest", ""), ref);
  }

  @Test
  void shortNameGetsDefaultDomainAndLibraryPrefix() throws ImageReferenceException {
    ImageReference ref = parser.parse("busybox");

    assertEquals("docker.io", ref.host());
    assertEquals("library/busybox", ref.repo());
    assertEquals("", ref.tag());
  }

  @Test
  void userRepositoryOnDefaultRegistryKeepsItsPath() throws ImageReferenceException {
    assertEquals("team/app", parser.parse("team/app:v1").repo());
  }

  @Test
  void legacyIndexDomainIsNormalized() throws ImageReferenceException {
    assertEquals("docker.io", parser.parse("index.docker.io/library/busybox").host());
  }

  @Test
  void registryWithPortAndDigest() throws ImageReferenceException {
    ImageReference ref = parser.parse("localhost:5000/team/app:v2@" + DIGEST);

    assertEquals("localhost:5000", ref.host());
    assertEquals("team/app", ref.repo());
    assertEquals("v2", ref.tag());
    assertEquals(DIGEST, ref.digest());
  }

  @Test
  void privateRegistryHostIsKept() throws ImageReferenceException {
    ImageReference ref = parser.parse("registry.cn-hangzhou.example.com/team/app:v1");

    assertEquals("registry.cn-hangzhou.example.com", ref.host());
    assertEquals("team/app", ref.repo());
  }

  @Test
  void malformedReferencesAreRejected() {
    assertThrows(ImageReferenceException.class, () -> parser.parse(""));
    assertThrows(ImageReferenceException.class, () -> parser.parse(null));
    assertThrows(ImageReferenceException.class, () -> parser.parse("registry.example.com/Team/App"));
    assertThrows(ImageReferenceException.class, () -> parser.parse("busybox:bad tag"));
    assertThrows(ImageReferenceException.class, () -> parser.parse("busybox@sha256:short"));
    assertThrows(ImageReferenceException.class, () -> parser.parse("registry.example.com/"));
  }
}
