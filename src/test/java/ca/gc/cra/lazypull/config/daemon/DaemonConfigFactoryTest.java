package ca.gc.cra.lazypull.config.daemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lazypull.testutil.TemplateFixtures;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DaemonConfigFactoryTest {

  @TempDir Path tempDir;

  @Test
  void fusedevTemplateLoadsDeviceSection() throws Exception {
    Path template = TemplateFixtures.write(tempDir, "fuse.json", TemplateFixtures.FUSE_REGISTRY);

    DaemonConfig config = DaemonConfigFactory.create("fusedev", template);

    FuseDaemonConfig fuse = assertInstanceOf(FuseDaemonConfig.class, config);
    assertSame(FsDriver.FUSEDEV, fuse.driver());
    assertEquals("direct", fuse.getMode());
    assertEquals("registry", fuse.getDevice().getBackendType());
    assertEquals("https", fuse.getDevice().getBackend().getScheme());
    assertEquals(2, fuse.getDevice().getBackend().getRetryLimit());
    assertEquals("/var/lib/lazypull/cache", fuse.getDevice().getCache().workDir());
    assertTrue(fuse.getFsPrefetch().prefetchAll());
    assertEquals(8, fuse.getFsPrefetch().threadsCount());
  }

  @Test
  void fscacheTemplateLoadsFlatBlobSection() throws Exception {
    Path template = TemplateFixtures.write(tempDir, "fscache.json", TemplateFixtures.FSCACHE_REGISTRY);

    DaemonConfig config = DaemonConfigFactory.create(" FSCACHE ", template);

    FscacheDaemonConfig fscache = assertInstanceOf(FscacheDaemonConfig.class, config);
    assertEquals("bootstrap", fscache.getType());
    assertEquals("domain-1", fscache.getDomainId());
    assertEquals("registry", fscache.getConfig().getBackendType());
    assertEquals("fscache", fscache.getConfig().getCacheType());
    assertEquals(4, fscache.getConfig().getPrefetch().threadsCount());
  }

  @Test
  void unknownDriverIsRejectedBeforeReadingTemplate() {
    UnsupportedDriverException ex = assertThrows(UnsupportedDriverException.class,
        () -> DaemonConfigFactory.create("blockdev", tempDir.resolve("missing.json")));
    assertEquals("blockdev", ex.driver());
  }

  @Test
  void missingTemplateFailsWithTemplatePath() {
    Path missing = tempDir.resolve("missing.json");

    TemplateLoadException ex = assertThrows(TemplateLoadException.class,
        () -> DaemonConfigFactory.create(FsDriver.FUSEDEV, missing));

    assertEquals(missing, ex.template());
    assertInstanceOf(IOException.class, ex.getCause());
  }

  @Test
  void malformedJsonFailsToLoad() throws IOException {
    Path template = TemplateFixtures.write(tempDir, "broken.json", "{\"device\": ");

    assertThrows(TemplateLoadException.class, () -> DaemonConfigFactory.create(FsDriver.FUSEDEV, template));
  }

  @Test
  void wrongFieldTypeFailsToLoad() throws IOException {
    Path template = TemplateFixtures.write(tempDir, "typed.json",
        "{\"device\": {\"backend\": {\"type\": \"registry\", \"config\": {\"timeout\": \"soon\"}}}}");

    TemplateLoadException ex = assertThrows(TemplateLoadException.class,
        () -> DaemonConfigFactory.create(FsDriver.FUSEDEV, template));
    assertTrue(ex.getMessage().contains("timeout"));
  }

  @Test
  void fscacheTemplateWithoutConfigSectionFails() throws IOException {
    Path template = TemplateFixtures.write(tempDir, "empty.json", "{\"type\": \"bootstrap\"}");

    assertThrows(TemplateLoadException.class, () -> DaemonConfigFactory.create(FsDriver.FSCACHE, template));
  }

  @Test
  void unknownBackendTypeStillLoads() throws Exception {
    Path template = TemplateFixtures.write(tempDir, "s3.json", TemplateFixtures.FUSE_UNKNOWN_BACKEND);

    DaemonConfig config = DaemonConfigFactory.create(FsDriver.FUSEDEV, template);

    assertEquals("s3", config.storageBackend().typeName());
    assertFalse(config.storageBackend().kind().isPresent());
  }

  @Test
  void eachCallReturnsAnIndependentConfiguration() throws Exception {
    Path template = TemplateFixtures.write(tempDir, "fuse.json", TemplateFixtures.FUSE_REGISTRY);

    DaemonConfig first = DaemonConfigFactory.create(FsDriver.FUSEDEV, template);
    DaemonConfig second = DaemonConfigFactory.create(FsDriver.FUSEDEV, template);
    first.supplement("registry.example.com", "team/app", "1", java.util.Map.of());

    assertEquals("", second.storageBackend().config().getHost());
  }
}
