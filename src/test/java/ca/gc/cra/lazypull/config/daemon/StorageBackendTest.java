package ca.gc.cra.lazypull.config.daemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.lazypull.testutil.TemplateFixtures;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StorageBackendTest {

  @TempDir Path tempDir;

  @Test
  void localfsBackendExposesDirectorySettings() throws Exception {
    DaemonConfig config = DaemonConfigFactory.create(FsDriver.FUSEDEV,
        TemplateFixtures.write(tempDir, "local.json", TemplateFixtures.FUSE_LOCALFS));

    StorageBackend backend = config.storageBackend();

    assertEquals(Optional.of(StorageBackendType.LOCALFS), backend.kind());
    assertEquals("/var/lib/blobs", backend.config().getDir());
  }

  @Test
  void ossBackendExposesBucketSettings() throws Exception {
    DaemonConfig config = DaemonConfigFactory.create(FsDriver.FUSEDEV,
        TemplateFixtures.write(tempDir, "oss.json", TemplateFixtures.FUSE_OSS));

    StorageBackend backend = config.storageBackend();

    assertEquals(Optional.of(StorageBackendType.OSS), backend.kind());
    assertEquals("images", backend.config().getBucketName());
  }

  @Test
  void registryBackendIsTheLiveBackendInstance() throws Exception {
    DaemonConfig config = DaemonConfigFactory.create(FsDriver.FSCACHE,
        TemplateFixtures.write(tempDir, "fscache.json", TemplateFixtures.FSCACHE_REGISTRY));

    StorageBackend backend = config.storageBackend();
    backend.config().setHost("registry.example.com");

    assertEquals(Optional.of(StorageBackendType.REGISTRY), backend.kind());
    assertSame(backend.config(), ((FscacheDaemonConfig) config).getConfig().getBackendConfig());
    assertEquals("registry.example.com", config.storageBackend().config().getHost());
  }

  @Test
  void missingDeviceSectionYieldsUnknownKind() {
    FuseDaemonConfig config = new FuseDaemonConfig(null, "direct", false, false, false, false, false, null, 0);

    assertEquals(Optional.empty(), config.storageBackend().kind());
  }
}
