package ca.gc.cra.lazypull.config.daemon;

import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a daemon serving a FUSE mount ({@link FsDriver#FUSEDEV}).
 *
 * @since 0.1.0
 */
public final class FuseDaemonConfig implements DaemonConfig {
  private final DeviceConfig device;
  private final String mode;
  private final boolean digestValidate;
  private final boolean iostatsFiles;
  private final boolean enableXattr;
  private final boolean accessPattern;
  private final boolean latestReadFiles;
  private final PrefetchConfig fsPrefetch;
  private final int amplifyIo;

  /**
   * Creates a FUSE configuration.
   *
   * @param device device section; {@code null} when the template has none
   * @param mode metadata access mode, e.g. {@code direct} or {@code cached}
   * @param digestValidate whether chunk digests are validated on read
   * @param iostatsFiles whether per-file I/O statistics are collected
   * @param enableXattr whether extended attributes are exposed
   * @param accessPattern whether file access patterns are recorded
   * @param latestReadFiles whether recently read files are tracked
   * @param fsPrefetch filesystem prefetch settings
   * @param amplifyIo read amplification size in bytes
   */
  public FuseDaemonConfig(
      DeviceConfig device,
      String mode,
      boolean digestValidate,
      boolean iostatsFiles,
      boolean enableXattr,
      boolean accessPattern,
      boolean latestReadFiles,
      PrefetchConfig fsPrefetch,
      int amplifyIo) {
    this.device = device;
    this.mode = mode == null ? "" : mode;
    this.digestValidate = digestValidate;
    this.iostatsFiles = iostatsFiles;
    this.enableXattr = enableXattr;
    this.accessPattern = accessPattern;
    this.latestReadFiles = latestReadFiles;
    this.fsPrefetch = fsPrefetch == null ? PrefetchConfig.DISABLED : fsPrefetch;
    this.amplifyIo = amplifyIo;
  }

  static FuseDaemonConfig fromJson(Map<String, Object> json) {
    Map<String, Object> deviceJson = JsonObjects.object(json, "device");
    if (deviceJson == null) {
      throw new IllegalArgumentException("device section is required");
    }
    return new FuseDaemonConfig(
        DeviceConfig.fromJson(deviceJson),
        JsonObjects.string(json, "mode"),
        JsonObjects.bool(json, "digest_validate"),
        JsonObjects.bool(json, "iostats_files"),
        JsonObjects.bool(json, "enable_xattr"),
        JsonObjects.bool(json, "access_pattern"),
        JsonObjects.bool(json, "latest_read_files"),
        PrefetchConfig.fromJson(JsonObjects.object(json, "fs_prefetch")),
        JsonObjects.integer(json, "amplify_io"));
  }

  @Override
  public FsDriver driver() {
    return FsDriver.FUSEDEV;
  }

  public DeviceConfig getDevice() {
    return device;
  }

  public String getMode() {
    return mode;
  }

  public boolean isDigestValidate() {
    return digestValidate;
  }

  public PrefetchConfig getFsPrefetch() {
    return fsPrefetch;
  }

  @Override
  public void supplement(String host, String repo, String snapshotId, Map<String, String> params) {
    BackendConfig backend = requireBackend();
    backend.setHost(host);
    backend.setRepo(repo);
  }

  @Override
  public void fillAuth(Keychain keychain) {
    DaemonConfigs.fillAuth(requireBackend(), keychain);
  }

  @Override
  public StorageBackend storageBackend() {
    if (device == null) {
      return new StorageBackend("", null);
    }
    return new StorageBackend(device.getBackendType(), device.getBackend());
  }

  @Override
  public void updateMirrors(Path mirrorsConfigDir, String registryHost) throws IOException {
    DaemonConfigs.updateMirrors(requireBackend(), mirrorsConfigDir, registryHost);
  }

  @Override
  public List<ConfigField> fields() {
    return List.of(
        ConfigField.of("device", device),
        ConfigField.of("mode", mode),
        ConfigField.of("digest_validate", digestValidate),
        ConfigField.omitEmpty("iostats_files", iostatsFiles),
        ConfigField.omitEmpty("enable_xattr", enableXattr),
        ConfigField.omitEmpty("access_pattern", accessPattern),
        ConfigField.omitEmpty("latest_read_files", latestReadFiles),
        ConfigField.omitEmpty("fs_prefetch", fsPrefetch.filesystemView()),
        ConfigField.omitEmpty("amplify_io", amplifyIo));
  }

  private BackendConfig requireBackend() {
    if (device == null) {
      throw new IllegalStateException("fusedev configuration has no device section");
    }
    return device.getBackend();
  }
}
