package ca.gc.cra.lazypull.config.daemon;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code config} section of an fscache configuration: backend, cache and metadata location for one
 * blob instance. Plays the role that {@link DeviceConfig} plays for FUSE mounts, in the flat layout the
 * daemon's fscache mode expects.
 *
 * @since 0.1.0
 */
public final class FscacheBlobConfig implements ConfigNode {
  private String id;
  private final String backendType;
  private final BackendConfig backendConfig;
  private final String cacheType;
  private final String cacheWorkDir;
  private final PrefetchConfig prefetch;
  private String metadataPath;

  /**
   * Creates an fscache blob section.
   *
   * @param id instance identifier; overwritten with the snapshot id on supplement
   * @param backendType backend discriminator, e.g. {@code registry}
   * @param backendConfig backend settings
   * @param cacheType cache kind, e.g. {@code fscache}
   * @param cacheWorkDir cache working directory
   * @param prefetch blob prefetch settings
   * @param metadataPath bootstrap path; overwritten on supplement
   */
  public FscacheBlobConfig(
      String id,
      String backendType,
      BackendConfig backendConfig,
      String cacheType,
      String cacheWorkDir,
      PrefetchConfig prefetch,
      String metadataPath) {
    this.id = id == null ? "" : id;
    this.backendType = backendType == null ? "" : backendType;
    this.backendConfig = Objects.requireNonNull(backendConfig, "backendConfig");
    this.cacheType = cacheType == null ? "" : cacheType;
    this.cacheWorkDir = cacheWorkDir == null ? "" : cacheWorkDir;
    this.prefetch = prefetch == null ? PrefetchConfig.DISABLED : prefetch;
    this.metadataPath = metadataPath == null ? "" : metadataPath;
  }

  static FscacheBlobConfig fromJson(Map<String, Object> json) {
    Map<String, Object> cacheConfig = JsonObjects.objectOrEmpty(json, "cache_config");
    return new FscacheBlobConfig(
        JsonObjects.string(json, "id"),
        JsonObjects.string(json, "backend_type"),
        BackendConfig.fromJson(JsonObjects.object(json, "backend_config")),
        JsonObjects.string(json, "cache_type"),
        JsonObjects.string(cacheConfig, "work_dir"),
        PrefetchConfig.fromJson(JsonObjects.object(json, "prefetch_config")),
        JsonObjects.string(json, "metadata_path"));
  }

  public String getId() {
    return id;
  }

  void setId(String id) {
    this.id = id == null ? "" : id;
  }

  public String getBackendType() {
    return backendType;
  }

  public BackendConfig getBackendConfig() {
    return backendConfig;
  }

  public String getCacheType() {
    return cacheType;
  }

  public String getCacheWorkDir() {
    return cacheWorkDir;
  }

  public PrefetchConfig getPrefetch() {
    return prefetch;
  }

  public String getMetadataPath() {
    return metadataPath;
  }

  void setMetadataPath(String metadataPath) {
    this.metadataPath = metadataPath == null ? "" : metadataPath;
  }

  @Override
  public List<ConfigField> fields() {
    ConfigNode cacheConfig = () -> List.of(ConfigField.of("work_dir", cacheWorkDir));
    return List.of(
        ConfigField.of("id", id),
        ConfigField.of("backend_type", backendType),
        ConfigField.of("backend_config", backendConfig),
        ConfigField.of("cache_type", cacheType),
        ConfigField.of("cache_config", cacheConfig),
        ConfigField.of("prefetch_config", prefetch.blobView()),
        ConfigField.of("metadata_path", metadataPath));
  }
}
