package ca.gc.cra.lazypull.config.daemon;

import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a daemon serving an EROFS-over-fscache mount ({@link FsDriver#FSCACHE}).
 *
 * <p>Unlike the FUSE shape, supplementing also binds the configuration to a snapshot: the envelope and
 * blob ids become the snapshot id and the metadata path comes from the {@code bootstrap} parameter.</p>
 *
 * @since 0.1.0
 */
public final class FscacheDaemonConfig implements DaemonConfig {
  private final String type;
  private String id;
  private final String domainId;
  private final FscacheBlobConfig config;
  private final PrefetchConfig fsPrefetch;

  /**
   * Creates an fscache configuration.
   *
   * @param type envelope type, normally {@code bootstrap}
   * @param id snapshot id; overwritten on supplement
   * @param domainId fscache domain shared by instances of the same image
   * @param config blob section; {@code null} when the template has none
   * @param fsPrefetch filesystem prefetch settings
   */
  public FscacheDaemonConfig(
      String type, String id, String domainId, FscacheBlobConfig config, PrefetchConfig fsPrefetch) {
    this.type = type == null ? "" : type;
    this.id = id == null ? "" : id;
    this.domainId = domainId == null ? "" : domainId;
    this.config = config;
    this.fsPrefetch = fsPrefetch == null ? PrefetchConfig.DISABLED : fsPrefetch;
  }

  static FscacheDaemonConfig fromJson(Map<String, Object> json) {
    Map<String, Object> configJson = JsonObjects.object(json, "config");
    if (configJson == null) {
      throw new IllegalArgumentException("config section is required");
    }
    return new FscacheDaemonConfig(
        JsonObjects.string(json, "type"),
        JsonObjects.string(json, "id"),
        JsonObjects.string(json, "domain_id"),
        FscacheBlobConfig.fromJson(configJson),
        PrefetchConfig.fromJson(JsonObjects.object(json, "fs_prefetch")));
  }

  @Override
  public FsDriver driver() {
    return FsDriver.FSCACHE;
  }

  public String getType() {
    return type;
  }

  public String getId() {
    return id;
  }

  public String getDomainId() {
    return domainId;
  }

  public FscacheBlobConfig getConfig() {
    return config;
  }

  @Override
  public void supplement(String host, String repo, String snapshotId, Map<String, String> params) {
    FscacheBlobConfig blob = requireConfig();
    BackendConfig backend = blob.getBackendConfig();
    backend.setHost(host);
    backend.setRepo(repo);
    id = snapshotId == null ? "" : snapshotId;
    blob.setId(snapshotId);
    blob.setMetadataPath(params == null ? "" : params.get(PARAM_BOOTSTRAP));
  }

  @Override
  public void fillAuth(Keychain keychain) {
    DaemonConfigs.fillAuth(requireConfig().getBackendConfig(), keychain);
  }

  @Override
  public StorageBackend storageBackend() {
    if (config == null) {
      return new StorageBackend("", null);
    }
    return new StorageBackend(config.getBackendType(), config.getBackendConfig());
  }

  @Override
  public void updateMirrors(Path mirrorsConfigDir, String registryHost) throws IOException {
    DaemonConfigs.updateMirrors(requireConfig().getBackendConfig(), mirrorsConfigDir, registryHost);
  }

  @Override
  public List<ConfigField> fields() {
    return List.of(
        ConfigField.of("type", type),
        ConfigField.of("id", id),
        ConfigField.of("domain_id", domainId),
        ConfigField.of("config", config),
        ConfigField.omitEmpty("fs_prefetch", fsPrefetch.filesystemView()));
  }

  private FscacheBlobConfig requireConfig() {
    if (config == null) {
      throw new IllegalStateException("fscache configuration has no config section");
    }
    return config;
  }
}
