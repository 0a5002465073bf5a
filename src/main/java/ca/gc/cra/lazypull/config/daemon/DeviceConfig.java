package ca.gc.cra.lazypull.config.daemon;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A FUSE device: one storage backend paired with a cache policy.
 *
 * <p>The backend {@code type} string is kept verbatim so that a template naming an unsupported backend
 * still loads; the supplementer rejects it when it tries to act on it.</p>
 *
 * @since 0.1.0
 */
public final class DeviceConfig implements ConfigNode {
  private final String backendType;
  private final BackendConfig backend;
  private final CacheConfig cache;

  /**
   * Creates a device section.
   *
   * @param backendType backend discriminator, e.g. {@code registry}
   * @param backend backend settings
   * @param cache cache policy
   */
  public DeviceConfig(String backendType, BackendConfig backend, CacheConfig cache) {
    this.backendType = backendType == null ? "" : backendType;
    this.backend = Objects.requireNonNull(backend, "backend");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  static DeviceConfig fromJson(Map<String, Object> json) {
    Map<String, Object> backendJson = JsonObjects.objectOrEmpty(json, "backend");
    return new DeviceConfig(
        JsonObjects.string(backendJson, "type"),
        BackendConfig.fromJson(JsonObjects.object(backendJson, "config")),
        CacheConfig.fromJson(JsonObjects.object(json, "cache")));
  }

  public String getBackendType() {
    return backendType;
  }

  public BackendConfig getBackend() {
    return backend;
  }

  public CacheConfig getCache() {
    return cache;
  }

  @Override
  public List<ConfigField> fields() {
    ConfigNode backendSection = () -> List.of(
        ConfigField.of("type", backendType),
        ConfigField.of("config", backend));
    return List.of(
        ConfigField.of("backend", backendSection),
        ConfigField.of("cache", cache));
  }
}
