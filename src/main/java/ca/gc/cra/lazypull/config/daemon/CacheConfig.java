package ca.gc.cra.lazypull.config.daemon;

import java.util.List;
import java.util.Map;

/**
 * Blob cache policy of a FUSE device.
 *
 * @param type cache kind, e.g. {@code blobcache}
 * @param compressed whether cached chunks are kept compressed
 * @param workDir cache working directory
 * @param disableIndexedMap whether the chunk index map is disabled
 * @since 0.1.0
 */
public record CacheConfig(String type, boolean compressed, String workDir, boolean disableIndexedMap)
    implements ConfigNode {

  public CacheConfig {
    type = type == null ? "" : type;
    workDir = workDir == null ? "" : workDir;
  }

  static CacheConfig fromJson(Map<String, Object> json) {
    if (json == null) {
      return new CacheConfig("", false, "", false);
    }
    Map<String, Object> inner = JsonObjects.objectOrEmpty(json, "config");
    return new CacheConfig(
        JsonObjects.string(json, "type"),
        JsonObjects.bool(json, "compressed"),
        JsonObjects.string(inner, "work_dir"),
        JsonObjects.bool(inner, "disable_indexed_map"));
  }

  @Override
  public List<ConfigField> fields() {
    ConfigNode inner = () -> List.of(
        ConfigField.of("work_dir", workDir),
        ConfigField.of("disable_indexed_map", disableIndexedMap));
    return List.of(
        ConfigField.of("type", type),
        ConfigField.omitEmpty("compressed", compressed),
        ConfigField.of("config", inner));
  }
}
