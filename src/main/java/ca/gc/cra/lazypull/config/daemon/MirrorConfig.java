package ca.gc.cra.lazypull.config.daemon;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Alternate registry endpoint tried by the daemon in list order when the primary host fails.
 *
 * @param host mirror base URL including scheme
 * @param headers extra request headers sent to the mirror
 * @param healthCheckInterval seconds between health probes; {@code 0} uses the daemon default
 * @param failureLimit consecutive failures before the mirror is marked unhealthy (0..255)
 * @param pingUrl health probe URL
 * @since 0.1.0
 */
public record MirrorConfig(
    String host,
    Map<String, String> headers,
    int healthCheckInterval,
    int failureLimit,
    String pingUrl) implements ConfigNode {

  public MirrorConfig {
    host = host == null ? "" : host;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    pingUrl = pingUrl == null ? "" : pingUrl;
    if (failureLimit < 0 || failureLimit > 255) {
      throw new IllegalArgumentException("failure_limit must be within 0..255 (was " + failureLimit + ")");
    }
  }

  /**
   * Creates a mirror with only a host set.
   *
   * @param host mirror base URL
   * @return mirror using daemon defaults for health checking
   */
  public static MirrorConfig of(String host) {
    return new MirrorConfig(Objects.requireNonNull(host, "host"), Map.of(), 0, 0, "");
  }

  static MirrorConfig fromJson(Map<String, Object> json) {
    return new MirrorConfig(
        JsonObjects.string(json, "host"),
        JsonObjects.stringMap(json, "headers"),
        JsonObjects.integer(json, "health_check_interval"),
        JsonObjects.integer(json, "failure_limit"),
        JsonObjects.string(json, "ping_url"));
  }

  @Override
  public List<ConfigField> fields() {
    return List.of(
        ConfigField.omitEmpty("host", host),
        ConfigField.omitEmpty("headers", headers),
        ConfigField.omitEmpty("health_check_interval", healthCheckInterval),
        ConfigField.omitEmpty("failure_limit", failureLimit),
        ConfigField.omitEmpty("ping_url", pingUrl));
  }
}
