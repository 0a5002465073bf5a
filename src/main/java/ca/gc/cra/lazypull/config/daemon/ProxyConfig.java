package ca.gc.cra.lazypull.config.daemon;

import java.util.List;
import java.util.Map;

/**
 * Local blob proxy consulted before the backend.
 *
 * @param url proxy base URL
 * @param fallback whether the daemon falls back to the backend when the proxy is unhealthy
 * @param pingUrl proxy health probe URL
 * @param checkInterval seconds between proxy health probes
 * @param useHttp whether blob requests to the proxy use plain HTTP
 * @since 0.1.0
 */
public record ProxyConfig(String url, boolean fallback, String pingUrl, int checkInterval, boolean useHttp)
    implements ConfigNode {

  /** Proxy settings with every field at its zero value. */
  public static final ProxyConfig NONE = new ProxyConfig("", false, "", 0, false);

  public ProxyConfig {
    url = url == null ? "" : url;
    pingUrl = pingUrl == null ? "" : pingUrl;
  }

  static ProxyConfig fromJson(Map<String, Object> json) {
    if (json == null) {
      return NONE;
    }
    return new ProxyConfig(
        JsonObjects.string(json, "url"),
        JsonObjects.bool(json, "fallback"),
        JsonObjects.string(json, "ping_url"),
        JsonObjects.integer(json, "check_interval"),
        JsonObjects.bool(json, "use_http"));
  }

  @Override
  public List<ConfigField> fields() {
    return List.of(
        ConfigField.omitEmpty("url", url),
        ConfigField.of("fallback", fallback),
        ConfigField.omitEmpty("ping_url", pingUrl),
        ConfigField.omitEmpty("check_interval", checkInterval),
        ConfigField.omitEmpty("use_http", useHttp));
  }
}
