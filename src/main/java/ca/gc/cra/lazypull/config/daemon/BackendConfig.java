package ca.gc.cra.lazypull.config.daemon;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Storage backend settings shared by every daemon configuration shape.
 * <p><strong>Why:</strong> The daemon reads image content from a local directory, an object store, or a
 * registry; one flat structure carries the union of their settings and the backend {@code type}
 * discriminator on the enclosing section decides which subset is active.</p>
 * <p><strong>Role:</strong> Mutable data holder. The supplementer writes {@code host}, {@code repo},
 * credentials and mirrors; everything else comes from the template.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single mount request.</p>
 * <p><strong>Security:</strong> {@code auth}, {@code registry_token}, {@code access_key_id} and
 * {@code access_key_secret} are declared secret and never survive redaction.</p>
 *
 * @since 0.1.0
 */
public final class BackendConfig implements ConfigNode {
  // localfs
  private String blobFile = "";
  private String dir = "";
  private boolean readAhead;
  private int readAheadSec;

  // registry
  private String host = "";
  private String repo = "";
  private String auth = "";
  private String registryToken = "";
  private String blobUrlScheme = "";
  private String blobRedirectedHost = "";
  private List<MirrorConfig> mirrors = List.of();

  // oss
  private String endpoint = "";
  private String accessKeyId = "";
  private String accessKeySecret = "";
  private String bucketName = "";
  private String objectPrefix = "";

  // registry and oss
  private String scheme = "";
  private boolean skipVerify;

  // all backends
  private ProxyConfig proxy = ProxyConfig.NONE;
  private int timeout;
  private int connectTimeout;
  private int retryLimit;

  static BackendConfig fromJson(Map<String, Object> json) {
    BackendConfig config = new BackendConfig();
    if (json == null) {
      return config;
    }
    config.blobFile = JsonObjects.string(json, "blob_file");
    config.dir = JsonObjects.string(json, "dir");
    config.readAhead = JsonObjects.bool(json, "readahead");
    config.readAheadSec = JsonObjects.integer(json, "readahead_sec");

    config.host = JsonObjects.string(json, "host");
    config.repo = JsonObjects.string(json, "repo");
    config.auth = JsonObjects.string(json, "auth");
    config.registryToken = JsonObjects.string(json, "registry_token");
    config.blobUrlScheme = JsonObjects.string(json, "blob_url_scheme");
    config.blobRedirectedHost = JsonObjects.string(json, "blob_redirected_host");
    List<MirrorConfig> parsedMirrors = new ArrayList<>();
    for (Map<String, Object> mirror : JsonObjects.objectList(json, "mirrors")) {
      parsedMirrors.add(MirrorConfig.fromJson(mirror));
    }
    config.mirrors = List.copyOf(parsedMirrors);

    config.endpoint = JsonObjects.string(json, "endpoint");
    config.accessKeyId = JsonObjects.string(json, "access_key_id");
    config.accessKeySecret = JsonObjects.string(json, "access_key_secret");
    config.bucketName = JsonObjects.string(json, "bucket_name");
    config.objectPrefix = JsonObjects.string(json, "object_prefix");

    config.scheme = JsonObjects.string(json, "scheme");
    config.skipVerify = JsonObjects.bool(json, "skip_verify");

    config.proxy = ProxyConfig.fromJson(JsonObjects.object(json, "proxy"));
    config.timeout = JsonObjects.integer(json, "timeout");
    config.connectTimeout = JsonObjects.integer(json, "connect_timeout");
    config.retryLimit = JsonObjects.integer(json, "retry_limit");
    return config;
  }

  @Override
  public List<ConfigField> fields() {
    return List.of(
        ConfigField.omitEmpty("blob_file", blobFile),
        ConfigField.omitEmpty("dir", dir),
        ConfigField.of("readahead", readAhead),
        ConfigField.omitEmpty("readahead_sec", readAheadSec),
        ConfigField.omitEmpty("host", host),
        ConfigField.omitEmpty("repo", repo),
        ConfigField.secret("auth", auth),
        ConfigField.secret("registry_token", registryToken),
        ConfigField.omitEmpty("blob_url_scheme", blobUrlScheme),
        ConfigField.omitEmpty("blob_redirected_host", blobRedirectedHost),
        ConfigField.omitEmpty("mirrors", mirrors),
        ConfigField.omitEmpty("endpoint", endpoint),
        ConfigField.secret("access_key_id", accessKeyId),
        ConfigField.secret("access_key_secret", accessKeySecret),
        ConfigField.omitEmpty("bucket_name", bucketName),
        ConfigField.omitEmpty("object_prefix", objectPrefix),
        ConfigField.omitEmpty("scheme", scheme),
        ConfigField.omitEmpty("skip_verify", skipVerify),
        ConfigField.omitEmpty("proxy", proxy),
        ConfigField.omitEmpty("timeout", timeout),
        ConfigField.omitEmpty("connect_timeout", connectTimeout),
        ConfigField.omitEmpty("retry_limit", retryLimit));
  }

  public String getBlobFile() {
    return blobFile;
  }

  public void setBlobFile(String blobFile) {
    this.blobFile = nullToEmpty(blobFile);
  }

  public String getDir() {
    return dir;
  }

  public void setDir(String dir) {
    this.dir = nullToEmpty(dir);
  }

  public boolean isReadAhead() {
    return readAhead;
  }

  public void setReadAhead(boolean readAhead) {
    this.readAhead = readAhead;
  }

  public int getReadAheadSec() {
    return readAheadSec;
  }

  public void setReadAheadSec(int readAheadSec) {
    this.readAheadSec = readAheadSec;
  }

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = nullToEmpty(host);
  }

  public String getRepo() {
    return repo;
  }

  public void setRepo(String repo) {
    this.repo = nullToEmpty(repo);
  }

  public String getAuth() {
    return auth;
  }

  public void setAuth(String auth) {
    this.auth = nullToEmpty(auth);
  }

  public String getRegistryToken() {
    return registryToken;
  }

  public void setRegistryToken(String registryToken) {
    this.registryToken = nullToEmpty(registryToken);
  }

  public String getBlobUrlScheme() {
    return blobUrlScheme;
  }

  public void setBlobUrlScheme(String blobUrlScheme) {
    this.blobUrlScheme = nullToEmpty(blobUrlScheme);
  }

  public String getBlobRedirectedHost() {
    return blobRedirectedHost;
  }

  public void setBlobRedirectedHost(String blobRedirectedHost) {
    this.blobRedirectedHost = nullToEmpty(blobRedirectedHost);
  }

  /**
   * Returns the mirrors in fallback priority order.
   *
   * @return immutable mirror list
   */
  public List<MirrorConfig> getMirrors() {
    return mirrors;
  }

  /**
   * Replaces the mirror list, keeping the supplied order.
   *
   * @param mirrors mirrors in fallback priority order; {@code null} clears the list
   */
  public void setMirrors(List<MirrorConfig> mirrors) {
    this.mirrors = mirrors == null ? List.of() : List.copyOf(mirrors);
  }

  public String getEndpoint() {
    return endpoint;
  }

  public void setEndpoint(String endpoint) {
    this.endpoint = nullToEmpty(endpoint);
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public void setAccessKeyId(String accessKeyId) {
    this.accessKeyId = nullToEmpty(accessKeyId);
  }

  public String getAccessKeySecret() {
    return accessKeySecret;
  }

  public void setAccessKeySecret(String accessKeySecret) {
    this.accessKeySecret = nullToEmpty(accessKeySecret);
  }

  public String getBucketName() {
    return bucketName;
  }

  public void setBucketName(String bucketName) {
    this.bucketName = nullToEmpty(bucketName);
  }

  public String getObjectPrefix() {
    return objectPrefix;
  }

  public void setObjectPrefix(String objectPrefix) {
    this.objectPrefix = nullToEmpty(objectPrefix);
  }

  public String getScheme() {
    return scheme;
  }

  public void setScheme(String scheme) {
    this.scheme = nullToEmpty(scheme);
  }

  public boolean isSkipVerify() {
    return skipVerify;
  }

  public void setSkipVerify(boolean skipVerify) {
    this.skipVerify = skipVerify;
  }

  public ProxyConfig getProxy() {
    return proxy;
  }

  public void setProxy(ProxyConfig proxy) {
    this.proxy = proxy == null ? ProxyConfig.NONE : proxy;
  }

  public int getTimeout() {
    return timeout;
  }

  public void setTimeout(int timeout) {
    this.timeout = timeout;
  }

  public int getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(int connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public int getRetryLimit() {
    return retryLimit;
  }

  public void setRetryLimit(int retryLimit) {
    this.retryLimit = retryLimit;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
