package ca.gc.cra.lazypull.config.daemon;

import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * <strong>What:</strong> Runtime configuration handed to the lazy-pulling filesystem daemon.
 * <p><strong>Why:</strong> Each filesystem driver expects its own document shape, but the mount path
 * only needs to fill in registry coordinates, mirrors and credentials; this contract hides the shape.</p>
 * <p><strong>Role:</strong> Closed set of variants, one per {@link FsDriver}. Created by
 * {@link DaemonConfigFactory}, mutated once by the supplementer, then treated as immutable.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A variant belongs to one mount request; callers
 * must not read it while a supplement call on it is in flight.</p>
 * <p><strong>Security:</strong> {@link #dumpString()} includes credentials; log only redacted forms.</p>
 *
 * @since 0.1.0
 */
public sealed interface DaemonConfig extends ConfigNode permits FuseDaemonConfig, FscacheDaemonConfig {

  /** Request parameter carrying the bootstrap (metadata) path for fscache mounts. */
  String PARAM_BOOTSTRAP = "bootstrap";

  /**
   * Returns the driver this configuration shape belongs to.
   *
   * @return filesystem driver
   */
  FsDriver driver();

  /**
   * Stores registry coordinates and mount identifiers. Repeated calls with identical inputs leave the
   * configuration unchanged; values are stored without validation.
   *
   * @param host effective registry host
   * @param repo repository path
   * @param snapshotId snapshot the mount serves
   * @param params request parameters, e.g. {@link #PARAM_BOOTSTRAP}
   */
  void supplement(String host, String repo, String snapshotId, Map<String, String> params);

  /**
   * Copies resolved credentials into the backend. An empty keychain leaves any configured credentials
   * in place; a token-based keychain fills {@code registry_token}, any other fills {@code auth}.
   *
   * @param keychain resolved credentials; {@code null} is treated as empty
   */
  void fillAuth(Keychain keychain);

  /**
   * Returns the backend discriminator and the live backend settings.
   *
   * @return backend view; never {@code null}
   */
  StorageBackend storageBackend();

  /**
   * Replaces the mirror list with the definitions found for {@code registryHost}. When no definitions
   * exist the current list is kept; on failure the current list is untouched.
   *
   * @param mirrorsConfigDir mirrors configuration root; {@code null} disables mirror loading
   * @param registryHost effective registry host
   * @throws IOException when the definitions cannot be read
   * @throws IllegalArgumentException when the definitions are malformed
   */
  void updateMirrors(Path mirrorsConfigDir, String registryHost) throws IOException;

  /**
   * Serializes the full configuration, credentials included, for the daemon process.
   *
   * @return compact JSON document
   * @throws SerializationException when a value cannot be encoded
   */
  default String dumpString() throws SerializationException {
    return DaemonConfigs.dumpString(this);
  }
}
