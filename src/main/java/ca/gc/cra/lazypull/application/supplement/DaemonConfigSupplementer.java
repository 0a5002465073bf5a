package ca.gc.cra.lazypull.application.supplement;

import ca.gc.cra.lazypull.application.port.ImageReferenceParser;
import ca.gc.cra.lazypull.application.port.KeychainProvider;
import ca.gc.cra.lazypull.application.port.MetricsPort;
import ca.gc.cra.lazypull.application.port.RegistryHostAliases;
import ca.gc.cra.lazypull.application.port.VpcHostRewriter;
import ca.gc.cra.lazypull.application.redact.ConfigRedactor;
import ca.gc.cra.lazypull.config.daemon.DaemonConfig;
import ca.gc.cra.lazypull.config.daemon.DaemonConfigException;
import ca.gc.cra.lazypull.config.daemon.MirrorUpdateException;
import ca.gc.cra.lazypull.config.daemon.StorageBackend;
import ca.gc.cra.lazypull.config.daemon.StorageBackendType;
import ca.gc.cra.lazypull.config.daemon.UnsupportedBackendException;
import ca.gc.cra.lazypull.domain.registry.ImageReference;
import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fills a template-derived {@link DaemonConfig} with registry coordinates,
 * mirrors and credentials known only at mount time.
 * <p><strong>Flow:</strong> parse the image, read the backend kind, and for registry backends resolve
 * the effective host (private-network rewrite, else public alias, else unchanged), load its mirrors,
 * resolve credentials, then {@code supplement} and {@code fillAuth} in that order. Local and object
 * storage backends are used exactly as the template defines them.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. Calls are serialized by the exclusive lock of the shared
 * {@link MirrorsConfigDir}; each call must target a configuration owned by its caller.</p>
 * <p><strong>Failure model:</strong> All failures are checked {@link DaemonConfigException}s. Nothing is
 * mutated before the effective host is known and the backend kind is accepted; mirrors are loaded
 * before any field is written.</p>
 * <p><strong>Observability:</strong> DEBUG log of the effective host; counters
 * {@code daemonConfig.supplement.success|failure} and {@code daemonConfig.supplement.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class DaemonConfigSupplementer {
  private static final Logger log = LoggerFactory.getLogger(DaemonConfigSupplementer.class);
  private static final String METRIC_PREFIX = "daemonConfig.supplement";

  private final ImageReferenceParser imageParser;
  private final KeychainProvider keychains;
  private final VpcHostRewriter vpcRewriter;
  private final RegistryHostAliases hostAliases;
  private final MirrorsConfigDir mirrorsDir;
  private final MetricsPort metrics;

  /**
   * Creates a supplementer.
   *
   * @param imageParser image reference parser
   * @param keychains credential lookup
   * @param vpcRewriter private-network host rewrite
   * @param hostAliases public registry API host mapping
   * @param mirrorsDir shared mirrors directory handle; its lock serializes every call
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public DaemonConfigSupplementer(
      ImageReferenceParser imageParser,
      KeychainProvider keychains,
      VpcHostRewriter vpcRewriter,
      RegistryHostAliases hostAliases,
      MirrorsConfigDir mirrorsDir,
      MetricsPort metrics) {
    this.imageParser = Objects.requireNonNull(imageParser, "imageParser");
    this.keychains = Objects.requireNonNull(keychains, "keychains");
    this.vpcRewriter = Objects.requireNonNull(vpcRewriter, "vpcRewriter");
    this.hostAliases = Objects.requireNonNull(hostAliases, "hostAliases");
    this.mirrorsDir = Objects.requireNonNull(mirrorsDir, "mirrorsDir");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Supplements {@code config} for the mount described by {@code info}.
   *
   * @param config configuration owned by the caller
   * @param info mount-time facts
   * @throws ca.gc.cra.lazypull.config.daemon.ImageReferenceException when the image id is malformed
   * @throws UnsupportedBackendException when the backend type is not supported
   * @throws MirrorUpdateException when mirror definitions cannot be loaded
   */
  public void supplement(DaemonConfig config, SupplementInfo info) throws DaemonConfigException {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(info, "info");
    long start = System.nanoTime();
    Lock lock = mirrorsDir.lock();
    lock.lock();
    try {
      supplementLocked(config, info);
      metrics.increment(METRIC_PREFIX + ".success");
    } catch (DaemonConfigException | RuntimeException ex) {
      metrics.increment(METRIC_PREFIX + ".failure");
      throw ex;
    } finally {
      lock.unlock();
      metrics.observe(METRIC_PREFIX + ".latencyNanos", System.nanoTime() - start);
    }
  }

  /**
   * Computes the host used for mirrors and credentials.
   *
   * @param parsedHost host parsed from the image reference
   * @param vpcRegistry whether the private-network rewrite applies
   * @return effective registry host
   */
  public String effectiveHost(String parsedHost, boolean vpcRegistry) {
    if (vpcRegistry) {
      return vpcRewriter.toVpcHost(parsedHost);
    }
    return hostAliases.apiHost(parsedHost);
  }

  private void supplementLocked(DaemonConfig config, SupplementInfo info) throws DaemonConfigException {
    ImageReference image = imageParser.parse(info.imageId());
    StorageBackend backend = config.storageBackend();
    StorageBackendType kind = backend.kind()
        .orElseThrow(() -> new UnsupportedBackendException(backend.typeName()));

    boolean fromRegistry = switch (kind) {
      case REGISTRY -> true;
      case LOCALFS, OSS -> false;
    };
    if (!fromRegistry) {
      log.debug("Backend {} for image {} is used as configured", kind.wireName(), info.imageId());
      return;
    }
    supplementRegistry(config, info, image);
  }

  private void supplementRegistry(DaemonConfig config, SupplementInfo info, ImageReference image)
      throws DaemonConfigException {
    String registryHost = effectiveHost(image.host(), info.isVpcRegistry());
    log.debug("Supplementing {} config for image {} with registry host {}",
        config.driver().id(), info.imageId(), registryHost);

    Path dir = mirrorsDir.path().orElse(null);
    try {
      config.updateMirrors(dir, registryHost);
    } catch (IOException | IllegalArgumentException ex) {
      throw new MirrorUpdateException(registryHost, ex);
    }

    Keychain keychain = keychains.keychainFor(registryHost, info.imageId(), info.labels());
    if (keychain == null) {
      keychain = Keychain.empty();
    }
    if (keychain.isEmpty()) {
      log.debug("No credentials found for {}; keeping configured auth", registryHost);
    }
    config.supplement(registryHost, image.repo(), info.snapshotId(), info.params());
    config.fillAuth(keychain);
    if (log.isDebugEnabled()) {
      log.debug("Supplemented config for snapshot {}: {}", info.snapshotId(),
          ConfigRedactor.redactedString(config));
    }
  }
}
