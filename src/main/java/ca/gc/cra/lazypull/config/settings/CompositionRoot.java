package ca.gc.cra.lazypull.config.settings;

import ca.gc.cra.lazypull.application.port.KeychainProvider;
import ca.gc.cra.lazypull.application.port.MetricsPort;
import ca.gc.cra.lazypull.application.supplement.DaemonConfigSupplementer;
import ca.gc.cra.lazypull.application.supplement.MirrorsConfigDir;
import ca.gc.cra.lazypull.infrastructure.auth.ChainedKeychainProvider;
import ca.gc.cra.lazypull.infrastructure.auth.DockerConfigKeychainProvider;
import ca.gc.cra.lazypull.infrastructure.auth.LabelKeychainProvider;
import ca.gc.cra.lazypull.infrastructure.registry.DefaultRegistryHostAliases;
import ca.gc.cra.lazypull.infrastructure.registry.DockerImageReferenceParser;
import ca.gc.cra.lazypull.infrastructure.registry.SuffixVpcHostRewriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the supplement flow to its default adapters from
 * {@link SnapshotterSettings}.
 * <p><strong>Role:</strong> Owns the single {@link MirrorsConfigDir} handle, so every supplementer it
 * creates shares one lock.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final SnapshotterSettings settings;
  private final MetricsPort metrics;
  private final MirrorsConfigDir mirrorsDir;

  /**
   * Creates a composition root.
   *
   * @param settings effective settings
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public CompositionRoot(SnapshotterSettings settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.mirrorsDir = new MirrorsConfigDir(settings.mirrorsConfigDir());
  }

  /**
   * @return supplementer bound to the shared mirrors handle
   */
  public DaemonConfigSupplementer supplementer() {
    return new DaemonConfigSupplementer(
        new DockerImageReferenceParser(),
        keychainProvider(),
        new SuffixVpcHostRewriter(),
        new DefaultRegistryHostAliases(),
        mirrorsDir,
        metrics);
  }

  /**
   * Builds the credential chain: snapshot labels first, then the Docker client config when set.
   *
   * @return keychain provider
   */
  public KeychainProvider keychainProvider() {
    List<KeychainProvider> chain = new ArrayList<>();
    chain.add(new LabelKeychainProvider());
    if (settings.dockerConfig() != null) {
      chain.add(new DockerConfigKeychainProvider(settings.dockerConfig()));
    }
    return new ChainedKeychainProvider(chain);
  }

  /**
   * @return settings this root was built from
   */
  public SnapshotterSettings settings() {
    return settings;
  }
}
