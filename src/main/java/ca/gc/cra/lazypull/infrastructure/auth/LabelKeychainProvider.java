package ca.gc.cra.lazypull.infrastructure.auth;

import ca.gc.cra.lazypull.application.port.KeychainProvider;
import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.util.Map;

/**
 * Resolves credentials passed by the container runtime as snapshot labels.
 *
 * <p>A label set without a secret yields an empty keychain. A secret without a user name is treated
 * as a registry token.</p>
 *
 * @since 0.1.0
 */
public final class LabelKeychainProvider implements KeychainProvider {
  /** Label carrying the pull user name. */
  public static final String USERNAME_LABEL = "containerd.io/snapshot/pullusername";
  /** Label carrying the pull secret or token. */
  public static final String SECRET_LABEL = "containerd.io/snapshot/pullsecret";

  @Override
  public Keychain keychainFor(String registryHost, String imageId, Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return Keychain.empty();
    }
    String secret = labels.get(SECRET_LABEL);
    if (secret == null || secret.isBlank()) {
      return Keychain.empty();
    }
    return new Keychain(labels.getOrDefault(USERNAME_LABEL, ""), secret);
  }
}
