package ca.gc.cra.lazypull.application.port;

import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.util.Map;

/**
 * <strong>What:</strong> Port resolving registry credentials for a mount request.
 * <p><strong>Contract:</strong> Lookups never fail. Missing, unreadable or malformed credential sources
 * yield {@link Keychain#empty()}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface KeychainProvider {
  /**
   * Resolves credentials for a registry host and image.
   *
   * @param registryHost effective registry host
   * @param imageId image identifier as requested
   * @param labels snapshot labels, which may carry per-request credentials
   * @return resolved credentials, or an empty keychain
   */
  Keychain keychainFor(String registryHost, String imageId, Map<String, String> labels);

  /** Provider that never finds credentials. */
  KeychainProvider NONE = (registryHost, imageId, labels) -> Keychain.empty();
}
