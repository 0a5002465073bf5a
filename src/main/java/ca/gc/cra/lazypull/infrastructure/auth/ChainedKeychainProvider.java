package ca.gc.cra.lazypull.infrastructure.auth;

import ca.gc.cra.lazypull.application.port.KeychainProvider;
import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.util.List;
import java.util.Map;

/**
 * Consults providers in order and returns the first non-empty keychain.
 *
 * @since 0.1.0
 */
public final class ChainedKeychainProvider implements KeychainProvider {
  private final List<KeychainProvider> providers;

  /**
   * Creates a chain.
   *
   * @param providers providers in priority order
   */
  public ChainedKeychainProvider(List<KeychainProvider> providers) {
    this.providers = List.copyOf(providers);
  }

  @Override
  public Keychain keychainFor(String registryHost, String imageId, Map<String, String> labels) {
    for (KeychainProvider provider : providers) {
      Keychain keychain = provider.keychainFor(registryHost, imageId, labels);
      if (keychain != null && !keychain.isEmpty()) {
        return keychain;
      }
    }
    return Keychain.empty();
  }
}
