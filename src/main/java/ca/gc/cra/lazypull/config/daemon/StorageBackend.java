package ca.gc.cra.lazypull.config.daemon;

import java.util.Optional;

/**
 * Result of backend introspection: the raw {@code type} discriminator and the live backend settings.
 *
 * @param typeName discriminator exactly as configured; empty when the variant has no backend section
 * @param config backend settings owned by the variant; {@code null} when there is no backend section
 * @since 0.1.0
 */
public record StorageBackend(String typeName, BackendConfig config) {

  public StorageBackend {
    typeName = typeName == null ? "" : typeName;
  }

  /**
   * Resolves the discriminator to a supported backend.
   *
   * @return backend kind, or empty when {@link #typeName()} is not a supported backend
   */
  public Optional<StorageBackendType> kind() {
    return StorageBackendType.fromWireName(typeName);
  }
}
