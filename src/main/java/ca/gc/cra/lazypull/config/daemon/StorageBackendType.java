package ca.gc.cra.lazypull.config.daemon;

import java.util.Optional;

/**
 * Storage backends the daemon can read image content from.
 *
 * @since 0.1.0
 */
public enum StorageBackendType {
  /** Blobs on a local directory. */
  LOCALFS("localfs"),
  /** Blobs in an object storage bucket. */
  OSS("oss"),
  /** Blobs pulled from an OCI registry over HTTP. */
  REGISTRY("registry");

  private final String wireName;

  StorageBackendType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value used for the backend {@code type} discriminator.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a backend {@code type} discriminator read from a template.
   *
   * @param value raw discriminator; may be {@code null}
   * @return matching backend, or empty when the value names no supported backend
   */
  public static Optional<StorageBackendType> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (StorageBackendType type : values()) {
      if (type.wireName.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
