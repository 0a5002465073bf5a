package ca.gc.cra.lazypull.config.daemon;

/**
 * Thrown when a configuration names a storage backend that is not one of {@link StorageBackendType}.
 *
 * @since 0.1.0
 */
public final class UnsupportedBackendException extends DaemonConfigException {
  private final String backendType;

  /**
   * Creates an exception naming the offending backend.
   *
   * @param backendType backend discriminator as configured
   */
  public UnsupportedBackendException(String backendType) {
    super("unknown backend type \"" + backendType + "\"");
    this.backendType = backendType;
  }

  public String backendType() {
    return backendType;
  }
}
