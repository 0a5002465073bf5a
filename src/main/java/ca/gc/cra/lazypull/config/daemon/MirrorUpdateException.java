package ca.gc.cra.lazypull.config.daemon;

/**
 * Thrown when the mirror definitions for a registry host cannot be read or are malformed.
 *
 * @since 0.1.0
 */
public final class MirrorUpdateException extends DaemonConfigException {
  private final String registryHost;

  /**
   * Creates an exception for the given registry host.
   *
   * @param registryHost effective registry host whose mirrors were being loaded
   * @param cause I/O or decoding failure
   */
  public MirrorUpdateException(String registryHost, Throwable cause) {
    super("update mirrors config for " + registryHost + ": " + cause.getMessage(), cause);
    this.registryHost = registryHost;
  }

  public String registryHost() {
    return registryHost;
  }
}
