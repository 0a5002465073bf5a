package ca.gc.cra.lazypull.config.daemon;

/**
 * Thrown when a configuration is requested for a filesystem driver that has no configuration shape.
 *
 * @since 0.1.0
 */
public final class UnsupportedDriverException extends DaemonConfigException {
  private final String driver;

  /**
   * Creates an exception naming the rejected driver.
   *
   * @param driver driver identifier as supplied; may be {@code null}
   */
  public UnsupportedDriverException(String driver) {
    super("unsupported fs driver \"" + driver + "\"");
    this.driver = driver;
  }

  /**
   * Returns the rejected driver identifier.
   *
   * @return identifier as supplied
   */
  public String driver() {
    return driver;
  }
}
