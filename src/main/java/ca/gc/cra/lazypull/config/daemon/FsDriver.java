package ca.gc.cra.lazypull.config.daemon;

import java.util.Locale;

/**
 * Filesystem integration modes of the daemon. Each mode has its own configuration shape.
 *
 * @since 0.1.0
 */
public enum FsDriver {
  /** FUSE userspace filesystem; configured by {@link FuseDaemonConfig}. */
  FUSEDEV("fusedev"),
  /** In-kernel EROFS over fscache; configured by {@link FscacheDaemonConfig}. */
  FSCACHE("fscache");

  private final String id;

  FsDriver(String id) {
    this.id = id;
  }

  /**
   * Returns the identifier used in settings and on the command line.
   *
   * @return driver identifier
   */
  public String id() {
    return id;
  }

  /**
   * Resolves a driver identifier.
   *
   * @param value identifier such as {@code fusedev}; surrounding whitespace and case are ignored
   * @return matching driver
   * @throws UnsupportedDriverException when the identifier names no supported driver
   */
  public static FsDriver fromId(String value) throws UnsupportedDriverException {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (FsDriver driver : values()) {
        if (driver.id.equals(normalized)) {
          return driver;
        }
      }
    }
    throw new UnsupportedDriverException(value);
  }
}
