package ca.gc.cra.lazypull.application.supplement;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Handle on the mirrors configuration directory and the lock that serializes
 * supplement calls.
 * <p><strong>Role:</strong> Created once by the composition root and passed to every
 * {@link DaemonConfigSupplementer}; sharing the handle is what makes the lock process-wide.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the lock itself.</p>
 *
 * @since 0.1.0
 */
public final class MirrorsConfigDir {
  private final Path path;
  private final Lock lock = new ReentrantLock();

  /**
   * Creates a handle.
   *
   * @param path mirrors configuration root; {@code null} when mirrors are not configured
   */
  public MirrorsConfigDir(Path path) {
    this.path = path;
  }

  /**
   * Creates a handle for a deployment without mirrors.
   *
   * @return handle with no directory
   */
  public static MirrorsConfigDir none() {
    return new MirrorsConfigDir(null);
  }

  /**
   * @return configured directory, if any
   */
  public Optional<Path> path() {
    return Optional.ofNullable(path);
  }

  /**
   * @return exclusive lock guarding supplement calls that use this directory
   */
  public Lock lock() {
    return lock;
  }
}
