package ca.gc.cra.lazypull.config.daemon;

/**
 * Checked base exception for failures while building, supplementing or serializing a daemon
 * configuration. Callers decide whether to abort or retry the mount request.
 *
 * @since 0.1.0
 */
public class DaemonConfigException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public DaemonConfigException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public DaemonConfigException(String msg, Throwable cause) { super(msg, cause); }
}
