package ca.gc.cra.lazypull.config.daemon;

/**
 * Thrown when a configuration cannot be encoded as JSON.
 *
 * @since 0.1.0
 */
public final class SerializationException extends DaemonConfigException {
  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause encoder failure
   */
  public SerializationException(String msg, Throwable cause) { super(msg, cause); }
}
