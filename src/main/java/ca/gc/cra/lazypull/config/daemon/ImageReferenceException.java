package ca.gc.cra.lazypull.config.daemon;

/**
 * Thrown when an image identifier is not a valid image reference.
 *
 * @since 0.1.0
 */
public final class ImageReferenceException extends DaemonConfigException {
  private final String imageId;

  /**
   * Creates an exception for a malformed image identifier.
   *
   * @param imageId identifier as supplied
   * @param reason why parsing failed
   */
  public ImageReferenceException(String imageId, String reason) {
    super("parse image " + imageId + ": " + reason);
    this.imageId = imageId;
  }

  /**
   * Returns the rejected identifier.
   *
   * @return identifier as supplied
   */
  public String imageId() {
    return imageId;
  }
}
