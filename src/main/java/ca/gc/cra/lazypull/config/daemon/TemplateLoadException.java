package ca.gc.cra.lazypull.config.daemon;

import java.nio.file.Path;

/**
 * Thrown when a configuration template cannot be read or decoded.
 *
 * @since 0.1.0
 */
public final class TemplateLoadException extends DaemonConfigException {
  private final Path template;

  /**
   * Creates an exception for the given template.
   *
   * @param template template location
   * @param detail what went wrong
   * @param cause I/O or decoding failure
   */
  public TemplateLoadException(Path template, String detail, Throwable cause) {
    super("load daemon config template " + template + ": " + detail, cause);
    this.template = template;
  }

  /**
   * Returns the template that failed to load.
   *
   * @return template location
   */
  public Path template() {
    return template;
  }
}
