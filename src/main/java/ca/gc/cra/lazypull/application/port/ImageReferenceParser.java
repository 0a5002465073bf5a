package ca.gc.cra.lazypull.application.port;

import ca.gc.cra.lazypull.config.daemon.ImageReferenceException;
import ca.gc.cra.lazypull.domain.registry.ImageReference;

/**
 * <strong>What:</strong> Port that splits an image identifier into registry host and repository.
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.lazypull.infrastructure.registry.DockerImageReferenceParser
 */
public interface ImageReferenceParser {
  /**
   * Parses and normalizes an image identifier.
   *
   * @param imageId identifier such as {@code docker.io/library/busybox:latest}
   * @return normalized reference
   * @throws ImageReferenceException when the identifier is malformed
   */
  ImageReference parse(String imageId) throws ImageReferenceException;
}
