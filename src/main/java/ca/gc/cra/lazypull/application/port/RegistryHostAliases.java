package ca.gc.cra.lazypull.application.port;

/**
 * Maps the user-facing domain of a public registry to the host that serves its API.
 *
 * @since 0.1.0
 * @see ca.gc.cra.lazypull.infrastructure.registry.DefaultRegistryHostAliases
 */
@FunctionalInterface
public interface RegistryHostAliases {
  /**
   * Returns the API host for {@code registryHost}.
   *
   * @param registryHost host parsed from the image reference
   * @return API host, or {@code registryHost} itself when it has no alias
   */
  String apiHost(String registryHost);

  /** Aliases that leave every host unchanged. */
  RegistryHostAliases IDENTITY = host -> host;
}
