package ca.gc.cra.lazypull.infrastructure.registry;

import ca.gc.cra.lazypull.application.port.RegistryHostAliases;
import java.util.Map;
import java.util.Objects;

/**
 * Table-driven {@link RegistryHostAliases}. The default table maps the public default registry's
 * user-facing domain {@code docker.io} to its API host {@code index.docker.io}.
 *
 * @since 0.1.0
 */
public final class DefaultRegistryHostAliases implements RegistryHostAliases {
  /** API host of the public default registry. */
  public static final String DOCKER_HUB_API_HOST = "index.docker.io";

  private final Map<String, String> aliases;

  public DefaultRegistryHostAliases() {
    this(Map.of(DockerImageReferenceParser.DEFAULT_DOMAIN, DOCKER_HUB_API_HOST));
  }

  /**
   * Creates aliases from an explicit table.
   *
   * @param aliases user-facing domain to API host
   */
  public DefaultRegistryHostAliases(Map<String, String> aliases) {
    this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
  }

  @Override
  public String apiHost(String registryHost) {
    return aliases.getOrDefault(registryHost, registryHost);
  }
}
