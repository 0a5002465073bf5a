package ca.gc.cra.lazypull.application.port;

/**
 * Maps a public registry host to the host reachable from the private network.
 *
 * <p>Implementations must be deterministic; the rewrite has no failure mode.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.lazypull.infrastructure.registry.SuffixVpcHostRewriter
 */
@FunctionalInterface
public interface VpcHostRewriter {
  /**
   * Returns the private-network host for {@code registryHost}.
   *
   * @param registryHost public registry host
   * @return private-network host
   */
  String toVpcHost(String registryHost);
}
