package ca.gc.cra.lazypull.infrastructure.registry;

import ca.gc.cra.lazypull.application.port.VpcHostRewriter;
import java.util.Objects;

/**
 * Rewrites a registry host to its private-network endpoint by suffixing the first DNS label, e.g.
 * {@code registry.cn-hangzhou.example.com} becomes {@code registry-vpc.cn-hangzhou.example.com}.
 * A port is kept. Hosts whose first label already carries the suffix are returned unchanged, so the
 * rewrite is idempotent.
 *
 * @since 0.1.0
 */
public final class SuffixVpcHostRewriter implements VpcHostRewriter {
  /** Suffix used by registries that publish private-network endpoints. */
  public static final String DEFAULT_SUFFIX = "-vpc";

  private final String suffix;

  public SuffixVpcHostRewriter() {
    this(DEFAULT_SUFFIX);
  }

  /**
   * Creates a rewriter with a custom suffix.
   *
   * @param suffix suffix appended to the first label; must not be blank
   */
  public SuffixVpcHostRewriter(String suffix) {
    Objects.requireNonNull(suffix, "suffix");
    if (suffix.isBlank()) {
      throw new IllegalArgumentException("suffix must not be blank");
    }
    this.suffix = suffix;
  }

  @Override
  public String toVpcHost(String registryHost) {
    Objects.requireNonNull(registryHost, "registryHost");
    int colon = registryHost.indexOf(':');
    String name = colon < 0 ? registryHost : registryHost.substring(0, colon);
    String port = colon < 0 ? "" : registryHost.substring(colon);
    int dot = name.indexOf('.');
    String first = dot < 0 ? name : name.substring(0, dot);
    String rest = dot < 0 ? "" : name.substring(dot);
    if (first.endsWith(suffix)) {
      return registryHost;
    }
    return first + suffix + rest + port;
  }
}
