package ca.gc.cra.lazypull.domain.registry;

import java.util.Objects;

/**
 * A normalized container image reference.
 *
 * @param host registry domain, e.g. {@code docker.io}, optionally with port
 * @param repo repository path within the registry, e.g. {@code library/busybox}
 * @param tag tag, or an empty string when absent
 * @param digest content digest, or an empty string when absent
 * @since 0.1.0
 */
public record ImageReference(String host, String repo, String tag, String digest) {

  public ImageReference {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(repo, "repo");
    tag = tag == null ? "" : tag;
    digest = digest == null ? "" : digest;
  }

  /**
   * Renders the fully qualified reference.
   *
   * @return {@code host/repo[:tag][@digest]}
   */
  public String canonical() {
    StringBuilder sb = new StringBuilder(host).append('/').append(repo);
    if (!tag.isEmpty()) {
      sb.append(':').append(tag);
    }
    if (!digest.isEmpty()) {
      sb.append('@').append(digest);
    }
    return sb.toString();
  }
}
