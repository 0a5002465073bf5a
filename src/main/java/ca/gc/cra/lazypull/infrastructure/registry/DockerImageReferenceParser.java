package ca.gc.cra.lazypull.infrastructure.registry;

import ca.gc.cra.lazypull.application.port.ImageReferenceParser;
import ca.gc.cra.lazypull.config.daemon.ImageReferenceException;
import ca.gc.cra.lazypull.domain.registry.ImageReference;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parses image identifiers using the Docker reference normalization rules.
 * <ul>
 *   <li>A first path component without {@code .} or {@code :}, other than {@code localhost}, is not a
 *   domain; such names live on {@code docker.io}.</li>
 *   <li>Single-component {@code docker.io} names get the {@code library/} prefix.</li>
 *   <li>{@code index.docker.io} is normalized to {@code docker.io}.</li>
 *   <li>A trailing {@code :tag} and {@code @digest} are split off and validated.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DockerImageReferenceParser implements ImageReferenceParser {
  /** Domain of the public default registry. */
  public static final String DEFAULT_DOMAIN = "docker.io";
  private static final String LEGACY_DEFAULT_DOMAIN = "index.docker.io";
  private static final String OFFICIAL_REPO_PREFIX = "library/";
  private static final int MAX_NAME_LENGTH = 255;

  private static final Pattern DOMAIN = Pattern.compile(
      "^(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])"
          + "(?:\\.(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9]))*(?::[0-9]+)?$");
  private static final Pattern PATH_COMPONENT = Pattern.compile("^[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*$");
  private static final Pattern TAG = Pattern.compile("^[\\w][\\w.-]{0,127}$");
  private static final Pattern DIGEST = Pattern.compile("^[a-z0-9]+(?:[.+_-][a-z0-9]+)*:[a-zA-Z0-9=_-]{32,}$");

  @Override
  public ImageReference parse(String imageId) throws ImageReferenceException {
    if (imageId == null || imageId.isBlank()) {
      throw new ImageReferenceException(imageId, "reference is empty");
    }
    String remainder = imageId.trim();

    String digest = "";
    int at = remainder.indexOf('@');
    if (at >= 0) {
      digest = remainder.substring(at + 1);
      remainder = remainder.substring(0, at);
      if (!DIGEST.matcher(digest).matches()) {
        throw new ImageReferenceException(imageId, "invalid digest " + digest);
      }
    }

    String tag = "";
    int colon = remainder.lastIndexOf(':');
    if (colon > remainder.lastIndexOf('/')) {
      tag = remainder.substring(colon + 1);
      remainder = remainder.substring(0, colon);
      if (!TAG.matcher(tag).matches()) {
        throw new ImageReferenceException(imageId, "invalid tag " + tag);
      }
    }

    String domain;
    String path;
    int slash = remainder.indexOf('/');
    if (slash < 0 || !looksLikeDomain(remainder.substring(0, slash))) {
      domain = DEFAULT_DOMAIN;
      path = remainder;
    } else {
      domain = remainder.substring(0, slash);
      path = remainder.substring(slash + 1);
    }
    if (!DOMAIN.matcher(domain).matches()) {
      throw new ImageReferenceException(imageId, "invalid registry domain " + domain);
    }
    if (domain.equals(LEGACY_DEFAULT_DOMAIN)) {
      domain = DEFAULT_DOMAIN;
    }
    if (domain.equals(DEFAULT_DOMAIN) && path.indexOf('/') < 0) {
      path = OFFICIAL_REPO_PREFIX + path;
    }
    validatePath(imageId, path);
    if (domain.length() + 1 + path.length() > MAX_NAME_LENGTH) {
      throw new ImageReferenceException(imageId, "repository name longer than " + MAX_NAME_LENGTH);
    }
    return new ImageReference(domain, path, tag, digest);
  }

  private static boolean looksLikeDomain(String candidate) {
    return candidate.contains(".") || candidate.contains(":") || candidate.equals("localhost")
        || !candidate.equals(candidate.toLowerCase(Locale.ROOT));
  }

  private static void validatePath(String imageId, String path) throws ImageReferenceException {
    if (path.isEmpty()) {
      throw new ImageReferenceException(imageId, "repository path is empty");
    }
    for (String component : path.split("/", -1)) {
      if (!PATH_COMPONENT.matcher(component).matches()) {
        throw new ImageReferenceException(imageId, "invalid repository path component \"" + component + "\"");
      }
    }
  }
}
