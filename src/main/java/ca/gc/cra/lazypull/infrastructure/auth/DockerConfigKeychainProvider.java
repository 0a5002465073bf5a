package ca.gc.cra.lazypull.infrastructure.auth;

import ca.gc.cra.lazypull.application.port.KeychainProvider;
import ca.gc.cra.lazypull.config.json.JsonSupport;
import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves credentials from a Docker client {@code config.json}.
 * <p><strong>Format:</strong> the {@code auths} object maps a registry key to an entry carrying
 * {@code auth} (base64 of {@code user:password}), or {@code username}/{@code password}, or
 * {@code registrytoken}. Keys may be bare hosts or URLs such as {@code https://index.docker.io/v1/};
 * the public default registry is matched under all of its aliases.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. The file is read on every lookup so credential
 * rotation is picked up without a restart.</p>
 * <p><strong>Failure model:</strong> Never throws for file problems. Missing, unreadable or malformed
 * files log a warning (without credential material) and yield {@link Keychain#empty()}.</p>
 *
 * @since 0.1.0
 */
public final class DockerConfigKeychainProvider implements KeychainProvider {
  private static final Logger log = LoggerFactory.getLogger(DockerConfigKeychainProvider.class);
  private static final Set<String> DOCKER_HUB_ALIASES =
      Set.of("docker.io", "index.docker.io", "registry-1.docker.io");

  private final Path configFile;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a provider.
   *
   * @param configFile Docker client configuration file
   */
  public DockerConfigKeychainProvider(Path configFile) {
    this.configFile = Objects.requireNonNull(configFile, "configFile");
  }

  @Override
  public Keychain keychainFor(String registryHost, String imageId, Map<String, String> labels) {
    if (registryHost == null || registryHost.isBlank()) {
      return Keychain.empty();
    }
    Map<String, Object> auths;
    try {
      auths = readAuths();
    } catch (NoSuchFileException ex) {
      log.debug("Docker config {} not found", configFile);
      return Keychain.empty();
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Ignoring unreadable docker config {}: {}", configFile, ex.getMessage());
      return Keychain.empty();
    }
    String wanted = normalizeKey(registryHost);
    for (Map.Entry<String, Object> entry : auths.entrySet()) {
      if (matches(wanted, normalizeKey(entry.getKey())) && entry.getValue() instanceof Map<?, ?> raw) {
        Keychain keychain = toKeychain(entry.getKey(), raw);
        if (!keychain.isEmpty()) {
          return keychain;
        }
      }
    }
    return Keychain.empty();
  }

  private Map<String, Object> readAuths() throws IOException {
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      Object auths = json.parseObject(reader).get("auths");
      if (auths == null) {
        return Map.of();
      }
      if (!(auths instanceof Map<?, ?> raw)) {
        throw new IllegalArgumentException("auths must be an object");
      }
      Map<String, Object> typed = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : raw.entrySet()) {
        typed.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      return typed;
    }
  }

  private Keychain toKeychain(String key, Map<?, ?> entry) {
    String token = text(entry.get("registrytoken"));
    if (!token.isEmpty()) {
      return new Keychain("", token);
    }
    String auth = text(entry.get("auth"));
    if (!auth.isEmpty()) {
      String decoded;
      try {
        decoded = new String(Base64.getDecoder().decode(auth), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring malformed auth entry for {} in {}", key, configFile);
        return Keychain.empty();
      }
      int colon = decoded.indexOf(':');
      if (colon < 0) {
        log.warn("Ignoring auth entry for {} in {}: missing ':' separator", key, configFile);
        return Keychain.empty();
      }
      return new Keychain(decoded.substring(0, colon), decoded.substring(colon + 1));
    }
    return new Keychain(text(entry.get("username")), text(entry.get("password")));
  }

  private static boolean matches(String wanted, String candidate) {
    if (wanted.equals(candidate)) {
      return true;
    }
    return DOCKER_HUB_ALIASES.contains(wanted) && DOCKER_HUB_ALIASES.contains(candidate);
  }

  static String normalizeKey(String key) {
    String host = key.trim().toLowerCase(Locale.ROOT);
    int scheme = host.indexOf("://");
    if (scheme >= 0) {
      host = host.substring(scheme + 3);
    }
    int slash = host.indexOf('/');
    if (slash >= 0) {
      host = host.substring(0, slash);
    }
    return host;
  }

  private static String text(Object value) {
    return value instanceof String s ? s : "";
  }
}
