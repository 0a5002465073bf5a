package ca.gc.cra.lazypull.config.daemon;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads registry mirror definitions from a per-host directory tree.
 * <p><strong>Layout:</strong> {@code <root>/<registry-host>/hosts.yaml}, falling back to
 * {@code <root>/_default/hosts.yaml} when the host has no directory of its own:</p>
 * <pre>
 * mirrors:
 *   - host: https://mirror.example.com
 *     headers:
 *       X-Origin: lazypull
 *     health_check_interval: 5
 *     failure_limit: 3
 *     ping_url: https://mirror.example.com/v2
 * </pre>
 * <p><strong>Thread-safety:</strong> Stateless; reads are synchronous and bounded by the file size.</p>
 *
 * @since 0.1.0
 */
public final class MirrorsConfigLoader {
  /** Directory consulted when a registry host has no directory of its own. */
  public static final String DEFAULT_HOST_DIR = "_default";
  /** File holding the mirror list inside a host directory. */
  public static final String HOSTS_FILE = "hosts.yaml";

  private MirrorsConfigLoader() {}

  /**
   * Loads the mirrors configured for {@code registryHost}, in file order.
   *
   * @param root mirrors configuration root; {@code null} disables mirrors
   * @param registryHost registry host, optionally with port
   * @return mirrors in priority order; empty when nothing is configured for the host
   * @throws NoSuchFileException when {@code root} does not exist
   * @throws NotDirectoryException when {@code root} is not a directory
   * @throws IOException when a definition file exists but cannot be read
   * @throws IllegalArgumentException when the host is not a plain name or the file is malformed
   */
  public static List<MirrorConfig> load(Path root, String registryHost) throws IOException {
    Objects.requireNonNull(registryHost, "registryHost");
    if (root == null) {
      return List.of();
    }
    if (!Files.exists(root)) {
      throw new NoSuchFileException(root.toString(), null, "mirrors config directory does not exist");
    }
    if (!Files.isDirectory(root)) {
      throw new NotDirectoryException(root.toString());
    }
    if (registryHost.isBlank() || registryHost.contains("/") || registryHost.contains("\\")
        || registryHost.equals("..") || registryHost.equals(".")) {
      throw new IllegalArgumentException("registry host is not a valid directory name: " + registryHost);
    }
    Path hostDir = root.resolve(registryHost);
    if (!Files.isDirectory(hostDir)) {
      hostDir = root.resolve(DEFAULT_HOST_DIR);
      if (!Files.isDirectory(hostDir)) {
        return List.of();
      }
    }
    Path hostsFile = hostDir.resolve(HOSTS_FILE);
    if (!Files.exists(hostsFile)) {
      return List.of();
    }
    return parse(hostsFile);
  }

  private static List<MirrorConfig> parse(Path hostsFile) throws IOException {
    try (Reader reader = Files.newBufferedReader(hostsFile, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return List.of();
      }
      Map<String, Object> root = asMap(document, "root", hostsFile);
      Object mirrorsNode = root.get("mirrors");
      if (mirrorsNode == null) {
        return List.of();
      }
      if (!(mirrorsNode instanceof List<?> entries)) {
        throw new IllegalArgumentException("mirrors must be a list in " + hostsFile);
      }
      List<MirrorConfig> mirrors = new ArrayList<>(entries.size());
      for (int i = 0; i < entries.size(); i++) {
        mirrors.add(parseMirror(asMap(entries.get(i), "mirrors[" + i + "]", hostsFile), i, hostsFile));
      }
      return List.copyOf(mirrors);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse mirrors config at " + hostsFile, ex);
    }
  }

  private static MirrorConfig parseMirror(Map<String, Object> node, int index, Path source) {
    String context = "mirrors[" + index + "]";
    Object host = node.get("host");
    if (!(host instanceof String hostValue) || hostValue.isBlank()) {
      throw new IllegalArgumentException(context + ".host is required in " + source);
    }
    Map<String, String> headers = new LinkedHashMap<>();
    Object headersNode = node.get("headers");
    if (headersNode != null) {
      for (Map.Entry<String, Object> entry : asMap(headersNode, context + ".headers", source).entrySet()) {
        Object value = entry.getValue();
        headers.put(entry.getKey(), value == null ? "" : value.toString());
      }
    }
    return new MirrorConfig(
        hostValue.trim(),
        headers,
        toInt(node.get("health_check_interval"), context + ".health_check_interval", source),
        toInt(node.get("failure_limit"), context + ".failure_limit", source),
        toString(node.get("ping_url")));
  }

  private static Map<String, Object> asMap(Object node, String context, Path source) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping in " + source);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key in " + source);
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static int toInt(Object value, String context, Path source) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Integer i) {
      return i;
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(context + " must be an integer in " + source, ex);
      }
    }
    throw new IllegalArgumentException(context + " must be an integer in " + source);
  }

  private static String toString(Object value) {
    return value == null ? "" : value.toString();
  }
}
