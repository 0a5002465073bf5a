package ca.gc.cra.lazypull.config.daemon;

import ca.gc.cra.lazypull.config.json.ConfigJsonWriter;
import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Serialization entry points and backend mutations shared by the {@link DaemonConfig} variants.
 *
 * @since 0.1.0
 */
public final class DaemonConfigs {

  private DaemonConfigs() {}

  /**
   * Serializes any configuration node, credentials included.
   *
   * @param node configuration or sub-section
   * @return compact JSON document
   * @throws SerializationException when a value cannot be encoded
   */
  public static String dumpString(ConfigNode node) throws SerializationException {
    Objects.requireNonNull(node, "node");
    try {
      return ConfigJsonWriter.write(node);
    } catch (IOException ex) {
      throw new SerializationException("encode daemon config: " + ex.getMessage(), ex);
    }
  }

  /**
   * Writes the full configuration to the file the daemon process reads. The file is written to a
   * sibling temporary file first and moved into place so the daemon never sees a partial document.
   *
   * @param config configuration to dump
   * @param target destination file
   * @throws SerializationException when the configuration cannot be encoded
   * @throws IOException when the file cannot be written
   */
  public static void dumpToFile(DaemonConfig config, Path target) throws SerializationException, IOException {
    Objects.requireNonNull(target, "target");
    String json = dumpString(config);
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = Files.createTempFile(parent, absolute.getFileName().toString(), ".tmp");
    try {
      Files.writeString(tmp, json, StandardCharsets.UTF_8);
      Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  static void fillAuth(BackendConfig backend, Keychain keychain) {
    if (keychain == null || keychain.isEmpty()) {
      return;
    }
    if (keychain.isTokenBased()) {
      backend.setRegistryToken(keychain.password());
    } else {
      backend.setAuth(keychain.toBase64());
    }
  }

  static void updateMirrors(BackendConfig backend, Path mirrorsConfigDir, String registryHost)
      throws IOException {
    List<MirrorConfig> mirrors = MirrorsConfigLoader.load(mirrorsConfigDir, registryHost);
    if (!mirrors.isEmpty()) {
      backend.setMirrors(mirrors);
    }
  }
}
