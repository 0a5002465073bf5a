package ca.gc.cra.lazypull.config.daemon;

import ca.gc.cra.lazypull.config.json.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds a {@link DaemonConfig} from a JSON template for a filesystem driver.
 * <p><strong>Role:</strong> Entry point of the configuration flow; its output is handed to the
 * supplementer for the mount request that asked for it.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call reads the template afresh and returns a new,
 * unshared configuration. Template reads are not guarded by the supplement lock.</p>
 * <p><strong>Observability:</strong> Logs the driver and template at DEBUG; never logs template content.</p>
 *
 * @since 0.1.0
 */
public final class DaemonConfigFactory {
  private static final Logger log = LoggerFactory.getLogger(DaemonConfigFactory.class);

  private DaemonConfigFactory() {}

  /**
   * Resolves {@code driver} and loads the template into that driver's configuration shape.
   *
   * @param driver driver identifier, {@code fusedev} or {@code fscache}
   * @param template JSON template location
   * @return new configuration owned by the caller
   * @throws UnsupportedDriverException when {@code driver} names no supported driver
   * @throws TemplateLoadException when the template cannot be read or decoded
   */
  public static DaemonConfig create(String driver, Path template) throws DaemonConfigException {
    return create(FsDriver.fromId(driver), template);
  }

  /**
   * Loads the template into the configuration shape of {@code driver}.
   *
   * @param driver filesystem driver
   * @param template JSON template location
   * @return new configuration owned by the caller
   * @throws TemplateLoadException when the template cannot be read or decoded
   */
  public static DaemonConfig create(FsDriver driver, Path template) throws TemplateLoadException {
    Objects.requireNonNull(driver, "driver");
    Objects.requireNonNull(template, "template");
    Map<String, Object> json = readTemplate(template);
    log.debug("Loading {} daemon config from {}", driver.id(), template);
    try {
      return switch (driver) {
        case FUSEDEV -> FuseDaemonConfig.fromJson(json);
        case FSCACHE -> FscacheDaemonConfig.fromJson(json);
      };
    } catch (IllegalArgumentException ex) {
      throw new TemplateLoadException(template, "invalid " + driver.id() + " config: " + ex.getMessage(), ex);
    }
  }

  private static Map<String, Object> readTemplate(Path template) throws TemplateLoadException {
    try (Reader reader = Files.newBufferedReader(template, StandardCharsets.UTF_8)) {
      return new JsonSupport().parseObject(reader);
    } catch (IOException ex) {
      throw new TemplateLoadException(template, "read failed: " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new TemplateLoadException(template, ex.getMessage(), ex);
    }
  }
}
