package ca.gc.cra.lazypull.application.redact;

import ca.gc.cra.lazypull.config.daemon.ConfigField;
import ca.gc.cra.lazypull.config.daemon.ConfigNode;
import ca.gc.cra.lazypull.config.daemon.SerializationException;
import ca.gc.cra.lazypull.config.json.ConfigJsonWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Renders configuration nodes into secret-free maps for logs and diagnostics.
 * <p><strong>Rules:</strong> applied per {@link ConfigField}, recursively:</p>
 * <ul>
 *   <li>secret fields are dropped whatever their value;</li>
 *   <li>omit-if-zero fields holding a zero value are dropped;</li>
 *   <li>{@code null} references are dropped, never rendered as {@code null};</li>
 *   <li>nested nodes become nested maps, lists of nodes become lists of maps;</li>
 *   <li>anything else is copied as a literal under the field key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless. Safe for concurrent use on distinct configurations.</p>
 * <p><strong>Security:</strong> Output never contains a field declared secret, at any depth.</p>
 *
 * @since 0.1.0
 */
public final class ConfigRedactor {

  private ConfigRedactor() {}

  /**
   * Redacts a configuration node.
   *
   * @param node configuration or sub-section
   * @return key-sorted map without secrets; nested values are maps, lists or literals
   */
  public static Map<String, Object> redact(ConfigNode node) {
    Objects.requireNonNull(node, "node");
    Map<String, Object> result = new TreeMap<>();
    for (ConfigField field : node.fields()) {
      if (field.secret()) {
        continue;
      }
      Object value = field.value();
      if (value == null) {
        continue;
      }
      if (field.omitIfZero() && field.isZero()) {
        continue;
      }
      if (result.containsKey(field.key())) {
        throw new IllegalStateException("duplicate configuration key " + field.key());
      }
      result.put(field.key(), redactValue(value));
    }
    return result;
  }

  /**
   * Redacts a configuration node and encodes the result as JSON.
   *
   * @param node configuration or sub-section
   * @return compact JSON without secrets, safe to log
   * @throws SerializationException when a value cannot be encoded
   */
  public static String redactedString(ConfigNode node) throws SerializationException {
    try {
      return ConfigJsonWriter.write(redact(node));
    } catch (IOException ex) {
      throw new SerializationException("encode redacted config: " + ex.getMessage(), ex);
    }
  }

  private static Object redactValue(Object value) {
    if (value instanceof ConfigNode nested) {
      return redact(nested);
    }
    if (value instanceof Map<?, ?> map) {
      return new LinkedHashMap<>(map);
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object element : collection) {
        if (element != null) {
          copy.add(redactValue(element));
        }
      }
      return copy;
    }
    return value;
  }
}
