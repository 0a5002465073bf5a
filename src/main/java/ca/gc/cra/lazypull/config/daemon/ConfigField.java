package ca.gc.cra.lazypull.config.daemon;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Explicit descriptor for one serialized field of a daemon configuration node.
 * <p><strong>Why:</strong> Serialization and redaction walk these descriptors instead of reflecting over
 * object structure, so every key, secret marker and omission policy is visible at compile time.</p>
 * <p><strong>Role:</strong> Value object produced by {@link ConfigNode#fields()} and consumed by the JSON
 * writer and the secret redactor.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; the referenced value is owned by the node.</p>
 *
 * @param key serialization key written to JSON
 * @param value field value: {@link String}, {@link Boolean}, {@link Number}, {@code Map<String, String>},
 *     a list of {@link ConfigNode}s, a nested {@link ConfigNode}, or {@code null}
 * @param secret whether the value carries credentials and must never appear in diagnostic output
 * @param omitIfZero whether the field is skipped when {@link #isZero()} holds
 * @since 0.1.0
 */
public record ConfigField(String key, Object value, boolean secret, boolean omitIfZero) {

  public ConfigField {
    Objects.requireNonNull(key, "key");
  }

  /**
   * Field that is always written, even when it holds a zero value.
   *
   * @param key serialization key
   * @param value field value
   * @return descriptor
   */
  public static ConfigField of(String key, Object value) {
    return new ConfigField(key, value, false, false);
  }

  /**
   * Field that is skipped when its value is the zero value for its type.
   *
   * @param key serialization key
   * @param value field value
   * @return descriptor
   */
  public static ConfigField omitEmpty(String key, Object value) {
    return new ConfigField(key, value, false, true);
  }

  /**
   * Credential-bearing field. Written by full dumps when non-empty, never by redacted dumps.
   *
   * @param key serialization key
   * @param value secret value
   * @return descriptor
   */
  public static ConfigField secret(String key, Object value) {
    return new ConfigField(key, value, true, true);
  }

  /**
   * Indicates whether the value equals the zero value of its type.
   *
   * @return {@code true} for {@code null}, empty strings, {@code false}, numeric zero, empty collections
   *     and maps, and nodes whose every field is zero
   */
  public boolean isZero() {
    return isZeroValue(value);
  }

  static boolean isZeroValue(Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof String s) {
      return s.isEmpty();
    }
    if (value instanceof Boolean b) {
      return !b;
    }
    if (value instanceof Number n) {
      return n.longValue() == 0L && n.doubleValue() == 0.0d;
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    if (value instanceof ConfigNode node) {
      for (ConfigField field : node.fields()) {
        if (!field.isZero()) {
          return false;
        }
      }
      return true;
    }
    return false;
  }
}
