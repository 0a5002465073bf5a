package ca.gc.cra.lazypull.config.daemon;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over the map/list graph produced by {@link ca.gc.cra.lazypull.config.json.JsonSupport}.
 *
 * <p>Absent keys and JSON {@code null} map to the type's zero value. Values of the wrong JSON type
 * raise {@link IllegalArgumentException} naming the key.</p>
 */
final class JsonObjects {

  private JsonObjects() {}

  static String string(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return "";
    }
    if (value instanceof String s) {
      return s;
    }
    throw typeMismatch(key, "a string", value);
  }

  static boolean bool(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    throw typeMismatch(key, "a boolean", value);
  }

  static int integer(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return 0;
    }
    if (value instanceof Number n) {
      long asLong = n.longValue();
      if (asLong != n.doubleValue() || asLong < Integer.MIN_VALUE || asLong > Integer.MAX_VALUE) {
        throw new IllegalArgumentException(key + " must be a 32-bit integer (was " + value + ")");
      }
      return (int) asLong;
    }
    throw typeMismatch(key, "an integer", value);
  }

  static Map<String, String> stringMap(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return Map.of();
    }
    Map<String, Object> raw = asObject(value, key);
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      if (!(entry.getValue() instanceof String s)) {
        throw typeMismatch(key + "." + entry.getKey(), "a string", entry.getValue());
      }
      result.put(entry.getKey(), s);
    }
    return result;
  }

  /**
   * Returns the nested object under {@code key}, or {@code null} when absent.
   */
  static Map<String, Object> object(Map<String, Object> json, String key) {
    Object value = json.get(key);
    return value == null ? null : asObject(value, key);
  }

  static Map<String, Object> objectOrEmpty(Map<String, Object> json, String key) {
    Map<String, Object> value = object(json, key);
    return value == null ? Map.of() : value;
  }

  static List<Map<String, Object>> objectList(Map<String, Object> json, String key) {
    Object value = json.get(key);
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw typeMismatch(key, "an array", value);
    }
    List<Map<String, Object>> result = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      result.add(asObject(list.get(i), key + "[" + i + "]"));
    }
    return result;
  }

  static Map<String, Object> asObject(Object value, String context) {
    if (!(value instanceof Map<?, ?> map)) {
      throw typeMismatch(context, "an object", value);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      result.put(key, entry.getValue());
    }
    return result;
  }

  private static IllegalArgumentException typeMismatch(String key, String expected, Object actual) {
    String actualType = actual == null ? "null" : actual.getClass().getSimpleName();
    return new IllegalArgumentException(key + " must be " + expected + " (was " + actualType + ")");
  }
}
