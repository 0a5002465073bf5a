package ca.gc.cra.lazypull.config.json;

import ca.gc.cra.lazypull.config.daemon.ConfigField;
import ca.gc.cra.lazypull.config.daemon.ConfigNode;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes configuration nodes and plain map/list graphs as compact JSON.
 *
 * <p>For {@link ConfigNode}s every field is written, secrets included, except omit-if-zero fields that
 * hold a zero value. A {@code null} reference that is not omit-if-zero is written as JSON {@code null}.
 * This is the form the daemon process consumes; it must never be logged.</p>
 *
 * @since 0.1.0
 */
public final class ConfigJsonWriter {
  private static final JsonFactory FACTORY = new JsonFactory();

  private ConfigJsonWriter() {}

  /**
   * Encodes a configuration node including its secrets.
   *
   * @param node root node
   * @return compact JSON document
   * @throws IOException when a value cannot be encoded
   */
  public static String write(ConfigNode node) throws IOException {
    Objects.requireNonNull(node, "node");
    return render(node);
  }

  /**
   * Encodes a map/list graph such as a redacted configuration.
   *
   * @param map root object
   * @return compact JSON document
   * @throws IOException when a value cannot be encoded
   */
  public static String write(Map<String, ?> map) throws IOException {
    Objects.requireNonNull(map, "map");
    return render(map);
  }

  private static String render(Object root) throws IOException {
    StringWriter out = new StringWriter(512);
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      writeValue(gen, root);
    }
    return out.toString();
  }

  private static void writeNode(JsonGenerator gen, ConfigNode node) throws IOException {
    gen.writeStartObject();
    for (ConfigField field : node.fields()) {
      if (field.omitIfZero() && field.isZero()) {
        continue;
      }
      gen.writeFieldName(field.key());
      writeValue(gen, field.value());
    }
    gen.writeEndObject();
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof ConfigNode node) {
      writeNode(gen, node);
    } else if (value instanceof String s) {
      gen.writeString(s);
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number n) {
      gen.writeNumber(n.doubleValue());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> collection) {
      gen.writeStartArray();
      for (Object element : collection) {
        writeValue(gen, element);
      }
      gen.writeEndArray();
    } else {
      throw new IOException("Unsupported configuration value type: " + value.getClass().getName());
    }
  }
}
