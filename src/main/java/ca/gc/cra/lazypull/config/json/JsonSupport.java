package ca.gc.cra.lazypull.config.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON reader that turns documents into mutable {@link Map}/{@link List} graphs.
 *
 * <p>Object key order is preserved. Duplicate keys keep the last value, matching common JSON
 * decoders.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON document whose root must be an object.
   *
   * @param reader source; not closed by this method
   * @return parsed root object
   * @throws IOException when the source cannot be read
   * @throws IllegalArgumentException when the document is not valid JSON or its root is not an object
   */
  public Map<String, Object> parseObject(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("JSON document root must be an object");
      }
      Map<String, Object> root = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return root;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON document: " + ex.getOriginalMessage(), ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
