package ca.gc.cra.lazypull.config.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.lazypull.config.daemon.ConfigField;
import ca.gc.cra.lazypull.config.daemon.ConfigNode;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigJsonWriterTest {

  @Test
  void writesFieldsInDeclarationOrder() throws IOException {
    ConfigNode node = () -> List.of(
        ConfigField.of("name", "cache"),
        ConfigField.of("enabled", true),
        ConfigField.of("size", 3),
        ConfigField.of("ratio", 0.5d));

    assertEquals("{\"name\":\"cache\",\"enabled\":true,\"size\":3,\"ratio\":0.5}", ConfigJsonWriter.write(node));
  }

  @Test
  void omitIfZeroSkipsOnlyZeroValues() throws IOException {
    ConfigNode node = () -> List.of(
        ConfigField.omitEmpty("empty", ""),
        ConfigField.omitEmpty("zero", 0),
        ConfigField.omitEmpty("off", false),
        ConfigField.omitEmpty("list", List.of()),
        ConfigField.of("kept", ""),
        ConfigField.omitEmpty("set", "x"));

    assertEquals("{\"kept\":\"\",\"set\":\"x\"}", ConfigJsonWriter.write(node));
  }

  @Test
  void nullReferenceFieldIsWrittenAsNull() throws IOException {
    ConfigNode node = () -> List.of(ConfigField.of("device", null));

    assertEquals("{\"device\":null}", ConfigJsonWriter.write(node));
  }

  @Test
  void writesNestedNodesListsAndMaps() throws IOException {
    ConfigNode mirror = () -> List.of(ConfigField.of("host", "m1"));
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("X-A", "1");
    ConfigNode node = () -> List.of(
        ConfigField.of("mirrors", List.of(mirror)),
        ConfigField.of("headers", headers));

    assertEquals("{\"mirrors\":[{\"host\":\"m1\"}],\"headers\":{\"X-A\":\"1\"}}", ConfigJsonWriter.write(node));
  }

  @Test
  void unsupportedValueTypeFails() {
    ConfigNode node = () -> List.of(ConfigField.of("when", new Object()));

    assertThrows(IOException.class, () -> ConfigJsonWriter.write(node));
  }
}
