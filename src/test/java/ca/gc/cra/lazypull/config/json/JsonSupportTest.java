package ca.gc.cra.lazypull.config.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedObjectsPreservingKeyOrder() throws IOException {
    Map<String, Object> root = json.parseObject(new StringReader(
        "{\"b\": 1, \"a\": {\"list\": [true, null, \"x\"]}, \"c\": null}"));

    assertEquals(List.of("b", "a", "c"), List.copyOf(root.keySet()));
    assertEquals(1, ((Number) root.get("b")).intValue());
    @SuppressWarnings("unchecked")
    Map<String, Object> nested = (Map<String, Object>) root.get("a");
    assertEquals(java.util.Arrays.asList(true, null, "x"), nested.get("list"));
    assertNull(root.get("c"));
  }

  @Test
  void rootMustBeAnObject() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("[1, 2]")));
  }

  @Test
  void malformedDocumentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("{\"a\": }")));
  }

  @Test
  void trailingContentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject(new StringReader("{} {}")));
  }
}
