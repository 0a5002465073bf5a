package ca.gc.cra.lazypull.config.daemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonObjectsTest {

  @Test
  void asObjectCopiesEntriesInOrder() {
    Map<Object, Object> raw = new LinkedHashMap<>();
    raw.put("scheme", "https");
    raw.put("host", "registry.example.com");

    Map<String, Object> typed = JsonObjects.asObject(raw, "config");

    assertNotSame(raw, typed);
    assertEquals(List.of("scheme", "host"), List.copyOf(typed.keySet()));
    assertEquals("registry.example.com", typed.get("host"));
  }

  @Test
  void asObjectRejectsNonStringKeys() {
    Map<Object, Object> raw = Map.of(1, "x");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> JsonObjects.asObject(raw, "config"));
    assertEquals("config contains non-string key", ex.getMessage());
  }

  @Test
  void asObjectRejectsNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> JsonObjects.asObject(List.of(), "config"));
  }
}
