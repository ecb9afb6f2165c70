package streetrace.dsl.runtime;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Builtins 单元测试
 */
public class BuiltinsTest {

  @Test
  public void testStringFunctions() {
    assertEquals("ABC", Builtins.call("upper", "abc"));
    assertEquals("abc", Builtins.call("lower", "ABC"));
    assertEquals("x", Builtins.call("trim", "  x "));
    assertEquals("", Builtins.call("str", (Object) null));
  }

  @Test
  public void testCollectionFunctions() {
    assertEquals(3, Builtins.call("len", List.of(1, 2, 3)));
    assertEquals(0, Builtins.call("len", (Object) null));
    assertEquals("a, b", Builtins.call("join", List.of("a", "b")));
    assertEquals("a|b", Builtins.call("join", List.of("a", "b"), "|"));
    assertEquals(List.of("k"), Builtins.call("keys", Map.of("k", 1)));
    assertEquals(1, Builtins.call("first", List.of(1, 2)));
    assertNull(Builtins.call("last", List.of()));
  }

  @Test
  public void testDottedNameUsesLastSegment() {
    assertTrue(Builtins.has("lib.text.upper"));
    assertEquals("HI", Builtins.call("lib.text.upper", "hi"));
  }

  @Test
  public void testErrors() {
    Builtins.BuiltinException unknown = assertThrows(Builtins.BuiltinException.class,
        () -> Builtins.call("explode", 1));
    assertTrue(unknown.getMessage().startsWith("unknown function: explode"));
    assertThrows(Builtins.BuiltinException.class, () -> Builtins.call("len", 1, 2));
    assertThrows(Builtins.BuiltinException.class, () -> Builtins.call("len", 42));
    assertThrows(Builtins.BuiltinException.class, () -> Builtins.call("keys", List.of()));
  }
}
