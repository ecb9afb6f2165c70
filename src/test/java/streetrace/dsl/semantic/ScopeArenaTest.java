package streetrace.dsl.semantic;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import streetrace.dsl.semantic.ScopeArena.ScopeType;
import streetrace.dsl.semantic.ScopeArena.Symbol;

/**
 * ScopeArena 单元测试：父链查找与兄弟作用域隔离
 */
public class ScopeArenaTest {

  private ScopeArena arena;

  @BeforeEach
  public void setUp() {
    arena = new ScopeArena();
  }

  @Test
  public void testBuiltinsInGlobalScope() {
    assertEquals(Symbol.Kind.BUILTIN, arena.lookup(ScopeArena.GLOBAL, "input_prompt").orElseThrow().kind);
    assertEquals(ScopeType.GLOBAL, arena.typeOf(ScopeArena.GLOBAL));
  }

  @Test
  public void testLookupWalksParentChain() {
    int flow = arena.open(ScopeType.FLOW, ScopeArena.GLOBAL);
    arena.define(flow, "task", Symbol.Kind.PARAMETER, null);
    int block = arena.open(ScopeType.BLOCK, flow);
    int nested = arena.open(ScopeType.BLOCK, block);

    assertTrue(arena.lookup(nested, "task").isPresent(), "嵌套块应能看到 flow 参数");
    assertTrue(arena.lookup(nested, "session_id").isPresent(), "嵌套块应能看到内建名");
    assertFalse(arena.isDefinedLocally(nested, "task"));
    assertEquals(block, arena.parentOf(nested));
  }

  @Test
  public void testSiblingScopesAreIsolated() {
    int flow = arena.open(ScopeType.FLOW, ScopeArena.GLOBAL);
    int first = arena.open(ScopeType.BLOCK, flow);
    int second = arena.open(ScopeType.BLOCK, flow);
    arena.define(first, "x", Symbol.Kind.VARIABLE, null);

    assertTrue(arena.lookup(first, "x").isPresent());
    assertTrue(arena.lookup(second, "x").isEmpty(), "兄弟作用域互不可见");
    assertTrue(arena.lookup(flow, "x").isEmpty(), "父作用域看不到子作用域的变量");
  }

  @Test
  public void testOpenRejectsUnknownParent() {
    assertThrows(IllegalArgumentException.class, () -> arena.open(ScopeType.BLOCK, 42));
  }
}
