package streetrace.dsl.semantic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import streetrace.dsl.ast.DslAst.EscalationCondition;
import streetrace.dsl.ast.DslAst.PromptDef;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.errors.ErrorCode;

/**
 * PromptMerger 单元测试
 * <p>
 * 测试目标：
 * 1. 声明与正文以任意顺序出现时合并结果一致
 * 2. 修饰符冲突只报告一次 E0014 并给出两个值
 * 3. 全部为空正文时只报告一次 E0013
 * 4. 后出现的空正文声明不会清空已有正文
 */
public class PromptMergerTest {

  private List<SemanticError> errors;
  private PromptMerger merger;

  @BeforeEach
  public void setUp() {
    errors = new ArrayList<>();
    merger = new PromptMerger(errors);
  }

  private static PromptDef decl(String model, String expecting, String inherit, int line) {
    return new PromptDef("p", "", model, expecting, inherit, null, new SourcePosition(line, 1));
  }

  private static PromptDef body(String text, int line) {
    return new PromptDef("p", text, null, null, null, null, new SourcePosition(line, 1));
  }

  private Map<String, PromptDef> mergeAll(List<PromptDef> defs) {
    for (PromptDef d : defs) {
      merger.add(d);
    }
    return merger.finish();
  }

  @Test
  public void testMergeIsOrderIndependent() {
    PromptDef a = decl("main", null, null, 1);
    PromptDef b = decl(null, "R", "$history", 2);
    PromptDef c = body("Body text.", 3);
    List<List<PromptDef>> orders = List.of(
        List.of(a, b, c), List.of(a, c, b), List.of(b, a, c),
        List.of(b, c, a), List.of(c, a, b), List.of(c, b, a));

    for (List<PromptDef> order : orders) {
      setUp();
      PromptDef merged = mergeAll(order).get("p");
      assertTrue(errors.isEmpty(), "无冲突时不应有错误: " + errors);
      assertEquals("Body text.", merged.body);
      assertEquals("main", merged.model);
      assertEquals("R", merged.expecting);
      assertEquals("$history", merged.inherit);
    }
  }

  @Test
  public void testAgreeingModifiersDoNotConflict() {
    mergeAll(List.of(decl("main", "R", null, 1), decl("main", "R", null, 2), body("x", 3)));
    assertTrue(errors.isEmpty(), "相同的修饰符值不算冲突");
  }

  @Test
  public void testConflictReportsBothValuesOnce() {
    PromptDef merged = mergeAll(List.of(decl("fast", null, null, 1), decl("slow", null, null, 2), body("x", 3)))
        .get("p");

    assertEquals(1, errors.size(), "应只报告一次冲突");
    SemanticError e = errors.get(0);
    assertEquals(ErrorCode.E0014, e.code());
    assertTrue(e.message().contains("'fast'"), "消息应包含第一个值");
    assertTrue(e.message().contains("'slow'"), "消息应包含第二个值");
    assertTrue(e.message().contains("model"), "消息应指明冲突字段");
    assertEquals(2, e.position().line, "位置应指向后出现的定义");
    assertEquals("fast", merged.model, "保留第一个提供的值");
  }

  @Test
  public void testEscalationConflict() {
    mergeAll(List.of(
        new PromptDef("p", "x", null, null, null, new EscalationCondition("~", "A"), null),
        new PromptDef("p", "", null, null, null, new EscalationCondition("==", "A"), null)));
    assertEquals(1, errors.size());
    assertEquals(ErrorCode.E0014, errors.get(0).code());
  }

  @Test
  public void testMissingBodyReportedOnce() {
    mergeAll(List.of(decl("m", null, null, 1), decl(null, "R", null, 2), decl(null, null, null, 3)));

    assertEquals(1, errors.size());
    assertEquals(ErrorCode.E0013, errors.get(0).code());
    assertEquals("prompt 'p' has no body", errors.get(0).message());
  }

  @Test
  public void testMiddleBodySurvivesLaterEmptyDeclaration() {
    PromptDef merged = mergeAll(List.of(decl("m", null, null, 1), body("Middle.", 2), decl(null, "R", null, 3)))
        .get("p");

    assertTrue(errors.isEmpty());
    assertEquals("Middle.", merged.body);
    assertEquals("R", merged.expecting);
  }

  @Test
  public void testLaterNonEmptyBodyReplacesEarlier() {
    PromptDef merged = mergeAll(List.of(body("first", 1), body("second", 2))).get("p");
    assertEquals("second", merged.body);
    assertEquals(1, merged.position.line, "合并结果保留首次出现的位置");
  }

  @Test
  public void testDistinctNamesKeptSeparately() {
    merger.add(new PromptDef("a", "A"));
    merger.add(new PromptDef("b", "B"));
    Map<String, PromptDef> merged = merger.finish();
    assertEquals(List.of("a", "b"), List.copyOf(merged.keySet()));
  }
}
