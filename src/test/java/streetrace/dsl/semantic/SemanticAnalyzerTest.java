package streetrace.dsl.semantic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import streetrace.dsl.ast.AstBuilder;
import streetrace.dsl.ast.DslAst.DslFile;
import streetrace.dsl.ast.DslAst.FlowDef;
import streetrace.dsl.ast.DslAst.MaskAction;
import streetrace.dsl.ast.DslAst.PromptDef;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.errors.ErrorCode;
import streetrace.dsl.grammar.DslParser;

/**
 * SemanticAnalyzer 单元测试
 * <p>
 * 测试目标：
 * 1. 端到端场景：分散声明的 prompt 合并后无错误
 * 2. 重复定义、未定义引用与建议文本
 * 3. 块作用域隔离与 on start 全局变量
 * 4. 循环引用、循环外 continue、instruction 插值等规则
 * 5. 错误全部累积后一次返回
 */
public class SemanticAnalyzerTest {

  private SemanticAnalyzer analyzer;

  @BeforeEach
  public void setUp() {
    analyzer = new SemanticAnalyzer();
  }

  private AnalysisResult analyze(String source) {
    return analyzer.analyze(AstBuilder.build(DslParser.parse(source)));
  }

  private static List<ErrorCode> codes(List<SemanticError> errors) {
    return errors.stream().map(SemanticError::code).collect(Collectors.toList());
  }

  private static final String PRELUDE = """
      prompt p: "Do the work."
      agent a:
          instruction p
      """;

  @Test
  public void testEndToEndScenario() {
    AnalysisResult result = analyze("""
        streetrace v1
        model main = provider/model-x
        prompt p expecting R using model "main"
        schema R:
            value: string
        prompt p: \"""Body text.\"""
        agent:
            instruction p
        """);

    assertTrue(result.isValid(), "应无错误: " + result.errors());
    PromptDef p = result.symbols().mergedPrompts().get("p");
    assertEquals("Body text.", p.body);
    assertEquals("main", p.model);
    assertEquals("R", p.expecting);
    assertEquals("provider/model-x", result.symbols().models().get("main").providerModel);
    assertTrue(result.symbols().agents().containsKey("default"), "未命名 agent 应登记为 default");
  }

  @Test
  public void testDuplicateModelKeepsFirst() {
    AnalysisResult result = analyze("""
        model m = provider/first
        model m = provider/second
        """);

    assertEquals(List.of(ErrorCode.E0003), codes(result.errors()));
    SemanticError e = result.errors().get(0);
    assertEquals("duplicate definition of model 'm'", e.message());
    assertEquals(2, e.position().line);
    assertEquals("first defined at line 1", e.suggestion());
    assertEquals("provider/first", result.symbols().models().get("m").providerModel);
  }

  @Test
  public void testExplicitDefaultAgentCollidesWithUnnamed() {
    AnalysisResult result = analyze(PRELUDE + """
        agent:
            instruction p
        agent default:
            instruction p
        """);
    assertEquals(List.of(ErrorCode.E0003), codes(result.errors()));
    assertTrue(result.errors().get(0).message().contains("agent 'default'"));
  }

  @Test
  public void testLoopVariableNotVisibleAfterLoop() {
    AnalysisResult result = analyze("""
        flow main:
            for $item in [1, 2] do
                $seen = $item
                if $seen:
                    log $item
            end
            log $seen
        """);

    assertEquals(List.of(ErrorCode.E0002), codes(result.errors()), "嵌套块可见、块外不可见");
    SemanticError e = result.errors().get(0);
    assertEquals("variable '$seen' used before definition", e.message());
    assertEquals(7, e.position().line);
  }

  @Test
  public void testMatchCasesAreIsolated() {
    AnalysisResult result = analyze("""
        flow main $kind:
            match $kind
                when "a" -> $x = 1
                when "b" -> log $x
                else -> log $kind
            end
        """);
    assertEquals(List.of(ErrorCode.E0002), codes(result.errors()), "兄弟分支中的变量不可见");
  }

  @Test
  public void testIfBlockVariableNotVisibleAfterBlock() {
    AnalysisResult result = analyze("""
        flow main:
            if true:
                $y = 1
            log $y
        """);
    assertEquals(List.of(ErrorCode.E0002), codes(result.errors()));
  }

  @Test
  public void testLoopBodySharesEnclosingScope() {
    AnalysisResult result = analyze("""
        flow main:
            loop max 2 do
                $z = 1
            end
            log $z
        """);
    assertTrue(result.isValid(), "loop 体不新建作用域: " + result.errors());
  }

  @Test
  public void testPushRequiresExistingVariable() {
    AnalysisResult result = analyze("""
        flow main:
            push 1 to $items
        """);
    assertEquals(List.of(ErrorCode.E0002), codes(result.errors()));
    assertEquals("assign '$items' before using it", result.errors().get(0).suggestion());

    AnalysisResult ok = analyze("""
        flow main:
            $items = []
            push 1 to $items
        """);
    assertTrue(ok.isValid());
  }

  @Test
  public void testFlowParametersAndBuiltinsResolve() {
    AnalysisResult result = analyze("""
        flow main $task:
            log $task
            log initial user prompt
            log $session_id
        """);
    assertTrue(result.isValid(), result.errors().toString());
  }

  @Test
  public void testProducesDefinesVariable() {
    AnalysisResult result = analyze("""
        prompt p: "x"
        agent a:
            instruction p
            produces $result
        flow main:
            run agent a
            return $result
        """);
    assertTrue(result.isValid(), "produces 应定义变量: " + result.errors());
  }

  @Test
  public void testOnStartVariablesAreGlobal() {
    AnalysisResult result = analyze("""
        flow main:
            log $goal
        on start do
            $goal = "ship it"
        end
        """);
    assertTrue(result.isValid(), "on start 赋值的变量全局可见: " + result.errors());
  }

  @Test
  public void testOtherHandlerVariablesAreLocal() {
    AnalysisResult result = analyze("""
        on input do
            $tmp = 1
        end
        flow main:
            log $tmp
        """);
    assertEquals(List.of(ErrorCode.E0002), codes(result.errors()));
  }

  @Test
  public void testMissingInstruction() {
    AnalysisResult result = analyze("""
        tool t = builtin streetrace.fs
        agent a:
            tools t
        """);
    assertEquals(List.of(ErrorCode.E0010), codes(result.errors()));
    SemanticError e = result.errors().get(0);
    assertEquals("missing required property 'instruction' in agent 'a'", e.message());
    assertEquals(SemanticAnalyzer.INSTRUCTION_HELP, e.suggestion());
  }

  @Test
  public void testToolWithoutType() {
    AnalysisResult result = analyze("""
        tool t:
            url: "http://localhost"
        """);
    assertEquals(List.of(ErrorCode.E0010), codes(result.errors()));
  }

  @Test
  public void testUndefinedReferencesWithSuggestions() {
    AnalysisResult result = analyze("""
        prompt analyze: "x"
        prompt summary: "y"
        agent a:
            instruction analyse
        agent b:
            instruction zzz
        """);
    assertEquals(List.of(ErrorCode.E0001, ErrorCode.E0001), codes(result.errors()));
    assertEquals("undefined reference to prompt 'analyse'", result.errors().get(0).message());
    assertEquals("did you mean 'analyze'?", result.errors().get(0).suggestion());
    assertEquals("defined prompts are: analyze, summary", result.errors().get(1).suggestion());
  }

  @Test
  public void testAgentReferenceErrorsPointAtPropertyLine() {
    AnalysisResult result = analyze("""
        prompt p: "x"
        agent a:
            description "reviewer"
            instruction p
            tools missing_tool
            retry missing_retry
            timeout missing_timeout
            delegate ghost
        """);
    assertEquals(List.of(ErrorCode.E0001, ErrorCode.E0001, ErrorCode.E0001, ErrorCode.E0001),
        codes(result.errors()));
    List<Integer> lines = result.errors().stream().map(e -> e.position().line).toList();
    assertEquals(List.of(5, 6, 7, 8), lines, "错误应定位到出错属性所在行");
  }

  @Test
  public void testMissingInstructionPointsAtAgent() {
    AnalysisResult result = analyze("""
        tool t = builtin a.b
        agent a:
            tools t
        """);
    assertEquals(List.of(ErrorCode.E0010), codes(result.errors()));
    assertEquals(2, result.errors().get(0).position().line);
  }

  @Test
  public void testCustomSuggestionStrategy() {
    SemanticAnalyzer custom = new SemanticAnalyzer((kind, name, candidates) -> Optional.of("custom " + kind.label()));
    AnalysisResult result = custom.analyze(AstBuilder.build(DslParser.parse("""
        agent a:
            instruction missing
        """)));
    assertEquals("custom prompt", result.errors().get(0).suggestion());
  }

  @Test
  public void testCircularAgentReference() {
    AnalysisResult result = analyze("""
        prompt p: "x"
        agent a:
            instruction p
            delegate b
        agent b:
            instruction p
            delegate a
        """);
    assertEquals(List.of(ErrorCode.E0011), codes(result.errors()), "同一个环只报告一次");
    assertEquals("circular agent reference detected: a -> b -> a", result.errors().get(0).message());
  }

  @Test
  public void testDelegateAndUseWarning() {
    AnalysisResult result = analyze(PRELUDE + """
        agent b:
            instruction p
        agent c:
            instruction p
            delegate a
            use b
        """);
    assertTrue(result.isValid(), "警告不影响有效性");
    assertEquals(List.of(ErrorCode.W0002), codes(result.warnings()));
  }

  @Test
  public void testContinueOutsideLoop() {
    AnalysisResult result = analyze(PRELUDE + """
        flow main:
            continue
            run agent a, on escalate continue
            loop max 3 do
                continue
            end
        """);
    assertEquals(List.of(ErrorCode.E0012, ErrorCode.E0012), codes(result.errors()));
    assertEquals("'continue' is only allowed inside a loop", result.errors().get(0).message());
    assertEquals("'on escalate continue' is only allowed inside a loop", result.errors().get(1).message());
  }

  @Test
  public void testInstructionInterpolationReportedOncePerName() {
    AnalysisResult result = analyze("""
        prompt style: "Be brief."
        prompt p: "Summarize ${topic} for ${input_prompt}. ${style} ${topic}"
        agent a:
            instruction p
        agent b:
            instruction p
        """);
    assertEquals(List.of(ErrorCode.E0016), codes(result.errors()));
    assertEquals("instruction 'p' references runtime variable '$topic'", result.errors().get(0).message());
  }

  @Test
  public void testGuardrailOutsideHandler() {
    SourcePosition pos = new SourcePosition(2, 5);
    DslFile file = new DslFile(null, List.of(new FlowDef("main", List.of(new MaskAction("pii", pos)))));
    AnalysisResult result = analyzer.analyze(file);
    assertEquals(List.of(ErrorCode.E0009), codes(result.errors()));
    assertEquals("invalid guardrail action 'mask' in flow context", result.errors().get(0).message());
  }

  @Test
  public void testGuardrailInsideHandler() {
    AnalysisResult result = analyze("""
        on output do
            mask pii
            block if $current_agent contains "secret"
            warn "careful"
        end
        """);
    assertTrue(result.isValid(), "处理器内允许守卫动作: " + result.errors());
  }

  @Test
  public void testErrorsAreAccumulated() {
    AnalysisResult result = analyze("""
        tool t = builtin a.b
        tool t = builtin c.d
        prompt p using model "missing": "x"
        flow main:
            run undefined flow
        """);
    assertFalse(result.isValid());
    assertEquals(List.of(ErrorCode.E0003, ErrorCode.E0001, ErrorCode.E0001), codes(result.errors()));
  }

  @Test
  public void testSchemaFieldReferencesUnknownSchema() {
    AnalysisResult result = analyze("""
        schema Report:
            items: list[Item]
            title: string
        """);
    assertEquals(List.of(ErrorCode.E0001), codes(result.errors()));
    assertTrue(result.errors().get(0).message().contains("schema 'Item'"));
  }
}
