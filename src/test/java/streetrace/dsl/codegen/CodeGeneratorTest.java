package streetrace.dsl.codegen;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import streetrace.dsl.ast.AstBuilder;
import streetrace.dsl.ast.DslAst.DslFile;
import streetrace.dsl.codegen.FlowModel.*;
import streetrace.dsl.errors.ErrorCode;
import streetrace.dsl.grammar.DslParser;
import streetrace.dsl.semantic.AnalysisResult;
import streetrace.dsl.semantic.SemanticAnalyzer;
import streetrace.dsl.sourcemap.SourceMapRegistry;
import streetrace.dsl.sourcemap.SourceMapping;

/**
 * CodeGenerator 单元测试
 * <p>
 * 测试目标：
 * 1. 每条语句一条源码映射，映射行号都来自输入
 * 2. 控制结构降级为跳转与保护区
 * 3. prompt 注册表取自合并结果
 * 4. 结构性错误抛出 LoweringError
 */
public class CodeGeneratorTest {

  private static final String SOURCE = "workflow.sr";

  private CodeGenerator generator;

  @BeforeEach
  public void setUp() {
    generator = new CodeGenerator();
  }

  private GenerationResult generate(String source) {
    DslFile ast = AstBuilder.build(DslParser.parse(source));
    AnalysisResult analysis = new SemanticAnalyzer().analyze(ast);
    assertTrue(analysis.isValid(), "测试源码应通过语义分析: " + analysis.errors());
    return generator.generate(ast, SOURCE, analysis.symbols().mergedPrompts());
  }

  private static List<String> kinds(FlowUnit unit) {
    return unit.instructions.stream().map(i -> i.getClass().getSimpleName()).collect(Collectors.toList());
  }

  private static final String AGENTS = """
      prompt p: "Do the work."
      prompt ask: "What should I do?"
      agent a:
          instruction p
          produces $draft
      agent b:
          instruction p
          prompt ask
      """;

  @Test
  public void testOneMappingPerStatement() {
    String source = """
        flow main $x:
            $a = 1
            if $a > 0:
                log "yes"
            for $i in [1, 2] do
                log $i
            end
            return $a
        """;
    GenerationResult result = generate(source);
    String unit = SourceMapRegistry.unitName(SOURCE, "main");
    List<SourceMapping> mappings = result.sourceMap().mappings(unit);

    assertEquals(6, mappings.size(), "6 条语句应产生 6 条映射");
    assertEquals(List.of(2, 3, 4, 5, 6, 8),
        mappings.stream().map(SourceMapping::sourceLine).collect(Collectors.toList()));
    assertEquals(List.of(0, 1, 2, 3, 5, 7),
        mappings.stream().map(SourceMapping::generatedPosition).collect(Collectors.toList()));
    int lineCount = (int) source.lines().count();
    for (SourceMapping m : mappings) {
      assertTrue(m.sourceLine() >= 1 && m.sourceLine() <= lineCount, "映射行号应来自输入: " + m);
      assertEquals(SOURCE, m.sourceFile());
    }
  }

  @Test
  public void testControlFlowShape() {
    FlowUnit unit = generate("""
        flow main $x:
            $a = 1
            if $a > 0:
                log "yes"
            for $i in [1, 2] do
                log $i
            end
            return $a
        """).program().flows.get("main");

    assertEquals(List.of("x"), unit.params, "参数名去掉 $ 前缀");
    assertEquals(List.of("Assign", "JumpIfFalse", "Log", "IterInit", "IterNext", "Log", "Jump", "Assign", "Halt", "Halt"),
        kinds(unit));
    assertEquals(3, ((JumpIfFalse) unit.instructions.get(1)).target);
    IterNext next = (IterNext) unit.instructions.get(4);
    assertEquals("i", next.variable);
    assertEquals(7, next.exit);
    assertEquals(4, ((Jump) unit.instructions.get(6)).target);
    Assign ret = (Assign) unit.instructions.get(7);
    assertEquals(FlowModel.RETURN_SLOT, ret.target, "return 写入返回槽");
    assertEquals("a", ((Var) ret.value).name);
  }

  @Test
  public void testFailureRegion() {
    FlowUnit unit = generate("""
        flow main:
            $a = 1
            log $a
            on failure:
                log "failed"
            log "after"
        """).program().flows.get("main");

    assertEquals(List.of("Assign", "Log", "Jump", "Log", "Log", "Halt"), kinds(unit));
    assertEquals(1, unit.regions.size());
    ProtectedRegion region = unit.regions.get(0);
    assertEquals(0, region.start);
    assertEquals(2, region.end);
    assertEquals(3, region.handler);
    assertEquals(4, ((Jump) unit.instructions.get(2)).target, "正常路径跳过失败处理");
  }

  @Test
  public void testRunAgentDefaults() {
    FlowUnit unit = generate(AGENTS + """
        flow main:
            run agent a with "input"
            run agent b
        """).program().flows.get("main");

    RunAgent first = (RunAgent) unit.instructions.get(0);
    assertEquals("draft", first.target, "无显式目标时使用 produces");
    assertNull(first.promptInput);
    RunAgent second = (RunAgent) unit.instructions.get(1);
    assertEquals("ask", second.promptInput, "无输入时使用 agent 的默认 prompt");
    assertNull(second.target);
  }

  @Test
  public void testEscalationContinueTargetsLoopHead() {
    FlowUnit unit = generate(AGENTS + """
        flow main:
            loop max 3 do
                $r = run agent a, on escalate continue
            end
            $s = run agent a, on escalate return "stopped"
        """).program().flows.get("main");

    assertEquals(List.of("CounterInit", "CounterCheck", "RunAgent", "EscalationCheck", "Jump",
        "RunAgent", "EscalationCheck", "Halt"), kinds(unit));
    CounterCheck check = (CounterCheck) unit.instructions.get(1);
    assertEquals(3, check.max);
    assertEquals(5, check.exit);
    EscalationCheck cont = (EscalationCheck) unit.instructions.get(3);
    assertEquals("CONTINUE", cont.action);
    assertEquals(Integer.valueOf(1), cont.continueTarget);
    EscalationCheck ret = (EscalationCheck) unit.instructions.get(6);
    assertEquals("RETURN", ret.action);
    assertEquals("stopped", ((Const) ret.value).value);
  }

  @Test
  public void testParallelBranches() {
    GenerationResult result = generate(AGENTS + """
        flow main:
            parallel do
                $x = run agent a with 1
                run agent b
            end
        """);
    FlowUnit unit = result.program().flows.get("main");

    Parallel parallel = (Parallel) unit.instructions.get(0);
    assertEquals(2, parallel.branches.size());
    assertEquals("a", parallel.branches.get(0).name);
    assertEquals("x", parallel.branches.get(0).target);
    assertNull(parallel.branches.get(1).target);
    List<SourceMapping> mappings = result.sourceMap().mappings(SourceMapRegistry.unitName(SOURCE, "main"));
    assertEquals(3, mappings.size(), "parallel 本身与两个分支各一条映射");
    assertTrue(mappings.stream().allMatch(m -> m.generatedPosition() == 0), "分支映射到 Parallel 指令");
  }

  @Test
  public void testParallelRejectsNonRunStatement() {
    LoweringError e = assertThrows(LoweringError.class, () -> generate("""
        flow main:
            parallel do
                log "x"
            end
        """));
    assertEquals("parallel do only supports 'run agent' statements. Found: LogStmt", e.getMessage());
    assertEquals(3, e.getPosition().line);
  }

  @Test
  public void testParallelRejectsEscalationHandler() {
    LoweringError e = assertThrows(LoweringError.class, () -> generate(AGENTS + """
        flow main:
            parallel do
                $x = run agent a with 1
                $y = run agent b with 2, on escalate abort
            end
        """));
    assertTrue(e.getMessage().startsWith("'on escalate' is not supported inside parallel do"), e.getMessage());
    assertEquals(ErrorCode.E0018, e.getCode());
    assertEquals(12, e.getPosition().line, "错误应定位到带升级处理的分支");
  }

  @Test
  public void testMatchDispatch() {
    FlowUnit unit = generate("""
        flow main $kind:
            match $kind
                when "bug" -> $label = "fix"
                when "bug" -> $label = "ignored"
                else -> $label = "triage"
            end
        """).program().flows.get("main");

    MatchJump dispatch = (MatchJump) unit.instructions.get(0);
    assertEquals(1, dispatch.cases.size(), "重复模式以首个为准");
    assertEquals(Integer.valueOf(1), dispatch.cases.get("bug"));
    assertEquals(5, dispatch.defaultTarget);
    assertEquals(6, ((Jump) unit.instructions.get(2)).target);
    assertEquals(6, ((Jump) unit.instructions.get(4)).target);
  }

  @Test
  public void testMergedPromptCarriesSchema() {
    WorkflowProgram program = generate("""
        schema R:
            value: string
        prompt p expecting R[] using model "main"
        model main = provider/model-x
        prompt p: "Body text."
        """).program();

    PromptSpec spec = program.prompts.get("p");
    assertEquals("Body text.", spec.body);
    assertEquals("R", spec.schema);
    assertTrue(spec.schemaIsList);
    assertEquals("main", spec.model);
    assertTrue(program.schemas.contains("R"));
  }

  @Test
  public void testLogInterpolationBecomesTemplate() {
    FlowUnit unit = generate("""
        flow main $user:
            log "Hello ${user.name} from ${upper($user.team)}"
        """).program().flows.get("main");

    Template template = (Template) ((Log) unit.instructions.get(0)).message;
    assertEquals(4, template.parts.size());
    assertEquals("Hello ", template.parts.get(0).text);
    assertEquals(List.of("user", "name"), template.parts.get(1).path);
    assertEquals("upper", template.parts.get(3).function);
    assertEquals(List.of("user", "team"), template.parts.get(3).path);
  }

  @Test
  public void testHandlersAreConcatenatedPerEvent() {
    WorkflowProgram program = generate("""
        on input do
            mask pii
        end
        after output do
            warn "check"
        end
        on input do
            log "second"
        end
        """).program();

    assertEquals(List.of("on_input", "after_output"), List.copyOf(program.handlers.keySet()));
    FlowUnit input = program.handlers.get("on_input");
    assertEquals(List.of("Guardrail", "Log", "Halt"), kinds(input));
    assertEquals("mask", ((Guardrail) input.instructions.get(0)).action);
    assertEquals("pii", ((Guardrail) input.instructions.get(0)).guardrail);
  }

  @Test
  public void testRegistries() {
    WorkflowProgram program = generate(AGENTS + """
        model fast = anthropic/claude-haiku
        tool fs = builtin streetrace.fs
        retry standard = 3 times, exponential backoff
        timeout quick = 2 minutes
        agent c:
            instruction p
            timeout 1 hours
        """).program();

    assertEquals("anthropic/claude-haiku", program.models.get("fast").providerModel);
    assertEquals("builtin", program.tools.get("fs").type);
    assertEquals("exponential", program.retryPolicies.get("standard").backoff);
    assertEquals(120L, program.timeoutPolicies.get("quick").seconds());
    assertEquals(Long.valueOf(3600), program.agents.get("c").timeoutSeconds);
    assertEquals("draft", program.agents.get("a").produces);
  }

  @Test
  public void testLargeAgentTimeoutKeepsFullRange() {
    WorkflowProgram program = generate(AGENTS + """
        agent slow:
            instruction p
            timeout 1000000 hours
        """).program();
    assertEquals(Long.valueOf(3_600_000_000L), program.agents.get("slow").timeoutSeconds, "换算为秒不应截断");
  }
}
