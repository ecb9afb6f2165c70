package streetrace.dsl.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import streetrace.dsl.ast.DslAst.*;
import streetrace.dsl.errors.ErrorCode;
import streetrace.dsl.grammar.DslParser;
import streetrace.dsl.grammar.SyntaxError;

/**
 * AstBuilder 单元测试：解析树到 AST 的结构映射与位置保留
 */
public class AstBuilderTest {

  private static DslFile build(String source) {
    return AstBuilder.build(DslParser.parse(source));
  }

  @SuppressWarnings("unchecked")
  private static <T extends Definition> T only(String source, Class<T> type) {
    DslFile file = build(source);
    assertEquals(1, file.definitions.size(), "应只有一个顶层定义");
    Definition d = file.definitions.get(0);
    assertInstanceOf(type, d);
    return (T) d;
  }

  private static List<Stmt> flowBody(String body) {
    FlowDef flow = only("flow main:\n" + body.indent(4), FlowDef.class);
    return flow.body;
  }

  @Nested
  class Definitions {

    @Test
    public void testVersionAndImports() {
      DslFile file = build("""
          streetrace v1
          import tools from streetrace
          import ./shared/common.sr
          import helpers from pip "helpers-pkg"
          import fs from mcp "http://localhost:8080"
          """);
      assertEquals("v1", file.version.version);
      assertEquals(4, file.definitions.size());
      ImportDef local = (ImportDef) file.definitions.get(1);
      assertEquals(ImportKind.LOCAL, local.kind);
      assertEquals("./shared/common.sr", local.source);
      ImportDef mcp = (ImportDef) file.definitions.get(3);
      assertEquals(ImportKind.MCP, mcp.kind);
      assertEquals("http://localhost:8080", mcp.source);
    }

    @Test
    public void testModelShortAndLongForm() {
      DslFile file = build("""
          model fast = anthropic/claude-haiku
          model smart:
              provider: anthropic
              name: claude-opus
              temperature: 0.2
              max_tokens: 4096
          """);
      ModelDef fast = (ModelDef) file.definitions.get(0);
      assertEquals("anthropic/claude-haiku", fast.providerModel);
      ModelDef smart = (ModelDef) file.definitions.get(1);
      assertEquals("anthropic/claude-opus", smart.providerModel);
      assertEquals(0.2, smart.properties.get("temperature"));
      assertEquals(4096, smart.properties.get("max_tokens"));
    }

    @Test
    public void testToolForms() {
      DslFile file = build("""
          tool fs = builtin streetrace.fs
          tool github = mcp "https://api.github.com/mcp" with auth bearer "token-1"
          tool search:
              type: mcp
              url: "https://search.example/mcp"
              headers:
                  X-Api-Key: "k"
          """);
      ToolDef fs = (ToolDef) file.definitions.get(0);
      assertEquals(ToolKind.BUILTIN, fs.kind);
      assertEquals("streetrace.fs", fs.builtinRef);
      ToolDef github = (ToolDef) file.definitions.get(1);
      assertEquals(ToolKind.MCP, github.kind);
      assertEquals("bearer", github.authType);
      assertEquals("token-1", github.authValue);
      ToolDef search = (ToolDef) file.definitions.get(2);
      assertEquals(ToolKind.MCP, search.kind);
      assertEquals("https://search.example/mcp", search.url);
      assertEquals(Map.of("X-Api-Key", "k"), search.headers);
    }

    @Test
    public void testSchemaFieldTypes() {
      SchemaDef schema = only("""
          schema Review:
              title: string
              tags: string[]
              score: float?
              items: list[Item]
          """, SchemaDef.class);
      assertEquals(4, schema.fields.size());
      TypeExpr tags = schema.fields.get(1).type;
      assertTrue(tags.isList);
      assertFalse(tags.isOptional);
      assertTrue(schema.fields.get(2).type.isOptional);
      TypeExpr items = schema.fields.get(3).type;
      assertEquals("Item", items.baseType);
      assertTrue(items.isList);
    }

    @Test
    public void testPromptModifiersAndTripleQuotedBody() {
      PromptDef prompt = only("""
          prompt review using model "fast" expecting Review[] inherit $history: \"""
              Review the code.
                Be concise.
              \"""
              escalate if ~ "NEEDS HUMAN"
          """, PromptDef.class);
      assertEquals("fast", prompt.model);
      assertEquals("Review[]", prompt.expecting);
      assertEquals("Review", prompt.schemaName());
      assertTrue(prompt.expectsList());
      assertEquals("$history", prompt.inherit);
      assertEquals("Review the code.\n  Be concise.", prompt.body, "三引号正文应去除公共缩进与首尾空白");
      assertEquals(new EscalationCondition("~", "NEEDS HUMAN"), prompt.escalationCondition);
    }

    @Test
    public void testPromptDeclarationWithoutBody() {
      PromptDef prompt = only("prompt p expecting R\n", PromptDef.class);
      assertFalse(prompt.hasBody());
      assertEquals("", prompt.body);
    }

    @Test
    public void testAgentProperties() {
      AgentDef agent = only("""
          agent reviewer:
              tools fs, github
              instruction review
              prompt ask
              produces verdict
              retry standard
              timeout 2 minutes
              description "Reviews code"
              delegate helper
          """, AgentDef.class);
      assertEquals(List.of("fs", "github"), agent.tools);
      assertEquals("review", agent.instruction);
      assertEquals("ask", agent.prompt);
      assertEquals("verdict", agent.produces);
      assertEquals("standard", agent.retry);
      assertEquals(Integer.valueOf(2), agent.timeoutValue);
      assertEquals("minutes", agent.timeoutUnit);
      assertEquals("Reviews code", agent.description);
      assertEquals(List.of("helper"), agent.delegate);
      assertEquals(2, agent.positionOf("tools").line);
      assertEquals(3, agent.positionOf("instruction").line);
      assertEquals(7, agent.positionOf("timeout").line);
      assertEquals(9, agent.positionOf("delegate").line);
      assertSame(agent.position, agent.positionOf("use"), "未声明的属性退回 agent 位置");
    }

    @Test
    public void testUnnamedAgentDefaultsToDefault() {
      AgentDef agent = only("agent:\n    instruction p\n", AgentDef.class);
      assertNull(agent.name);
      assertEquals(AgentDef.DEFAULT_NAME, agent.effectiveName());
    }

    @Test
    public void testPolicies() {
      DslFile file = build("""
          retry standard = 3 times, exponential backoff
          timeout quick = 30 seconds
          """);
      RetryPolicyDef retry = (RetryPolicyDef) file.definitions.get(0);
      assertEquals(3, retry.times);
      assertEquals("exponential", retry.backoff);
      TimeoutPolicyDef timeout = (TimeoutPolicyDef) file.definitions.get(1);
      assertEquals(30, timeout.value);
      assertEquals("seconds", timeout.unit);
    }

    @Test
    public void testCountOutOfRangeIsSyntaxError() {
      SyntaxError e = assertThrows(SyntaxError.class, () -> build("retry r = 99999999999 times\n"));
      assertEquals(ErrorCode.E0017, e.getCode());
      assertEquals("numeric literal '99999999999' is out of range", e.getMessage());
      assertEquals(1, e.getLine());
      assertEquals(11, e.getColumn());
      assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    public void testLoopMaxOutOfRange() {
      SyntaxError e = assertThrows(SyntaxError.class,
          () -> build("flow main:\n    loop max 4294967296 do\n        log \"x\"\n    end\n"));
      assertEquals(ErrorCode.E0017, e.getCode());
      assertEquals(2, e.getLine());
    }

    @Test
    public void testFlowNameAndParams() {
      FlowDef flow = only("""
          flow get agent goal $task $limit:
              return $task
          """, FlowDef.class);
      assertEquals("get agent goal", flow.name);
      assertEquals(List.of("$task", "$limit"), flow.params);
    }

    @Test
    public void testEventHandlerUnitName() {
      EventHandler handler = only("""
          after tool-call do
              log "called"
          end
          """, EventHandler.class);
      assertEquals(Timing.AFTER, handler.timing);
      assertEquals(EventType.TOOL_CALL, handler.eventType);
      assertEquals("after_tool_call", handler.unitName());
    }

    @Test
    public void testGuardrailActions() {
      EventHandler handler = only("""
          on output do
              mask pii
              block if $output contains "secret"
              warn "be careful"
              retry with "try again" if len($output) > 100
          end
          """, EventHandler.class);
      assertInstanceOf(MaskAction.class, handler.body.get(0));
      assertEquals("pii", ((MaskAction) handler.body.get(0)).guardrail);
      assertInstanceOf(BlockAction.class, handler.body.get(1));
      WarnAction warn = (WarnAction) handler.body.get(2);
      assertNull(warn.condition);
      assertEquals("be careful", warn.message);
      assertInstanceOf(RetryAction.class, handler.body.get(3));
    }
  }

  @Nested
  class Statements {

    @Test
    public void testRunAgentWithEscalationHandler() {
      List<Stmt> body = flowBody("$r = run agent checker with $a, $b, on escalate return \"stop\"\n");
      RunStmt run = (RunStmt) body.get(0);
      assertEquals("$r", run.target);
      assertEquals("checker", run.name);
      assertFalse(run.isFlow);
      assertEquals(2, run.args.size());
      assertEquals(EscalationAction.RETURN, run.escalationHandler.action);
      assertEquals("stop", ((Literal) run.escalationHandler.value).value);
    }

    @Test
    public void testRunMultiWordFlow() {
      List<Stmt> body = flowBody("$goal = run get agent goal with $x\n");
      RunStmt run = (RunStmt) body.get(0);
      assertTrue(run.isFlow);
      assertEquals("get agent goal", run.name);
    }

    @Test
    public void testCallLlmWithModelOverride() {
      List<Stmt> body = flowBody("$s = call llm summarize with $text using model \"fast\"\n");
      CallStmt call = (CallStmt) body.get(0);
      assertEquals("summarize", call.prompt);
      assertEquals("fast", call.model);
      assertEquals(1, call.args.size());
    }

    @Test
    public void testBareVariableNamesAccepted() {
      List<Stmt> body = flowBody("""
          x = 1
          for item in items do
              push item to out
          end
          """);
      Assignment assign = (Assignment) body.get(0);
      assertEquals("x", assign.target);
      ForLoop loop = (ForLoop) body.get(1);
      assertEquals("item", loop.variable);
      assertEquals("items", ((VarRef) loop.iterable).name);
    }

    @Test
    public void testPropertyAssignment() {
      PropertyAssignment s = (PropertyAssignment) flowBody("$obj.a.b = 2\n").get(0);
      assertEquals("$obj", s.target);
      assertEquals(List.of("a", "b"), s.path);
    }

    @Test
    public void testMatchBlock() {
      MatchBlock match = (MatchBlock) flowBody("""
          match $kind
              when "bug" -> $label = "fix"
              when "feature" -> $label = "build"
              else -> $label = "triage"
          end
          """).get(0);
      assertEquals(2, match.cases.size());
      assertEquals("bug", match.cases.get(0).pattern);
      assertInstanceOf(Assignment.class, match.elseBody);
    }

    @Test
    public void testLoopParallelAndFailure() {
      List<Stmt> body = flowBody("""
          loop max 3 do
              continue
          end
          parallel do
              $a = run agent x
              $b = run agent y
          end
          on failure:
              notify "failed"
          """);
      LoopBlock loop = (LoopBlock) body.get(0);
      assertEquals(Integer.valueOf(3), loop.maxIterations);
      assertInstanceOf(ContinueStmt.class, loop.body.get(0));
      assertEquals(2, ((ParallelBlock) body.get(1)).body.size());
      assertInstanceOf(NotifyStmt.class, ((FailureBlock) body.get(2)).body.get(0));
    }

    @Test
    public void testStatementPositions() {
      List<Stmt> body = flowBody("""
          $x = 1
          if $x > 0:
              log "positive"
          """);
      assertEquals(new SourcePosition(2, 5), body.get(0).position());
      assertEquals(new SourcePosition(3, 5), body.get(1).position());
      IfBlock ifBlock = (IfBlock) body.get(1);
      assertEquals(4, ifBlock.body.get(0).position().line);
    }
  }

  @Nested
  class Expressions {

    private Expr valueOf(String expression) {
      return ((Assignment) flowBody("$v = " + expression + "\n").get(0)).value;
    }

    @Test
    public void testInitialUserPrompt() {
      VarRef ref = (VarRef) valueOf("initial user prompt");
      assertEquals("input_prompt", ref.name);
    }

    @Test
    public void testPrecedence() {
      BinaryOp or = (BinaryOp) valueOf("$a and $b or not $c");
      assertEquals("or", or.op);
      assertEquals("and", ((BinaryOp) or.left).op);
      assertEquals("not", ((UnaryOp) or.right).op);

      BinaryOp sum = (BinaryOp) valueOf("1 + 2 * 3");
      assertEquals("+", sum.op);
      assertEquals("*", ((BinaryOp) sum.right).op);
    }

    @Test
    public void testPropertyAccessAndFunctionCall() {
      PropertyAccess access = (PropertyAccess) valueOf("$user.profile.name");
      assertEquals("$user", ((VarRef) access.base).name);
      assertEquals(List.of("profile", "name"), access.properties);

      FunctionCall call = (FunctionCall) valueOf("lib.upper($x)");
      assertEquals("lib.upper", call.name);
      assertEquals(1, call.args.size());
    }

    @Test
    public void testFilterWithImplicitProperty() {
      FilterExpr filter = (FilterExpr) valueOf("filter $items where .score >= 5");
      assertEquals("$items", ((VarRef) filter.source).name);
      BinaryOp cond = (BinaryOp) filter.condition;
      assertEquals(List.of("score"), ((ImplicitProperty) cond.left).properties);
    }

    @Test
    public void testLiterals() {
      assertEquals(42, ((Literal) valueOf("42")).value);
      assertEquals(Long.valueOf(3000000000L), ((Literal) valueOf("3000000000")).value);
      SyntaxError e = assertThrows(SyntaxError.class, () -> valueOf("99999999999999999999"));
      assertEquals(ErrorCode.E0017, e.getCode());
      assertEquals(1.5, ((Literal) valueOf("1.5")).value);
      assertEquals(Boolean.TRUE, ((Literal) valueOf("true")).value);
      assertNull(((Literal) valueOf("null")).value);
      assertEquals("a\nb", ((Literal) valueOf("\"a\\nb\"")).value);
      ListLiteral list = (ListLiteral) valueOf("[1, 2, 3]");
      assertEquals(3, list.elements.size());
      ObjectLiteral obj = (ObjectLiteral) valueOf("{name: \"x\", \"count\": 2}");
      assertEquals(List.of("name", "count"), List.copyOf(obj.entries.keySet()));
    }
  }
}
