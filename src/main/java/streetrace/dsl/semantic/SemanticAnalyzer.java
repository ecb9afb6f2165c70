package streetrace.dsl.semantic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import streetrace.dsl.ast.DslAst;
import streetrace.dsl.ast.DslAst.*;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.errors.ErrorCode;
import streetrace.dsl.semantic.ScopeArena.ScopeType;
import streetrace.dsl.semantic.ScopeArena.Symbol;

/**
 * 两遍语义分析
 * <p>
 * 第一遍收集顶层定义并合并同名 prompt；第二遍在嵌套作用域中检查
 * 变量与交叉引用。所有错误累积后一次返回，不在第一个错误处中止。
 * <p>
 * 分析器本身无状态，每次 {@link #analyze} 新建符号表与作用域竞技场，
 * 可在多个线程中共享同一实例。
 */
public final class SemanticAnalyzer {
  private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

  private static final Set<String> PRIMITIVE_TYPES = Set.of("string", "int", "float", "bool");
  private static final Pattern INTERPOLATION = Pattern.compile("\\$\\{\\s*([A-Za-z_][A-Za-z0-9_]*)");

  static final String INSTRUCTION_HELP = "add 'instruction <prompt_name>' to specify the agent's instruction prompt";

  private final SuggestionStrategy suggestions;

  public SemanticAnalyzer() {
    this(PrefixSuggestionStrategy.INSTANCE);
  }

  public SemanticAnalyzer(SuggestionStrategy suggestions) {
    this.suggestions = suggestions;
  }

  /**
   * 分析一个 DSL 文件
   *
   * @param file AST 根节点
   * @return 分析结果，包含全部错误、警告与符号表
   */
  public AnalysisResult analyze(DslFile file) {
    Analysis analysis = new Analysis();
    analysis.collect(file);
    analysis.validate(file);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "semantic analysis finished: {0} errors, {1} warnings, {2}",
          new Object[] {analysis.errors.size(), analysis.warnings.size(), analysis.symbols});
    }
    return new AnalysisResult(analysis.errors, analysis.warnings, analysis.symbols);
  }

  /** 单次分析的全部可变状态 */
  private final class Analysis {
    final SymbolTable symbols = new SymbolTable();
    final ScopeArena scopes = new ScopeArena();
    final List<SemanticError> errors = new ArrayList<>();
    final List<SemanticError> warnings = new ArrayList<>();
    final Set<String> reportedInterpolations = new HashSet<>();

    // ============================================================
    // 第一遍：收集
    // ============================================================

    void collect(DslFile file) {
      PromptMerger merger = new PromptMerger(errors);
      Collector collector = new Collector(merger);
      for (Definition def : file.definitions) {
        def.accept(collector);
      }
      for (Map.Entry<String, PromptDef> e : merger.finish().entrySet()) {
        symbols.replacePrompt(e.getKey(), e.getValue());
      }
    }

    private final class Collector implements DefinitionVisitor<Void> {
      private final PromptMerger merger;

      Collector(PromptMerger merger) {
        this.merger = merger;
      }

      private void register(SymbolKind kind, String name, Definition def) {
        Definition existing = symbols.putIfAbsent(kind, name, def);
        if (existing != null) {
          String help = existing.position() != null
              ? "first defined at line " + existing.position().line
              : null;
          errors.add(new SemanticError(ErrorCode.E0003,
              ErrorCode.E0003.format(Map.of("kind", kind.label(), "name", name)),
              def.position(), help));
        }
      }

      @Override public Void visitImport(ImportDef def) { return null; }
      @Override public Void visitModel(ModelDef def) { register(SymbolKind.MODEL, def.name, def); return null; }
      @Override public Void visitSchema(SchemaDef def) { register(SymbolKind.SCHEMA, def.name, def); return null; }
      @Override public Void visitTool(ToolDef def) { register(SymbolKind.TOOL, def.name, def); return null; }
      @Override public Void visitPrompt(PromptDef def) { merger.add(def); return null; }
      @Override public Void visitAgent(AgentDef def) { register(SymbolKind.AGENT, def.effectiveName(), def); return null; }
      @Override public Void visitFlow(FlowDef def) { register(SymbolKind.FLOW, def.name, def); return null; }
      @Override public Void visitEventHandler(EventHandler def) { return null; }
      @Override public Void visitRetryPolicy(RetryPolicyDef def) { register(SymbolKind.RETRY_POLICY, def.name, def); return null; }
      @Override public Void visitTimeoutPolicy(TimeoutPolicyDef def) { register(SymbolKind.TIMEOUT_POLICY, def.name, def); return null; }
    }

    // ============================================================
    // 第二遍：校验
    // ============================================================

    void validate(DslFile file) {
      for (PromptDef prompt : symbols.prompts().values()) {
        validatePrompt(prompt);
      }
      for (SchemaDef schema : symbols.schemas().values()) {
        validateSchema(schema);
      }
      for (ToolDef tool : symbols.tools().values()) {
        validateTool(tool);
      }
      AgentReferenceGraph graph = new AgentReferenceGraph();
      for (AgentDef agent : symbols.agents().values()) {
        validateAgent(agent);
        List<String> refs = new ArrayList<>(agent.delegate);
        refs.addAll(agent.use);
        graph.addAgent(agent.effectiveName(), refs);
      }
      for (List<String> cycle : graph.findCycles()) {
        AgentDef first = symbols.agents().get(cycle.get(0));
        errors.add(new SemanticError(ErrorCode.E0011,
            ErrorCode.E0011.format(Map.of("cycle", String.join(" -> ", cycle))),
            first.position,
            "remove one of the delegate/use references to break the cycle"));
      }

      // on start 处理器写入全局作用域，先于 flow 校验以便其变量在各处可见
      for (Definition def : file.definitions) {
        if (def instanceof EventHandler h && isGlobalHandler(h)) {
          validateHandler(h);
        }
      }
      for (Definition def : file.definitions) {
        if (def instanceof EventHandler h && !isGlobalHandler(h)) {
          validateHandler(h);
        } else if (def instanceof FlowDef f && symbols.flows().get(f.name) == f) {
          validateFlow(f);
        }
      }
    }

    private boolean isGlobalHandler(EventHandler h) {
      return h.timing == Timing.ON && h.eventType == EventType.START;
    }

    private void validatePrompt(PromptDef prompt) {
      if (prompt.model != null) {
        requireDefined(SymbolKind.MODEL, prompt.model, prompt.position);
      }
      if (prompt.expecting != null) {
        requireDefined(SymbolKind.SCHEMA, prompt.schemaName(), prompt.position);
      }
    }

    private void validateSchema(SchemaDef schema) {
      for (SchemaField field : schema.fields) {
        String base = field.type.baseType;
        if (!PRIMITIVE_TYPES.contains(base) && !symbols.contains(SymbolKind.SCHEMA, base)) {
          requireDefined(SymbolKind.SCHEMA, base,
              field.position != null ? field.position : schema.position);
        }
      }
    }

    private void validateTool(ToolDef tool) {
      if (tool.kind == null) {
        errors.add(new SemanticError(ErrorCode.E0010,
            ErrorCode.E0010.format(Map.of("field", "type", "kind", "tool '" + tool.name + "'")),
            tool.position,
            "add 'type: mcp' or 'type: builtin' to the tool definition"));
      }
    }

    private void validateAgent(AgentDef agent) {
      String name = agent.effectiveName();
      if (agent.instruction == null) {
        errors.add(new SemanticError(ErrorCode.E0010,
            ErrorCode.E0010.format(Map.of("field", "instruction", "kind", "agent '" + name + "'")),
            agent.position, INSTRUCTION_HELP));
      } else if (requireDefined(SymbolKind.PROMPT, agent.instruction, agent.positionOf("instruction"))) {
        checkInstructionVariables(symbols.prompts().get(agent.instruction), agent.positionOf("instruction"));
      }
      for (String tool : agent.tools) {
        requireDefined(SymbolKind.TOOL, tool, agent.positionOf("tools"));
      }
      if (agent.prompt != null) {
        requireDefined(SymbolKind.PROMPT, agent.prompt, agent.positionOf("prompt"));
      }
      if (agent.retry != null) {
        requireDefined(SymbolKind.RETRY_POLICY, agent.retry, agent.positionOf("retry"));
      }
      if (agent.timeoutRef != null) {
        requireDefined(SymbolKind.TIMEOUT_POLICY, agent.timeoutRef, agent.positionOf("timeout"));
      }
      for (String ref : agent.delegate) {
        requireDefined(SymbolKind.AGENT, ref, agent.positionOf("delegate"));
      }
      for (String ref : agent.use) {
        requireDefined(SymbolKind.AGENT, ref, agent.positionOf("use"));
      }
      if (!agent.delegate.isEmpty() && !agent.use.isEmpty()) {
        warnings.add(new SemanticError(ErrorCode.W0002,
            ErrorCode.W0002.format(Map.of("name", name)),
            agent.position,
            "use 'delegate' for hand-off and 'use' for tool-style calls, usually not both"));
      }
    }

    /** instruction 只能插值其他 prompt（组合）与内建全局名 */
    private void checkInstructionVariables(PromptDef prompt, SourcePosition agentPosition) {
      Matcher m = INTERPOLATION.matcher(prompt.body);
      while (m.find()) {
        String ref = m.group(1);
        if (symbols.contains(SymbolKind.PROMPT, ref) || ScopeArena.BUILTIN_NAMES.contains(ref)) {
          continue;
        }
        if (reportedInterpolations.add(prompt.name + "\u0000" + ref)) {
          errors.add(new SemanticError(ErrorCode.E0016,
              ErrorCode.E0016.format(Map.of("prompt", prompt.name, "name", ref)),
              prompt.position != null ? prompt.position : agentPosition,
              "pass '" + ref + "' as the agent input instead of interpolating it into the instruction"));
        }
      }
    }

    private void validateFlow(FlowDef flow) {
      int scope = scopes.open(ScopeType.FLOW, ScopeArena.GLOBAL);
      for (String param : flow.params) {
        scopes.define(scope, DslAst.bare(param), Symbol.Kind.PARAMETER, flow);
      }
      new StmtChecker(scope, 0, false).checkAll(flow.body);
    }

    private void validateHandler(EventHandler handler) {
      int scope = isGlobalHandler(handler)
          ? ScopeArena.GLOBAL
          : scopes.open(ScopeType.HANDLER, ScopeArena.GLOBAL);
      new StmtChecker(scope, 0, true).checkAll(handler.body);
    }

    /**
     * @return 引用是否成功解析
     */
    private boolean requireDefined(SymbolKind kind, String name, SourcePosition position) {
      if (symbols.contains(kind, name)) {
        return true;
      }
      String suggestion = suggestions.suggest(kind, name, symbols.names(kind)).orElse(null);
      errors.add(new SemanticError(ErrorCode.E0001,
          ErrorCode.E0001.format(Map.of("kind", kind.label(), "name", name)),
          position, suggestion));
      return false;
    }

    // ============================================================
    // 语句与表达式
    // ============================================================

    /**
     * 单个作用域内的语句检查器；进入嵌套块时派生新实例。
     */
    private final class StmtChecker implements StmtVisitor<Void>, ExprVisitor<Void> {
      private final int scope;
      private final int loopDepth;
      private final boolean inHandler;

      StmtChecker(int scope, int loopDepth, boolean inHandler) {
        this.scope = scope;
        this.loopDepth = loopDepth;
        this.inHandler = inHandler;
      }

      void checkAll(List<Stmt> body) {
        for (Stmt s : body) {
          s.accept(this);
        }
      }

      private StmtChecker block(int depthIncrement) {
        return new StmtChecker(scopes.open(ScopeType.BLOCK, scope), loopDepth + depthIncrement, inHandler);
      }

      private void defineVariable(String name, Object node) {
        scopes.define(scope, DslAst.bare(name), Symbol.Kind.VARIABLE, node);
      }

      private void requireVariable(String name, SourcePosition position) {
        String bare = DslAst.bare(name);
        if (scopes.lookup(scope, bare).isEmpty()) {
          errors.add(new SemanticError(ErrorCode.E0002,
              ErrorCode.E0002.format(Map.of("name", bare)),
              position,
              "assign '$" + bare + "' before using it"));
        }
      }

      private void check(Expr e) {
        if (e != null) {
          e.accept(this);
        }
      }

      private void checkArgs(List<Expr> args) {
        for (Expr a : args) {
          check(a);
        }
      }

      private void requireLoop(String statement, SourcePosition position) {
        if (loopDepth == 0) {
          errors.add(new SemanticError(ErrorCode.E0012,
              ErrorCode.E0012.format(Map.of("statement", statement)),
              position,
              "move it inside a 'for' or 'loop' body"));
        }
      }

      private void requireHandler(String action, SourcePosition position) {
        if (!inHandler) {
          errors.add(new SemanticError(ErrorCode.E0009,
              ErrorCode.E0009.format(Map.of("action", action, "context", "flow")),
              position,
              "guardrail actions are only allowed inside 'on'/'after' event handlers"));
        }
      }

      // ---- 语句 ----

      @Override
      public Void visitAssignment(Assignment s) {
        check(s.value);
        defineVariable(s.target, s);
        return null;
      }

      @Override
      public Void visitPropertyAssignment(PropertyAssignment s) {
        check(s.value);
        requireVariable(s.target, s.position);
        return null;
      }

      @Override
      public Void visitRun(RunStmt s) {
        checkArgs(s.args);
        AgentDef agent = null;
        if (s.isFlow) {
          requireDefined(SymbolKind.FLOW, s.name, s.position);
        } else if (requireDefined(SymbolKind.AGENT, s.name, s.position)) {
          agent = symbols.agents().get(s.name);
        }
        if (s.escalationHandler != null) {
          switch (s.escalationHandler.action) {
            case RETURN -> check(s.escalationHandler.value);
            case CONTINUE -> requireLoop("on escalate continue", s.position);
            case ABORT -> { }
          }
        }
        if (s.target != null) {
          defineVariable(s.target, s);
        } else if (agent != null && agent.produces != null) {
          defineVariable(agent.produces, s);
        }
        return null;
      }

      @Override
      public Void visitCall(CallStmt s) {
        checkArgs(s.args);
        requireDefined(SymbolKind.PROMPT, s.prompt, s.position);
        if (s.model != null) {
          requireDefined(SymbolKind.MODEL, s.model, s.position);
        }
        if (s.target != null) {
          defineVariable(s.target, s);
        }
        return null;
      }

      @Override
      public Void visitReturn(ReturnStmt s) {
        check(s.value);
        return null;
      }

      @Override
      public Void visitPush(PushStmt s) {
        check(s.value);
        requireVariable(s.target, s.position);
        return null;
      }

      @Override
      public Void visitFor(ForLoop s) {
        check(s.iterable);
        StmtChecker body = block(1);
        scopes.define(body.scope, DslAst.bare(s.variable), Symbol.Kind.VARIABLE, s);
        body.checkAll(s.body);
        return null;
      }

      @Override
      public Void visitIf(IfBlock s) {
        check(s.condition);
        block(0).checkAll(s.body);
        return null;
      }

      @Override
      public Void visitMatch(MatchBlock s) {
        check(s.subject);
        for (MatchCase c : s.cases) {
          c.body.accept(block(0));
        }
        if (s.elseBody != null) {
          s.elseBody.accept(block(0));
        }
        return null;
      }

      @Override
      public Void visitParallel(ParallelBlock s) {
        checkAll(s.body);
        return null;
      }

      @Override
      public Void visitFailure(FailureBlock s) {
        checkAll(s.body);
        return null;
      }

      @Override
      public Void visitLoop(LoopBlock s) {
        new StmtChecker(scope, loopDepth + 1, inHandler).checkAll(s.body);
        return null;
      }

      @Override
      public Void visitLog(LogStmt s) {
        check(s.message);
        return null;
      }

      @Override
      public Void visitNotify(NotifyStmt s) {
        check(s.message);
        return null;
      }

      @Override
      public Void visitEscalate(EscalateStmt s) {
        return null;
      }

      @Override
      public Void visitContinue(ContinueStmt s) {
        requireLoop("continue", s.position);
        return null;
      }

      @Override
      public Void visitAbort(AbortStmt s) {
        return null;
      }

      @Override
      public Void visitRetryStep(RetryStepStmt s) {
        check(s.message);
        return null;
      }

      @Override
      public Void visitMask(MaskAction s) {
        requireHandler("mask", s.position);
        return null;
      }

      @Override
      public Void visitBlock(BlockAction s) {
        requireHandler("block", s.position);
        check(s.condition);
        return null;
      }

      @Override
      public Void visitWarn(WarnAction s) {
        requireHandler("warn", s.position);
        check(s.condition);
        return null;
      }

      @Override
      public Void visitRetryAction(RetryAction s) {
        requireHandler("retry", s.position);
        check(s.message);
        check(s.condition);
        return null;
      }

      // ---- 表达式 ----

      @Override
      public Void visitVarRef(VarRef e) {
        requireVariable(e.name, e.position);
        return null;
      }

      @Override
      public Void visitPropertyAccess(PropertyAccess e) {
        check(e.base);
        return null;
      }

      @Override
      public Void visitBinary(BinaryOp e) {
        check(e.left);
        check(e.right);
        return null;
      }

      @Override
      public Void visitUnary(UnaryOp e) {
        check(e.operand);
        return null;
      }

      @Override
      public Void visitFunctionCall(FunctionCall e) {
        checkArgs(e.args);
        return null;
      }

      @Override
      public Void visitList(ListLiteral e) {
        checkArgs(e.elements);
        return null;
      }

      @Override
      public Void visitObject(ObjectLiteral e) {
        for (Expr v : e.entries.values()) {
          check(v);
        }
        return null;
      }

      @Override
      public Void visitLiteral(Literal e) {
        return null;
      }

      @Override
      public Void visitFilter(FilterExpr e) {
        check(e.source);
        check(e.condition);
        return null;
      }

      // 相对 filter 当前元素取值，不在作用域中查找
      @Override
      public Void visitImplicitProperty(ImplicitProperty e) {
        return null;
      }
    }
  }
}
