package streetrace.dsl.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import streetrace.dsl.ast.DslAst;
import streetrace.dsl.ast.DslAst.*;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.codegen.FlowModel.*;
import streetrace.dsl.semantic.MergedPrompts;
import streetrace.dsl.sourcemap.SourceMapRegistry;
import streetrace.dsl.sourcemap.SourceMapping;

/**
 * 代码生成（降级）：已通过语义分析的 AST → {@link WorkflowProgram} + 源码映射
 * <p>
 * 每个 flow 与事件处理器降级为一个线性指令单元，控制结构以跳转表示：
 * <pre>
 *   if      : JumpIfFalse(cond, end) body end:
 *   for     : IterInit  head: IterNext(exit) body Jump(head)  exit:
 *   loop    : CounterInit  head: CounterCheck(max, exit) body Jump(head)  exit:
 *   match   : MatchJump  case1 Jump(end)  case2 Jump(end) ... else  end:
 *   failure : [前置语句] Jump(after)  handler: [失败处理]  after: [后续语句]
 *   return  : Assign(_return_value) Halt
 * </pre>
 * 前置语句登记为保护区，区内失败转入处理器。每条带位置的语句在其第一条指令处
 * 登记一条源码映射。
 * <p>
 * prompt 注册表只取自 {@link MergedPrompts}：未合并的 AST prompt 会丢失
 * 声明与正文分开书写时的修饰符。
 */
public final class CodeGenerator {
  private static final Logger LOGGER = Logger.getLogger(CodeGenerator.class.getName());

  /**
   * 生成可执行表示
   *
   * @param ast 已通过语义分析的 AST
   * @param sourceName 源码标识，仅用于诊断与源码映射
   * @param prompts 符号表中合并后的 prompt
   * @return 程序与源码映射
   * @throws LoweringError 遇到结构性错误（例如 parallel 中出现非 run 语句）
   */
  public GenerationResult generate(DslFile ast, String sourceName, MergedPrompts prompts) {
    Objects.requireNonNull(ast, "ast");
    Objects.requireNonNull(prompts, "prompts");
    WorkflowProgram program = new WorkflowProgram();
    program.sourceName = sourceName;
    program.version = ast.version != null ? ast.version.version : null;
    SourceMapRegistry sourceMap = new SourceMapRegistry();

    Map<String, AgentDef> agents = new LinkedHashMap<>();
    Map<String, List<Stmt>> handlerBodies = new LinkedHashMap<>();
    List<FlowDef> flows = new ArrayList<>();

    for (Definition def : ast.definitions) {
      if (def instanceof ImportDef d) {
        program.imports.add(importSpec(d));
      } else if (def instanceof ModelDef d) {
        program.models.putIfAbsent(d.name, modelSpec(d));
      } else if (def instanceof SchemaDef d) {
        if (!program.schemas.contains(d.name)) {
          program.schemas.register(structuredType(d));
        }
      } else if (def instanceof ToolDef d) {
        program.tools.putIfAbsent(d.name, toolSpec(d));
      } else if (def instanceof AgentDef d) {
        if (agents.putIfAbsent(d.effectiveName(), d) == null) {
          program.agents.put(d.effectiveName(), agentSpec(d));
        }
      } else if (def instanceof RetryPolicyDef d) {
        program.retryPolicies.putIfAbsent(d.name, retrySpec(d));
      } else if (def instanceof TimeoutPolicyDef d) {
        program.timeoutPolicies.putIfAbsent(d.name, timeoutSpec(d.name, d.value, d.unit));
      } else if (def instanceof FlowDef d) {
        flows.add(d);
      } else if (def instanceof EventHandler d) {
        // 同一时机与事件的多个处理器按出现顺序拼接
        handlerBodies.computeIfAbsent(d.unitName(), k -> new ArrayList<>()).addAll(d.body);
      }
    }
    for (PromptDef p : prompts.asMap().values()) {
      program.prompts.put(p.name, promptSpec(p));
    }

    for (FlowDef flow : flows) {
      if (program.flows.containsKey(flow.name)) {
        continue;
      }
      UnitLowering lowering = new UnitLowering(flow.name, sourceName, sourceMap, agents);
      FlowUnit unit = lowering.lower(flow.body);
      for (String p : flow.params) {
        unit.params.add(DslAst.bare(p));
      }
      program.flows.put(flow.name, unit);
    }
    for (Map.Entry<String, List<Stmt>> e : handlerBodies.entrySet()) {
      UnitLowering lowering = new UnitLowering(e.getKey(), sourceName, sourceMap, agents);
      program.handlers.put(e.getKey(), lowering.lower(e.getValue()));
    }

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "lowered {0}: {1} flows, {2} handlers, {3} source mappings",
          new Object[] {sourceName, program.flows.size(), program.handlers.size(), sourceMap.size()});
    }
    return new GenerationResult(program, sourceMap);
  }

  // ============================================================
  // 注册表
  // ============================================================

  private static ImportSpec importSpec(ImportDef d) {
    ImportSpec s = new ImportSpec();
    s.name = d.name;
    s.source = d.source;
    s.type = d.kind.name().toLowerCase();
    return s;
  }

  private static ModelSpec modelSpec(ModelDef d) {
    ModelSpec s = new ModelSpec();
    s.name = d.name;
    s.providerModel = d.providerModel;
    s.properties.putAll(d.properties);
    return s;
  }

  private static SchemaRegistry.StructuredType structuredType(SchemaDef d) {
    SchemaRegistry.StructuredType t = new SchemaRegistry.StructuredType();
    t.name = d.name;
    for (SchemaField f : d.fields) {
      t.fields.add(new SchemaRegistry.FieldType(f.name, f.type.baseType, f.type.isList, f.type.isOptional));
    }
    return t;
  }

  private static ToolSpec toolSpec(ToolDef d) {
    ToolSpec s = new ToolSpec();
    s.name = d.name;
    s.type = d.kind != null ? d.kind.name().toLowerCase() : null;
    s.url = d.url;
    s.authType = d.authType;
    s.authValue = d.authValue;
    s.builtinRef = d.builtinRef;
    s.headers.putAll(d.headers);
    s.properties.putAll(d.properties);
    return s;
  }

  private static PromptSpec promptSpec(PromptDef p) {
    PromptSpec s = new PromptSpec();
    s.name = p.name;
    s.body = p.body;
    s.model = p.model;
    s.schema = p.schemaName();
    s.schemaIsList = p.expectsList();
    s.inherit = p.inherit != null ? DslAst.bare(p.inherit) : null;
    if (p.escalationCondition != null) {
      s.escalation = new EscalationSpec(p.escalationCondition.op, p.escalationCondition.value);
    }
    return s;
  }

  private static AgentSpec agentSpec(AgentDef d) {
    AgentSpec s = new AgentSpec();
    s.name = d.effectiveName();
    s.instruction = d.instruction;
    s.prompt = d.prompt;
    s.produces = d.produces != null ? DslAst.bare(d.produces) : null;
    s.tools.addAll(d.tools);
    s.retryPolicy = d.retry;
    s.timeoutPolicy = d.timeoutRef;
    if (d.timeoutValue != null) {
      s.timeoutSeconds = timeoutSpec(null, d.timeoutValue, d.timeoutUnit).seconds();
    }
    s.description = d.description;
    s.delegate.addAll(d.delegate);
    s.use.addAll(d.use);
    return s;
  }

  private static RetrySpec retrySpec(RetryPolicyDef d) {
    RetrySpec s = new RetrySpec();
    s.name = d.name;
    s.times = d.times;
    s.backoff = d.backoff;
    return s;
  }

  private static TimeoutSpec timeoutSpec(String name, int value, String unit) {
    TimeoutSpec s = new TimeoutSpec();
    s.name = name;
    s.value = value;
    s.unit = unit;
    return s;
  }

  // ============================================================
  // 单元降级
  // ============================================================

  /**
   * 一个 flow / 处理器单元的降级状态
   */
  private static final class UnitLowering implements StmtVisitor<Void> {
    private final String sourceName;
    private final String unitKey;
    private final SourceMapRegistry sourceMap;
    private final Map<String, AgentDef> agents;
    private final FlowUnit unit = new FlowUnit();
    private final ExprLowering exprs = new ExprLowering();
    // 当前所在循环的 continue 目标（循环头下标）
    private final Deque<Integer> loopHeads = new ArrayDeque<>();
    private int slotCounter;

    UnitLowering(String name, String sourceName, SourceMapRegistry sourceMap, Map<String, AgentDef> agents) {
      this.unit.name = name;
      this.sourceName = sourceName;
      this.unitKey = SourceMapRegistry.unitName(sourceName, name);
      this.sourceMap = sourceMap;
      this.agents = agents;
    }

    FlowUnit lower(List<Stmt> body) {
      lowerBody(body);
      emit(new Halt());
      return unit;
    }

    private int pc() {
      return unit.instructions.size();
    }

    private int emit(Instruction instruction) {
      unit.instructions.add(instruction);
      return unit.instructions.size() - 1;
    }

    private String newSlot(String prefix) {
      return "_" + prefix + "_" + (slotCounter++);
    }

    private void map(SourcePosition position) {
      if (position != null) {
        sourceMap.add(new SourceMapping(unitKey, pc(), position.line, position.column, sourceName));
      }
    }

    private void lowerBody(List<Stmt> body) {
      int failureAt = -1;
      for (int i = 0; i < body.size(); i++) {
        if (body.get(i) instanceof FailureBlock) {
          failureAt = i;
          break;
        }
      }
      if (failureAt < 0) {
        lowerAll(body);
        return;
      }
      FailureBlock failure = (FailureBlock) body.get(failureAt);
      int start = pc();
      lowerAll(body.subList(0, failureAt));
      int end = pc();
      map(failure.position);
      Jump skip = new Jump();
      emit(skip);
      int handler = pc();
      lowerAll(failure.body);
      skip.target = pc();
      unit.regions.add(new ProtectedRegion(start, end, handler));
      lowerBody(body.subList(failureAt + 1, body.size()));
    }

    private void lowerAll(List<Stmt> stmts) {
      for (Stmt s : stmts) {
        lowerStmt(s);
      }
    }

    private void lowerStmt(Stmt s) {
      map(s.position());
      s.accept(this);
    }

    private List<FlowModel.Expr> args(List<DslAst.Expr> args) {
      List<FlowModel.Expr> out = new ArrayList<>(args.size());
      for (DslAst.Expr a : args) {
        out.add(exprs.lower(a));
      }
      return out;
    }

    /** 显式目标优先，否则使用 agent 声明的 produces */
    private String runTarget(RunStmt s) {
      if (s.target != null) {
        return DslAst.bare(s.target);
      }
      if (!s.isFlow) {
        AgentDef agent = agents.get(s.name);
        if (agent != null && agent.produces != null) {
          return DslAst.bare(agent.produces);
        }
      }
      return null;
    }

    private FlowModel.Expr message(DslAst.Expr e) {
      if (e instanceof Literal lit && lit.value instanceof String text && InterpolationParser.hasInterpolation(text)) {
        return new Template(InterpolationParser.parse(text, lit.position));
      }
      return exprs.lower(e);
    }

    // ---- 语句 ----

    @Override
    public Void visitAssignment(Assignment s) {
      emit(new Assign(DslAst.bare(s.target), exprs.lower(s.value)));
      return null;
    }

    @Override
    public Void visitPropertyAssignment(PropertyAssignment s) {
      emit(new AssignProperty(DslAst.bare(s.target), new ArrayList<>(s.path), exprs.lower(s.value)));
      return null;
    }

    @Override
    public Void visitRun(RunStmt s) {
      String target = runTarget(s);
      if (s.isFlow) {
        emit(new RunFlow(s.name, args(s.args), target));
        return null;
      }
      String promptInput = null;
      AgentDef agent = agents.get(s.name);
      if (s.args.isEmpty() && agent != null && agent.prompt != null) {
        promptInput = agent.prompt;
      }
      emit(new RunAgent(s.name, args(s.args), target, promptInput));
      if (s.escalationHandler != null) {
        EscalationHandler h = s.escalationHandler;
        Integer continueTarget = null;
        if (h.action == EscalationAction.CONTINUE) {
          if (loopHeads.isEmpty()) {
            throw new LoweringError("'on escalate continue' used outside of a loop", s.position);
          }
          continueTarget = loopHeads.peek();
        }
        FlowModel.Expr value = h.value != null ? exprs.lower(h.value) : null;
        emit(new EscalationCheck(h.action.name(), value, continueTarget));
      }
      return null;
    }

    @Override
    public Void visitCall(CallStmt s) {
      String target = s.target != null ? DslAst.bare(s.target) : null;
      emit(new CallLlm(s.prompt, args(s.args), s.model, target));
      return null;
    }

    @Override
    public Void visitReturn(ReturnStmt s) {
      emit(new Assign(FlowModel.RETURN_SLOT, exprs.lower(s.value)));
      emit(new Halt());
      return null;
    }

    @Override
    public Void visitPush(PushStmt s) {
      emit(new Push(exprs.lower(s.value), DslAst.bare(s.target)));
      return null;
    }

    @Override
    public Void visitFor(ForLoop s) {
      String slot = newSlot("iter");
      emit(new IterInit(slot, exprs.lower(s.iterable)));
      IterNext next = new IterNext(slot, DslAst.bare(s.variable), -1);
      int head = emit(next);
      loopHeads.push(head);
      lowerBody(s.body);
      loopHeads.pop();
      emit(new Jump(head));
      next.exit = pc();
      return null;
    }

    @Override
    public Void visitIf(IfBlock s) {
      JumpIfFalse branch = new JumpIfFalse(exprs.lower(s.condition), -1);
      emit(branch);
      lowerBody(s.body);
      branch.target = pc();
      return null;
    }

    @Override
    public Void visitMatch(MatchBlock s) {
      MatchJump dispatch = new MatchJump(exprs.lower(s.subject));
      emit(dispatch);
      List<Jump> exits = new ArrayList<>();
      for (MatchCase c : s.cases) {
        // 重复的模式以首个为准
        dispatch.cases.putIfAbsent(c.pattern, pc());
        lowerStmt(c.body);
        Jump exit = new Jump();
        emit(exit);
        exits.add(exit);
      }
      dispatch.defaultTarget = pc();
      if (s.elseBody != null) {
        lowerStmt(s.elseBody);
      }
      int end = pc();
      for (Jump exit : exits) {
        exit.target = end;
      }
      return null;
    }

    @Override
    public Void visitParallel(ParallelBlock s) {
      List<ParallelBranch> branches = new ArrayList<>();
      for (Stmt child : s.body) {
        if (!(child instanceof RunStmt run)) {
          throw new LoweringError("parallel do only supports 'run agent' statements. Found: "
              + child.getClass().getSimpleName(), child.position());
        }
        if (run.escalationHandler != null) {
          throw new LoweringError("'on escalate' is not supported inside parallel do; "
              + "run '" + run.name + "' outside the block to handle its escalation", run.position);
        }
        branches.add(new ParallelBranch(run.name, run.isFlow, args(run.args), runTarget(run)));
      }
      // 并行分支不单独产生指令，全部映射到 Parallel 指令
      for (Stmt child : s.body) {
        map(child.position());
      }
      emit(new Parallel(branches));
      return null;
    }

    @Override
    public Void visitFailure(FailureBlock s) {
      // lowerBody 已在语句序列层面拆分，这里只会遇到不可达的嵌套用法
      throw new LoweringError("'on failure' must appear directly in a statement body", s.position);
    }

    @Override
    public Void visitLoop(LoopBlock s) {
      String slot = newSlot("loop");
      emit(new CounterInit(slot));
      CounterCheck check = new CounterCheck(slot, s.maxIterations != null ? s.maxIterations : -1, -1);
      int head = emit(check);
      loopHeads.push(head);
      lowerBody(s.body);
      loopHeads.pop();
      emit(new Jump(head));
      check.exit = pc();
      return null;
    }

    @Override
    public Void visitLog(LogStmt s) {
      emit(new Log(message(s.message)));
      return null;
    }

    @Override
    public Void visitNotify(NotifyStmt s) {
      emit(new Notify(message(s.message)));
      return null;
    }

    @Override
    public Void visitEscalate(EscalateStmt s) {
      emit(new Escalate(s.message));
      return null;
    }

    @Override
    public Void visitContinue(ContinueStmt s) {
      if (loopHeads.isEmpty()) {
        throw new LoweringError("'continue' used outside of a loop", s.position);
      }
      emit(new Jump(loopHeads.peek()));
      return null;
    }

    @Override
    public Void visitAbort(AbortStmt s) {
      emit(new Abort());
      return null;
    }

    @Override
    public Void visitRetryStep(RetryStepStmt s) {
      emit(new RetryStep(exprs.lower(s.message)));
      return null;
    }

    @Override
    public Void visitMask(MaskAction s) {
      emit(new Guardrail("mask", s.guardrail, null, null));
      return null;
    }

    @Override
    public Void visitBlock(BlockAction s) {
      emit(new Guardrail("block", null, exprs.lower(s.condition), null));
      return null;
    }

    @Override
    public Void visitWarn(WarnAction s) {
      FlowModel.Expr condition = s.condition != null ? exprs.lower(s.condition) : null;
      FlowModel.Expr message = s.message != null ? new Const(s.message) : null;
      emit(new Guardrail("warn", null, condition, message));
      return null;
    }

    @Override
    public Void visitRetryAction(RetryAction s) {
      emit(new Guardrail("retry", null, exprs.lower(s.condition), exprs.lower(s.message)));
      return null;
    }
  }

  /**
   * 表达式降级：变量名去掉 {@code $}，其余结构一一对应。
   */
  private static final class ExprLowering implements DslAst.ExprVisitor<FlowModel.Expr> {

    FlowModel.Expr lower(DslAst.Expr e) {
      return e.accept(this);
    }

    private List<FlowModel.Expr> lowerAll(List<DslAst.Expr> list) {
      List<FlowModel.Expr> out = new ArrayList<>(list.size());
      for (DslAst.Expr e : list) {
        out.add(lower(e));
      }
      return out;
    }

    @Override
    public FlowModel.Expr visitVarRef(VarRef e) {
      return new Var(DslAst.bare(e.name));
    }

    @Override
    public FlowModel.Expr visitPropertyAccess(PropertyAccess e) {
      return new Prop(lower(e.base), new ArrayList<>(e.properties));
    }

    @Override
    public FlowModel.Expr visitBinary(BinaryOp e) {
      return new Binary(e.op, lower(e.left), lower(e.right));
    }

    @Override
    public FlowModel.Expr visitUnary(UnaryOp e) {
      return new Unary(e.op, lower(e.operand));
    }

    @Override
    public FlowModel.Expr visitFunctionCall(FunctionCall e) {
      return new Call(e.name, lowerAll(e.args));
    }

    @Override
    public FlowModel.Expr visitList(ListLiteral e) {
      return new ListE(lowerAll(e.elements));
    }

    @Override
    public FlowModel.Expr visitObject(ObjectLiteral e) {
      Map<String, FlowModel.Expr> entries = new LinkedHashMap<>();
      for (Map.Entry<String, DslAst.Expr> entry : e.entries.entrySet()) {
        entries.put(entry.getKey(), lower(entry.getValue()));
      }
      return new ObjectE(entries);
    }

    @Override
    public FlowModel.Expr visitLiteral(Literal e) {
      return new Const(e.value);
    }

    @Override
    public FlowModel.Expr visitFilter(FilterExpr e) {
      return new Filter(lower(e.source), lower(e.condition));
    }

    @Override
    public FlowModel.Expr visitImplicitProperty(ImplicitProperty e) {
      return new Item(new ArrayList<>(e.properties));
    }
  }
}
