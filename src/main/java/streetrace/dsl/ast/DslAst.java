package streetrace.dsl.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DSL 抽象语法树
 * <p>
 * 三个封闭的节点族：顶层定义 {@link Definition}、语句 {@link Stmt}、表达式 {@link Expr}。
 * 每个节点族配有访问者接口，新增节点必须同时扩展 permits 列表与访问者方法，
 * 所有访问者实现因此在编译期被迫处理新节点。
 * <p>
 * 名称字段保留源码写法（变量可能带 {@code $} 前缀），去除前缀见 {@link #bare(String)}。
 */
public final class DslAst {
  private DslAst() {}

  /** 变量名去掉 {@code $} 前缀 */
  public static String bare(String name) {
    if (name == null) return null;
    return name.startsWith("$") ? name.substring(1) : name;
  }

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  public static final class DslFile {
    public final VersionDecl version;
    public final List<Definition> definitions;
    public final SourcePosition position;

    public DslFile(VersionDecl version, List<Definition> definitions, SourcePosition position) {
      this.version = version;
      this.definitions = copy(definitions);
      this.position = position;
    }

    public DslFile(VersionDecl version, List<Definition> definitions) {
      this(version, definitions, null);
    }
  }

  public static final class VersionDecl {
    public final String version;
    public final SourcePosition position;

    public VersionDecl(String version, SourcePosition position) {
      this.version = version;
      this.position = position;
    }
  }

  // ============================================================
  // 顶层定义
  // ============================================================

  public sealed interface Definition
      permits ImportDef, ModelDef, SchemaDef, ToolDef, PromptDef, AgentDef,
              FlowDef, EventHandler, RetryPolicyDef, TimeoutPolicyDef {
    SourcePosition position();
    <R> R accept(DefinitionVisitor<R> visitor);
  }

  public interface DefinitionVisitor<R> {
    R visitImport(ImportDef def);
    R visitModel(ModelDef def);
    R visitSchema(SchemaDef def);
    R visitTool(ToolDef def);
    R visitPrompt(PromptDef def);
    R visitAgent(AgentDef def);
    R visitFlow(FlowDef def);
    R visitEventHandler(EventHandler def);
    R visitRetryPolicy(RetryPolicyDef def);
    R visitTimeoutPolicy(TimeoutPolicyDef def);
  }

  public enum ImportKind { STREETRACE, LOCAL, PIP, MCP }

  public static final class ImportDef implements Definition {
    public final String name;
    public final String source;
    public final ImportKind kind;
    public final SourcePosition position;

    public ImportDef(String name, String source, ImportKind kind, SourcePosition position) {
      this.name = name;
      this.source = source;
      this.kind = kind;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitImport(this); }
  }

  /**
   * 模型定义：短形式 {@code provider/model-id}，或长形式属性表（provider、name、temperature...）。
   */
  public static final class ModelDef implements Definition {
    public final String name;
    public final String providerModel;
    public final Map<String, Object> properties;
    public final SourcePosition position;

    public ModelDef(String name, String providerModel, Map<String, Object> properties, SourcePosition position) {
      this.name = name;
      this.providerModel = providerModel;
      this.properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
      this.position = position;
    }

    public ModelDef(String name, String providerModel) {
      this(name, providerModel, null, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitModel(this); }
  }

  /** 字段类型：基础类型名，可选列表与可空修饰 */
  public static final class TypeExpr {
    public final String baseType;
    public final boolean isList;
    public final boolean isOptional;

    public TypeExpr(String baseType, boolean isList, boolean isOptional) {
      this.baseType = baseType;
      this.isList = isList;
      this.isOptional = isOptional;
    }

    public static TypeExpr of(String baseType) {
      return new TypeExpr(baseType, false, false);
    }

    @Override
    public String toString() {
      return baseType + (isList ? "[]" : "") + (isOptional ? "?" : "");
    }
  }

  public static final class SchemaField {
    public final String name;
    public final TypeExpr type;
    public final SourcePosition position;

    public SchemaField(String name, TypeExpr type, SourcePosition position) {
      this.name = name;
      this.type = type;
      this.position = position;
    }

    public SchemaField(String name, TypeExpr type) {
      this(name, type, null);
    }
  }

  public static final class SchemaDef implements Definition {
    public final String name;
    public final List<SchemaField> fields;
    public final SourcePosition position;

    public SchemaDef(String name, List<SchemaField> fields, SourcePosition position) {
      this.name = name;
      this.fields = copy(fields);
      this.position = position;
    }

    public SchemaDef(String name, List<SchemaField> fields) {
      this(name, fields, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitSchema(this); }
  }

  public enum ToolKind { MCP, BUILTIN }

  /**
   * 工具定义。长形式中 {@code type} 属性缺失时 {@link #kind} 为 null，由语义分析报告。
   */
  public static final class ToolDef implements Definition {
    public final String name;
    public final ToolKind kind;
    public final String url;
    public final String authType;
    public final String authValue;
    public final String builtinRef;
    public final Map<String, String> headers;
    public final Map<String, Object> properties;
    public final SourcePosition position;

    public ToolDef(String name, ToolKind kind, String url, String authType, String authValue,
                   String builtinRef, Map<String, String> headers, Map<String, Object> properties,
                   SourcePosition position) {
      this.name = name;
      this.kind = kind;
      this.url = url;
      this.authType = authType;
      this.authValue = authValue;
      this.builtinRef = builtinRef;
      this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
      this.properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
      this.position = position;
    }

    public static ToolDef builtin(String name, String ref) {
      return new ToolDef(name, ToolKind.BUILTIN, null, null, null, ref, null, null, null);
    }

    public static ToolDef mcp(String name, String url) {
      return new ToolDef(name, ToolKind.MCP, url, null, null, null, null, null, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitTool(this); }
  }

  /** prompt 的升级条件：{@code escalate if ~ "DRIFTING"} */
  public static final class EscalationCondition {
    public final String op;
    public final String value;

    public EscalationCondition(String op, String value) {
      this.op = op;
      this.value = value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof EscalationCondition that)) return false;
      return op.equals(that.op) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + value.hashCode();
    }

    @Override
    public String toString() {
      return op + " \"" + value + "\"";
    }
  }

  /**
   * prompt 定义。正文为空字符串表示“仅声明”，修饰符为 null 表示未提供。
   * {@code expecting} 保留源码写法，列表形式带 {@code []} 后缀。
   */
  public static final class PromptDef implements Definition {
    public final String name;
    public final String body;
    public final String model;
    public final String expecting;
    public final String inherit;
    public final EscalationCondition escalationCondition;
    public final SourcePosition position;

    public PromptDef(String name, String body, String model, String expecting, String inherit,
                     EscalationCondition escalationCondition, SourcePosition position) {
      this.name = name;
      this.body = body == null ? "" : body;
      this.model = model;
      this.expecting = expecting;
      this.inherit = inherit;
      this.escalationCondition = escalationCondition;
      this.position = position;
    }

    public PromptDef(String name, String body) {
      this(name, body, null, null, null, null, null);
    }

    public boolean hasBody() { return !body.isEmpty(); }

    /** expecting 去掉列表后缀后的 schema 名 */
    public String schemaName() {
      if (expecting == null) return null;
      return expecting.endsWith("[]") ? expecting.substring(0, expecting.length() - 2) : expecting;
    }

    public boolean expectsList() {
      return expecting != null && expecting.endsWith("[]");
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitPrompt(this); }
  }

  public static final class AgentDef implements Definition {
    public static final String DEFAULT_NAME = "default";

    public final String name;
    public final List<String> tools;
    public final String instruction;
    public final String prompt;
    public final String produces;
    public final String retry;
    public final String timeoutRef;
    public final Integer timeoutValue;
    public final String timeoutUnit;
    public final String description;
    public final List<String> delegate;
    public final List<String> use;
    public final SourcePosition position;
    /** 属性名（instruction、tools、retry 等）→ 属性所在行的位置 */
    public final Map<String, SourcePosition> propertyPositions;

    public AgentDef(String name, List<String> tools, String instruction, String prompt, String produces,
                    String retry, String timeoutRef, Integer timeoutValue, String timeoutUnit,
                    String description, List<String> delegate, List<String> use, SourcePosition position) {
      this(name, tools, instruction, prompt, produces, retry, timeoutRef, timeoutValue, timeoutUnit,
          description, delegate, use, position, Map.of());
    }

    public AgentDef(String name, List<String> tools, String instruction, String prompt, String produces,
                    String retry, String timeoutRef, Integer timeoutValue, String timeoutUnit,
                    String description, List<String> delegate, List<String> use, SourcePosition position,
                    Map<String, SourcePosition> propertyPositions) {
      this.name = name;
      this.tools = copy(tools);
      this.instruction = instruction;
      this.prompt = prompt;
      this.produces = produces;
      this.retry = retry;
      this.timeoutRef = timeoutRef;
      this.timeoutValue = timeoutValue;
      this.timeoutUnit = timeoutUnit;
      this.description = description;
      this.delegate = copy(delegate);
      this.use = copy(use);
      this.position = position;
      this.propertyPositions = Collections.unmodifiableMap(new LinkedHashMap<>(propertyPositions));
    }

    /** 属性所在位置；未记录时退回 agent 定义的位置 */
    public SourcePosition positionOf(String property) {
      SourcePosition p = propertyPositions.get(property);
      return p != null ? p : position;
    }

    public static AgentDef of(String name, String instruction, List<String> tools) {
      return new AgentDef(name, tools, instruction, null, null, null, null, null, null, null, null, null, null);
    }

    /** 未命名 agent 的名称为 {@code default} */
    public String effectiveName() {
      return name != null ? name : DEFAULT_NAME;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitAgent(this); }
  }

  public static final class FlowDef implements Definition {
    public final String name;
    public final List<String> params;
    public final List<Stmt> body;
    public final SourcePosition position;

    public FlowDef(String name, List<String> params, List<Stmt> body, SourcePosition position) {
      this.name = name;
      this.params = copy(params);
      this.body = copy(body);
      this.position = position;
    }

    public FlowDef(String name, List<Stmt> body) {
      this(name, List.of(), body, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitFlow(this); }
  }

  public enum Timing {
    ON("on"), AFTER("after");

    public final String label;

    Timing(String label) { this.label = label; }
  }

  public enum EventType {
    START("start"), INPUT("input"), OUTPUT("output"), TOOL_CALL("tool-call"), TOOL_RESULT("tool-result");

    public final String label;

    EventType(String label) { this.label = label; }

    public static EventType fromLabel(String label) {
      for (EventType t : values()) {
        if (t.label.equals(label)) return t;
      }
      throw new IllegalArgumentException("unknown event type: " + label);
    }
  }

  public static final class EventHandler implements Definition {
    public final Timing timing;
    public final EventType eventType;
    public final List<Stmt> body;
    public final SourcePosition position;

    public EventHandler(Timing timing, EventType eventType, List<Stmt> body, SourcePosition position) {
      this.timing = timing;
      this.eventType = eventType;
      this.body = copy(body);
      this.position = position;
    }

    /** 例如 {@code on_tool_call} */
    public String unitName() {
      return timing.label + "_" + eventType.label.replace('-', '_');
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitEventHandler(this); }
  }

  public static final class RetryPolicyDef implements Definition {
    public final String name;
    public final int times;
    public final String backoff;
    public final SourcePosition position;

    public RetryPolicyDef(String name, int times, String backoff, SourcePosition position) {
      this.name = name;
      this.times = times;
      this.backoff = backoff;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitRetryPolicy(this); }
  }

  public static final class TimeoutPolicyDef implements Definition {
    public final String name;
    public final int value;
    public final String unit;
    public final SourcePosition position;

    public TimeoutPolicyDef(String name, int value, String unit, SourcePosition position) {
      this.name = name;
      this.value = value;
      this.unit = unit;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(DefinitionVisitor<R> v) { return v.visitTimeoutPolicy(this); }
  }

  // ============================================================
  // 语句
  // ============================================================

  public sealed interface Stmt
      permits Assignment, PropertyAssignment, RunStmt, CallStmt, ReturnStmt, PushStmt,
              ForLoop, IfBlock, MatchBlock, ParallelBlock, FailureBlock, LoopBlock,
              LogStmt, NotifyStmt, EscalateStmt, ContinueStmt, AbortStmt, RetryStepStmt,
              MaskAction, BlockAction, WarnAction, RetryAction {
    SourcePosition position();
    <R> R accept(StmtVisitor<R> visitor);
  }

  public interface StmtVisitor<R> {
    R visitAssignment(Assignment s);
    R visitPropertyAssignment(PropertyAssignment s);
    R visitRun(RunStmt s);
    R visitCall(CallStmt s);
    R visitReturn(ReturnStmt s);
    R visitPush(PushStmt s);
    R visitFor(ForLoop s);
    R visitIf(IfBlock s);
    R visitMatch(MatchBlock s);
    R visitParallel(ParallelBlock s);
    R visitFailure(FailureBlock s);
    R visitLoop(LoopBlock s);
    R visitLog(LogStmt s);
    R visitNotify(NotifyStmt s);
    R visitEscalate(EscalateStmt s);
    R visitContinue(ContinueStmt s);
    R visitAbort(AbortStmt s);
    R visitRetryStep(RetryStepStmt s);
    R visitMask(MaskAction s);
    R visitBlock(BlockAction s);
    R visitWarn(WarnAction s);
    R visitRetryAction(RetryAction s);
  }

  public static final class Assignment implements Stmt {
    public final String target;
    public final Expr value;
    public final SourcePosition position;

    public Assignment(String target, Expr value, SourcePosition position) {
      this.target = target;
      this.value = value;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitAssignment(this); }
  }

  /** {@code $obj.a.b = v} */
  public static final class PropertyAssignment implements Stmt {
    public final String target;
    public final List<String> path;
    public final Expr value;
    public final SourcePosition position;

    public PropertyAssignment(String target, List<String> path, Expr value, SourcePosition position) {
      this.target = target;
      this.path = copy(path);
      this.value = value;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitPropertyAssignment(this); }
  }

  public enum EscalationAction { RETURN, CONTINUE, ABORT }

  /** {@code , on escalate return $x | continue | abort} */
  public static final class EscalationHandler {
    public final EscalationAction action;
    public final Expr value;

    public EscalationHandler(EscalationAction action, Expr value) {
      this.action = action;
      this.value = value;
    }
  }

  /**
   * 调用 agent（{@code run agent x}）或嵌套 flow（{@code run x}）。
   */
  public static final class RunStmt implements Stmt {
    public final String target;
    public final String name;
    public final List<Expr> args;
    public final boolean isFlow;
    public final EscalationHandler escalationHandler;
    public final SourcePosition position;

    public RunStmt(String target, String name, List<Expr> args, boolean isFlow,
                   EscalationHandler escalationHandler, SourcePosition position) {
      this.target = target;
      this.name = name;
      this.args = copy(args);
      this.isFlow = isFlow;
      this.escalationHandler = escalationHandler;
      this.position = position;
    }

    public static RunStmt agent(String target, String agent, List<Expr> args, SourcePosition position) {
      return new RunStmt(target, agent, args, false, null, position);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitRun(this); }
  }

  public static final class CallStmt implements Stmt {
    public final String target;
    public final String prompt;
    public final List<Expr> args;
    public final String model;
    public final SourcePosition position;

    public CallStmt(String target, String prompt, List<Expr> args, String model, SourcePosition position) {
      this.target = target;
      this.prompt = prompt;
      this.args = copy(args);
      this.model = model;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitCall(this); }
  }

  public static final class ReturnStmt implements Stmt {
    public final Expr value;
    public final SourcePosition position;

    public ReturnStmt(Expr value, SourcePosition position) {
      this.value = value;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitReturn(this); }
  }

  public static final class PushStmt implements Stmt {
    public final Expr value;
    public final String target;
    public final SourcePosition position;

    public PushStmt(Expr value, String target, SourcePosition position) {
      this.value = value;
      this.target = target;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitPush(this); }
  }

  public static final class ForLoop implements Stmt {
    public final String variable;
    public final Expr iterable;
    public final List<Stmt> body;
    public final SourcePosition position;

    public ForLoop(String variable, Expr iterable, List<Stmt> body, SourcePosition position) {
      this.variable = variable;
      this.iterable = iterable;
      this.body = copy(body);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitFor(this); }
  }

  public static final class IfBlock implements Stmt {
    public final Expr condition;
    public final List<Stmt> body;
    public final SourcePosition position;

    public IfBlock(Expr condition, List<Stmt> body, SourcePosition position) {
      this.condition = condition;
      this.body = copy(body);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitIf(this); }
  }

  public static final class MatchCase {
    public final String pattern;
    public final Stmt body;
    public final SourcePosition position;

    public MatchCase(String pattern, Stmt body, SourcePosition position) {
      this.pattern = pattern;
      this.body = body;
      this.position = position;
    }
  }

  public static final class MatchBlock implements Stmt {
    public final Expr subject;
    public final List<MatchCase> cases;
    public final Stmt elseBody;
    public final SourcePosition position;

    public MatchBlock(Expr subject, List<MatchCase> cases, Stmt elseBody, SourcePosition position) {
      this.subject = subject;
      this.cases = copy(cases);
      this.elseBody = elseBody;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitMatch(this); }
  }

  /** 语法上接受任意语句，降级阶段要求全部为 {@link RunStmt} */
  public static final class ParallelBlock implements Stmt {
    public final List<Stmt> body;
    public final SourcePosition position;

    public ParallelBlock(List<Stmt> body, SourcePosition position) {
      this.body = copy(body);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitParallel(this); }
  }

  public static final class FailureBlock implements Stmt {
    public final List<Stmt> body;
    public final SourcePosition position;

    public FailureBlock(List<Stmt> body, SourcePosition position) {
      this.body = copy(body);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitFailure(this); }
  }

  /** {@code maxIterations} 为 null 表示无上限 */
  public static final class LoopBlock implements Stmt {
    public final Integer maxIterations;
    public final List<Stmt> body;
    public final SourcePosition position;

    public LoopBlock(Integer maxIterations, List<Stmt> body, SourcePosition position) {
      this.maxIterations = maxIterations;
      this.body = copy(body);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitLoop(this); }
  }

  public static final class LogStmt implements Stmt {
    public final Expr message;
    public final SourcePosition position;

    public LogStmt(Expr message, SourcePosition position) {
      this.message = message;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitLog(this); }
  }

  public static final class NotifyStmt implements Stmt {
    public final Expr message;
    public final SourcePosition position;

    public NotifyStmt(Expr message, SourcePosition position) {
      this.message = message;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitNotify(this); }
  }

  public static final class EscalateStmt implements Stmt {
    public final String message;
    public final SourcePosition position;

    public EscalateStmt(String message, SourcePosition position) {
      this.message = message;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitEscalate(this); }
  }

  public static final class ContinueStmt implements Stmt {
    public final SourcePosition position;

    public ContinueStmt(SourcePosition position) {
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitContinue(this); }
  }

  public static final class AbortStmt implements Stmt {
    public final SourcePosition position;

    public AbortStmt(SourcePosition position) {
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitAbort(this); }
  }

  public static final class RetryStepStmt implements Stmt {
    public final Expr message;
    public final SourcePosition position;

    public RetryStepStmt(Expr message, SourcePosition position) {
      this.message = message;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitRetryStep(this); }
  }

  // 以下为事件处理器中的 guardrail 动作

  public static final class MaskAction implements Stmt {
    public final String guardrail;
    public final SourcePosition position;

    public MaskAction(String guardrail, SourcePosition position) {
      this.guardrail = guardrail;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitMask(this); }
  }

  public static final class BlockAction implements Stmt {
    public final Expr condition;
    public final SourcePosition position;

    public BlockAction(Expr condition, SourcePosition position) {
      this.condition = condition;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitBlock(this); }
  }

  /** {@code warn if cond} 或 {@code warn "msg"}，二者择一 */
  public static final class WarnAction implements Stmt {
    public final Expr condition;
    public final String message;
    public final SourcePosition position;

    public WarnAction(Expr condition, String message, SourcePosition position) {
      this.condition = condition;
      this.message = message;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitWarn(this); }
  }

  public static final class RetryAction implements Stmt {
    public final Expr message;
    public final Expr condition;
    public final SourcePosition position;

    public RetryAction(Expr message, Expr condition, SourcePosition position) {
      this.message = message;
      this.condition = condition;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(StmtVisitor<R> v) { return v.visitRetryAction(this); }
  }

  // ============================================================
  // 表达式
  // ============================================================

  public sealed interface Expr
      permits VarRef, PropertyAccess, BinaryOp, UnaryOp, FunctionCall,
              ListLiteral, ObjectLiteral, Literal, FilterExpr, ImplicitProperty {
    SourcePosition position();
    <R> R accept(ExprVisitor<R> visitor);
  }

  public interface ExprVisitor<R> {
    R visitVarRef(VarRef e);
    R visitPropertyAccess(PropertyAccess e);
    R visitBinary(BinaryOp e);
    R visitUnary(UnaryOp e);
    R visitFunctionCall(FunctionCall e);
    R visitList(ListLiteral e);
    R visitObject(ObjectLiteral e);
    R visitLiteral(Literal e);
    R visitFilter(FilterExpr e);
    R visitImplicitProperty(ImplicitProperty e);
  }

  public static final class VarRef implements Expr {
    public final String name;
    public final SourcePosition position;

    public VarRef(String name, SourcePosition position) {
      this.name = name;
      this.position = position;
    }

    public VarRef(String name) {
      this(name, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitVarRef(this); }
  }

  public static final class PropertyAccess implements Expr {
    public final Expr base;
    public final List<String> properties;
    public final SourcePosition position;

    public PropertyAccess(Expr base, List<String> properties, SourcePosition position) {
      this.base = base;
      this.properties = copy(properties);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitPropertyAccess(this); }
  }

  public static final class BinaryOp implements Expr {
    public final String op;
    public final Expr left;
    public final Expr right;
    public final SourcePosition position;

    public BinaryOp(String op, Expr left, Expr right, SourcePosition position) {
      this.op = op;
      this.left = left;
      this.right = right;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitBinary(this); }
  }

  public static final class UnaryOp implements Expr {
    public final String op;
    public final Expr operand;
    public final SourcePosition position;

    public UnaryOp(String op, Expr operand, SourcePosition position) {
      this.op = op;
      this.operand = operand;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitUnary(this); }
  }

  public static final class FunctionCall implements Expr {
    public final String name;
    public final List<Expr> args;
    public final SourcePosition position;

    public FunctionCall(String name, List<Expr> args, SourcePosition position) {
      this.name = name;
      this.args = copy(args);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitFunctionCall(this); }
  }

  public static final class ListLiteral implements Expr {
    public final List<Expr> elements;
    public final SourcePosition position;

    public ListLiteral(List<Expr> elements, SourcePosition position) {
      this.elements = copy(elements);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitList(this); }
  }

  public static final class ObjectLiteral implements Expr {
    public final Map<String, Expr> entries;
    public final SourcePosition position;

    public ObjectLiteral(Map<String, Expr> entries, SourcePosition position) {
      this.entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitObject(this); }
  }

  public enum LiteralType { STRING, INT, FLOAT, BOOL, NULL }

  public static final class Literal implements Expr {
    public final Object value;
    public final LiteralType type;
    public final SourcePosition position;

    public Literal(Object value, LiteralType type, SourcePosition position) {
      this.value = value;
      this.type = type;
      this.position = position;
    }

    public static Literal string(String value) {
      return new Literal(value, LiteralType.STRING, null);
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitLiteral(this); }
  }

  /** {@code filter $list where .prop >= 80} */
  public static final class FilterExpr implements Expr {
    public final Expr source;
    public final Expr condition;
    public final SourcePosition position;

    public FilterExpr(Expr source, Expr condition, SourcePosition position) {
      this.source = source;
      this.condition = condition;
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitFilter(this); }
  }

  /** filter 条件中的 {@code .a.b}，相对当前元素取值 */
  public static final class ImplicitProperty implements Expr {
    public final List<String> properties;
    public final SourcePosition position;

    public ImplicitProperty(List<String> properties, SourcePosition position) {
      this.properties = copy(properties);
      this.position = position;
    }

    @Override public SourcePosition position() { return position; }
    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitImplicitProperty(this); }
  }
}
