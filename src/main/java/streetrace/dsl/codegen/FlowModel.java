package streetrace.dsl.codegen;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * 降级后的可执行表示
 * <p>
 * 每个 flow / 事件处理器是一个 {@link FlowUnit}：线性指令表加保护区表。
 * 生成位置即指令在所属单元中的下标；跳转目标同样以下标表示。
 * 挂起点为 {@link RunAgent}、{@link RunFlow}、{@link CallLlm} 与 {@link Parallel}，
 * 运行时在这些指令处交出控制权，拿到结果后从下一条指令继续。
 */
public final class FlowModel {
  private FlowModel() {}

  /** 返回值槽位：return 写入此变量后停机 */
  public static final String RETURN_SLOT = "_return_value";

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class WorkflowProgram {
    public String sourceName;
    public String version;
    public Map<String, ModelSpec> models = new LinkedHashMap<>();
    public Map<String, ToolSpec> tools = new LinkedHashMap<>();
    public SchemaRegistry schemas = new SchemaRegistry();
    public Map<String, PromptSpec> prompts = new LinkedHashMap<>();
    public Map<String, AgentSpec> agents = new LinkedHashMap<>();
    public Map<String, RetrySpec> retryPolicies = new LinkedHashMap<>();
    public Map<String, TimeoutSpec> timeoutPolicies = new LinkedHashMap<>();
    public List<ImportSpec> imports = new ArrayList<>();
    public Map<String, FlowUnit> flows = new LinkedHashMap<>();
    public Map<String, FlowUnit> handlers = new LinkedHashMap<>();
  }

  // ============================================================
  // 定义注册表
  // ============================================================

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public static final class ModelSpec {
    public String name;
    public String providerModel;
    public Map<String, Object> properties = new LinkedHashMap<>();
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public static final class ToolSpec {
    public String name;
    public String type;
    public String url;
    public String authType;
    public String authValue;
    public String builtinRef;
    public Map<String, String> headers = new LinkedHashMap<>();
    public Map<String, Object> properties = new LinkedHashMap<>();
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class PromptSpec {
    public String name;
    public String body;
    public String model;
    public String schema;
    public boolean schemaIsList;
    public String inherit;
    public EscalationSpec escalation;
  }

  public static final class EscalationSpec {
    public String op;
    public String value;

    public EscalationSpec() {}
    public EscalationSpec(String op, String value) { this.op = op; this.value = value; }
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public static final class AgentSpec {
    public String name;
    public String instruction;
    public String prompt;
    public String produces;
    public List<String> tools = new ArrayList<>();
    public String retryPolicy;
    public String timeoutPolicy;
    public Long timeoutSeconds;
    public String description;
    public List<String> delegate = new ArrayList<>();
    public List<String> use = new ArrayList<>();
  }

  public static final class RetrySpec {
    public String name;
    public int times;
    public String backoff;
  }

  public static final class TimeoutSpec {
    public String name;
    public int value;
    public String unit;

    /** 换算为秒 */
    public long seconds() {
      return switch (unit) {
        case "minutes" -> value * 60L;
        case "hours" -> value * 3600L;
        default -> value;
      };
    }
  }

  public static final class ImportSpec {
    public String name;
    public String source;
    public String type;
  }

  // ============================================================
  // 可执行单元
  // ============================================================

  public static final class FlowUnit {
    public String name;
    public List<String> params = new ArrayList<>();
    public List<Instruction> instructions = new ArrayList<>();
    public List<ProtectedRegion> regions = new ArrayList<>();
  }

  /** [start, end) 内抛出的任何失败转到 handler */
  public static final class ProtectedRegion {
    public int start;
    public int end;
    public int handler;

    public ProtectedRegion() {}
    public ProtectedRegion(int start, int end, int handler) { this.start = start; this.end = end; this.handler = handler; }

    public boolean covers(int pc) { return pc >= start && pc < end; }
  }

  public static final class ParallelBranch {
    public String name;
    public boolean flow;
    public List<Expr> args = new ArrayList<>();
    public String target;

    public ParallelBranch() {}
    public ParallelBranch(String name, boolean flow, List<Expr> args, String target) {
      this.name = name; this.flow = flow; this.args = args; this.target = target;
    }
  }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = AssignProperty.class, name = "AssignProperty"),
    @JsonSubTypes.Type(value = Jump.class, name = "Jump"),
    @JsonSubTypes.Type(value = JumpIfFalse.class, name = "JumpIfFalse"),
    @JsonSubTypes.Type(value = MatchJump.class, name = "MatchJump"),
    @JsonSubTypes.Type(value = IterInit.class, name = "IterInit"),
    @JsonSubTypes.Type(value = IterNext.class, name = "IterNext"),
    @JsonSubTypes.Type(value = CounterInit.class, name = "CounterInit"),
    @JsonSubTypes.Type(value = CounterCheck.class, name = "CounterCheck"),
    @JsonSubTypes.Type(value = RunAgent.class, name = "RunAgent"),
    @JsonSubTypes.Type(value = RunFlow.class, name = "RunFlow"),
    @JsonSubTypes.Type(value = CallLlm.class, name = "CallLlm"),
    @JsonSubTypes.Type(value = Parallel.class, name = "Parallel"),
    @JsonSubTypes.Type(value = EscalationCheck.class, name = "EscalationCheck"),
    @JsonSubTypes.Type(value = Push.class, name = "Push"),
    @JsonSubTypes.Type(value = Log.class, name = "Log"),
    @JsonSubTypes.Type(value = Notify.class, name = "Notify"),
    @JsonSubTypes.Type(value = Escalate.class, name = "Escalate"),
    @JsonSubTypes.Type(value = Abort.class, name = "Abort"),
    @JsonSubTypes.Type(value = RetryStep.class, name = "RetryStep"),
    @JsonSubTypes.Type(value = Guardrail.class, name = "Guardrail"),
    @JsonSubTypes.Type(value = Halt.class, name = "Halt")
  })
  public sealed interface Instruction
      permits Assign, AssignProperty, Jump, JumpIfFalse, MatchJump, IterInit, IterNext,
              CounterInit, CounterCheck, RunAgent, RunFlow, CallLlm, Parallel, EscalationCheck,
              Push, Log, Notify, Escalate, Abort, RetryStep, Guardrail, Halt {
    <R> R accept(InstructionVisitor<R> visitor);
  }

  public interface InstructionVisitor<R> {
    R visitAssign(Assign i);
    R visitAssignProperty(AssignProperty i);
    R visitJump(Jump i);
    R visitJumpIfFalse(JumpIfFalse i);
    R visitMatchJump(MatchJump i);
    R visitIterInit(IterInit i);
    R visitIterNext(IterNext i);
    R visitCounterInit(CounterInit i);
    R visitCounterCheck(CounterCheck i);
    R visitRunAgent(RunAgent i);
    R visitRunFlow(RunFlow i);
    R visitCallLlm(CallLlm i);
    R visitParallel(Parallel i);
    R visitEscalationCheck(EscalationCheck i);
    R visitPush(Push i);
    R visitLog(Log i);
    R visitNotify(Notify i);
    R visitEscalate(Escalate i);
    R visitAbort(Abort i);
    R visitRetryStep(RetryStep i);
    R visitGuardrail(Guardrail i);
    R visitHalt(Halt i);
  }

  @JsonTypeName("Assign")
  public static final class Assign implements Instruction {
    public String target; public Expr value;
    public Assign() {}
    public Assign(String target, Expr value) { this.target = target; this.value = value; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitAssign(this); }
  }

  @JsonTypeName("AssignProperty")
  public static final class AssignProperty implements Instruction {
    public String target; public List<String> path; public Expr value;
    public AssignProperty() {}
    public AssignProperty(String target, List<String> path, Expr value) { this.target = target; this.path = path; this.value = value; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitAssignProperty(this); }
  }

  @JsonTypeName("Jump")
  public static final class Jump implements Instruction {
    public int target;
    public Jump() {}
    public Jump(int target) { this.target = target; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJump(this); }
  }

  @JsonTypeName("JumpIfFalse")
  public static final class JumpIfFalse implements Instruction {
    public Expr condition; public int target;
    public JumpIfFalse() {}
    public JumpIfFalse(Expr condition, int target) { this.condition = condition; this.target = target; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitJumpIfFalse(this); }
  }

  /** 按字符串相等分派；未命中跳转 defaultTarget */
  @JsonTypeName("MatchJump")
  public static final class MatchJump implements Instruction {
    public Expr subject; public Map<String, Integer> cases = new LinkedHashMap<>(); public int defaultTarget;
    public MatchJump() {}
    public MatchJump(Expr subject) { this.subject = subject; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitMatchJump(this); }
  }

  @JsonTypeName("IterInit")
  public static final class IterInit implements Instruction {
    public String slot; public Expr iterable;
    public IterInit() {}
    public IterInit(String slot, Expr iterable) { this.slot = slot; this.iterable = iterable; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitIterInit(this); }
  }

  /** 取下一个元素绑定到 variable；耗尽时跳转 exit */
  @JsonTypeName("IterNext")
  public static final class IterNext implements Instruction {
    public String slot; public String variable; public int exit;
    public IterNext() {}
    public IterNext(String slot, String variable, int exit) { this.slot = slot; this.variable = variable; this.exit = exit; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitIterNext(this); }
  }

  @JsonTypeName("CounterInit")
  public static final class CounterInit implements Instruction {
    public String slot;
    public CounterInit() {}
    public CounterInit(String slot) { this.slot = slot; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitCounterInit(this); }
  }

  /** max 为 -1 表示无上限（由运行时安全上限兜底） */
  @JsonTypeName("CounterCheck")
  public static final class CounterCheck implements Instruction {
    public String slot; public int max; public int exit;
    public CounterCheck() {}
    public CounterCheck(String slot, int max, int exit) { this.slot = slot; this.max = max; this.exit = exit; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitCounterCheck(this); }
  }

  @JsonTypeName("RunAgent")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class RunAgent implements Instruction {
    public String agent; public List<Expr> args = new ArrayList<>(); public String target; public String promptInput;
    public RunAgent() {}
    public RunAgent(String agent, List<Expr> args, String target, String promptInput) {
      this.agent = agent; this.args = args; this.target = target; this.promptInput = promptInput;
    }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitRunAgent(this); }
  }

  @JsonTypeName("RunFlow")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class RunFlow implements Instruction {
    public String flow; public List<Expr> args = new ArrayList<>(); public String target;
    public RunFlow() {}
    public RunFlow(String flow, List<Expr> args, String target) { this.flow = flow; this.args = args; this.target = target; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitRunFlow(this); }
  }

  @JsonTypeName("CallLlm")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class CallLlm implements Instruction {
    public String prompt; public List<Expr> args = new ArrayList<>(); public String model; public String target;
    public CallLlm() {}
    public CallLlm(String prompt, List<Expr> args, String model, String target) {
      this.prompt = prompt; this.args = args; this.model = model; this.target = target;
    }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitCallLlm(this); }
  }

  @JsonTypeName("Parallel")
  public static final class Parallel implements Instruction {
    public List<ParallelBranch> branches = new ArrayList<>();
    public Parallel() {}
    public Parallel(List<ParallelBranch> branches) { this.branches = branches; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitParallel(this); }
  }

  /**
   * 紧随 {@link RunAgent} 之后：上一次调用被升级时按 action 处理，
   * RETURN 写返回槽并停机，CONTINUE 跳到 continueTarget，ABORT 中止。
   */
  @JsonTypeName("EscalationCheck")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class EscalationCheck implements Instruction {
    public String action; public Expr value; public Integer continueTarget;
    public EscalationCheck() {}
    public EscalationCheck(String action, Expr value, Integer continueTarget) {
      this.action = action; this.value = value; this.continueTarget = continueTarget;
    }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitEscalationCheck(this); }
  }

  @JsonTypeName("Push")
  public static final class Push implements Instruction {
    public Expr value; public String target;
    public Push() {}
    public Push(Expr value, String target) { this.value = value; this.target = target; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitPush(this); }
  }

  @JsonTypeName("Log")
  public static final class Log implements Instruction {
    public Expr message;
    public Log() {}
    public Log(Expr message) { this.message = message; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitLog(this); }
  }

  @JsonTypeName("Notify")
  public static final class Notify implements Instruction {
    public Expr message;
    public Notify() {}
    public Notify(Expr message) { this.message = message; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitNotify(this); }
  }

  @JsonTypeName("Escalate")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Escalate implements Instruction {
    public String message;
    public Escalate() {}
    public Escalate(String message) { this.message = message; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitEscalate(this); }
  }

  @JsonTypeName("Abort")
  public static final class Abort implements Instruction {
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitAbort(this); }
  }

  @JsonTypeName("RetryStep")
  public static final class RetryStep implements Instruction {
    public Expr message;
    public RetryStep() {}
    public RetryStep(Expr message) { this.message = message; }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitRetryStep(this); }
  }

  /** action ∈ mask / block / warn / retry */
  @JsonTypeName("Guardrail")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Guardrail implements Instruction {
    public String action; public String guardrail; public Expr condition; public Expr message;
    public Guardrail() {}
    public Guardrail(String action, String guardrail, Expr condition, Expr message) {
      this.action = action; this.guardrail = guardrail; this.condition = condition; this.message = message;
    }

    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitGuardrail(this); }
  }

  @JsonTypeName("Halt")
  public static final class Halt implements Instruction {
    @Override public <R> R accept(InstructionVisitor<R> v) { return v.visitHalt(this); }
  }

  // ============================================================
  // 表达式
  // ============================================================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Const.class, name = "Const"),
    @JsonSubTypes.Type(value = Var.class, name = "Var"),
    @JsonSubTypes.Type(value = Prop.class, name = "Prop"),
    @JsonSubTypes.Type(value = Binary.class, name = "Binary"),
    @JsonSubTypes.Type(value = Unary.class, name = "Unary"),
    @JsonSubTypes.Type(value = Call.class, name = "Call"),
    @JsonSubTypes.Type(value = ListE.class, name = "List"),
    @JsonSubTypes.Type(value = ObjectE.class, name = "Object"),
    @JsonSubTypes.Type(value = Filter.class, name = "Filter"),
    @JsonSubTypes.Type(value = Item.class, name = "Item"),
    @JsonSubTypes.Type(value = Template.class, name = "Template")
  })
  public sealed interface Expr permits Const, Var, Prop, Binary, Unary, Call, ListE, ObjectE, Filter, Item, Template {
    <R> R accept(ExprVisitor<R> visitor);
  }

  public interface ExprVisitor<R> {
    R visitConst(Const e);
    R visitVar(Var e);
    R visitProp(Prop e);
    R visitBinary(Binary e);
    R visitUnary(Unary e);
    R visitCall(Call e);
    R visitList(ListE e);
    R visitObject(ObjectE e);
    R visitFilter(Filter e);
    R visitItem(Item e);
    R visitTemplate(Template e);
  }

  @JsonTypeName("Const")
  public static final class Const implements Expr {
    public Object value;
    public Const() {}
    public Const(Object value) { this.value = value; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitConst(this); }
  }

  @JsonTypeName("Var")
  public static final class Var implements Expr {
    public String name;
    public Var() {}
    public Var(String name) { this.name = name; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitVar(this); }
  }

  @JsonTypeName("Prop")
  public static final class Prop implements Expr {
    public Expr base; public List<String> path;
    public Prop() {}
    public Prop(Expr base, List<String> path) { this.base = base; this.path = path; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitProp(this); }
  }

  @JsonTypeName("Binary")
  public static final class Binary implements Expr {
    public String op; public Expr left; public Expr right;
    public Binary() {}
    public Binary(String op, Expr left, Expr right) { this.op = op; this.left = left; this.right = right; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitBinary(this); }
  }

  @JsonTypeName("Unary")
  public static final class Unary implements Expr {
    public String op; public Expr operand;
    public Unary() {}
    public Unary(String op, Expr operand) { this.op = op; this.operand = operand; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitUnary(this); }
  }

  @JsonTypeName("Call")
  public static final class Call implements Expr {
    public String function; public List<Expr> args = new ArrayList<>();
    public Call() {}
    public Call(String function, List<Expr> args) { this.function = function; this.args = args; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitCall(this); }
  }

  @JsonTypeName("List")
  public static final class ListE implements Expr {
    public List<Expr> elements = new ArrayList<>();
    public ListE() {}
    public ListE(List<Expr> elements) { this.elements = elements; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitList(this); }
  }

  @JsonTypeName("Object")
  public static final class ObjectE implements Expr {
    public Map<String, Expr> entries = new LinkedHashMap<>();
    public ObjectE() {}
    public ObjectE(Map<String, Expr> entries) { this.entries = entries; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitObject(this); }
  }

  @JsonTypeName("Filter")
  public static final class Filter implements Expr {
    public Expr source; public Expr condition;
    public Filter() {}
    public Filter(Expr source, Expr condition) { this.source = source; this.condition = condition; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitFilter(this); }
  }

  /** filter 条件中相对当前元素的属性路径 */
  @JsonTypeName("Item")
  public static final class Item implements Expr {
    public List<String> path;
    public Item() {}
    public Item(List<String> path) { this.path = path; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitItem(this); }
  }

  @JsonTypeName("Template")
  public static final class Template implements Expr {
    public List<TemplatePart> parts = new ArrayList<>();
    public Template() {}
    public Template(List<TemplatePart> parts) { this.parts = parts; }

    @Override public <R> R accept(ExprVisitor<R> v) { return v.visitTemplate(this); }
  }

  /** 字面文本（text 非空）或插值洞：path 为点分变量路径，function 可选 */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class TemplatePart {
    public String text;
    public List<String> path;
    public String function;

    public static TemplatePart literal(String text) {
      TemplatePart p = new TemplatePart();
      p.text = text;
      return p;
    }

    public static TemplatePart hole(List<String> path, String function) {
      TemplatePart p = new TemplatePart();
      p.path = path;
      p.function = function;
      return p;
    }

    @JsonIgnore
    public boolean isLiteral() { return text != null; }
  }
}
