package streetrace.dsl.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import streetrace.dsl.codegen.FlowModel;
import streetrace.dsl.codegen.FlowModel.*;

/**
 * 单个执行单元（flow 或事件处理器）的可挂起执行
 * <p>
 * 外部调用 {@link #next()} 推进；遇到 agent / flow / LLM / parallel 调用时返回挂起事件，
 * 宿主完成后以 {@link #resume(Object)} 回填结果，或以 {@link #fail(Throwable)} 报告失败。
 * 失败落在 failure 保护区内时跳转到对应处理代码，否则以 {@link WorkflowRuntimeException} 抛出。
 * <p>
 * 非线程安全：同一执行只能由一个线程驱动。
 */
public final class FlowExecution {
  private static final Logger LOGGER = Logger.getLogger(FlowExecution.class.getName());

  /** 保护区处理代码中可读取的错误消息变量 */
  public static final String ERROR_SLOT = "_error";

  public enum State { RUNNING, SUSPENDED, COMPLETED, ABORTED, FAILED }

  private final FlowUnit unit;
  private final VariableEnv env;
  private int pc;
  private State state = State.RUNNING;
  private Instruction pending;
  private boolean lastEscalated;
  private RuntimeEvent terminal;
  private final Stepper stepper = new Stepper();

  public FlowExecution(FlowUnit unit, VariableEnv env) {
    this.unit = unit;
    this.env = env;
  }

  /**
   * 按参数位置绑定 flow 参数并创建执行
   */
  public static FlowExecution start(FlowUnit unit, VariableEnv env, List<?> args) {
    for (int i = 0; i < unit.params.size(); i++) {
      env.bind(unit.params.get(i), i < args.size() ? args.get(i) : null);
    }
    return new FlowExecution(unit, env);
  }

  public State state() { return state; }

  public VariableEnv env() { return env; }

  public String unitName() { return unit.name; }

  /** 当前指令位置，供 source map 反查 */
  public int pc() { return pc; }

  /**
   * 运行到下一个事件
   *
   * @return 挂起、通知或终止事件
   * @throws WorkflowRuntimeException 未被 failure 保护区捕获的运行时错误
   */
  public RuntimeEvent next() {
    switch (state) {
      case SUSPENDED:
        throw new IllegalStateException("execution of '" + unit.name + "' is suspended; resume it first");
      case COMPLETED:
      case ABORTED:
        return terminal;
      case FAILED:
        throw new IllegalStateException("execution of '" + unit.name + "' has failed");
      default:
        break;
    }
    while (true) {
      if (pc >= unit.instructions.size()) {
        return complete();
      }
      Instruction instruction = unit.instructions.get(pc);
      if (RuntimeConfig.DEBUG) {
        LOGGER.log(Level.INFO, "{0}@{1}: {2}", new Object[]{unit.name, pc, instruction});
      }
      RuntimeEvent event;
      try {
        event = step(instruction);
      } catch (WorkflowRuntimeException | Builtins.BuiltinException e) {
        handleFailure(e);
        continue;
      }
      if (event != null) {
        return event;
      }
    }
  }

  /** 以调用结果恢复挂起的执行 */
  public void resume(Object result) {
    resume(result, false);
  }

  /** 以调用结果恢复，并标记该 agent 调用触发了升级条件 */
  public void resumeEscalated(Object result) {
    resume(result, true);
  }

  private void resume(Object result, boolean escalated) {
    requireSuspended();
    Instruction instruction = pending;
    pending = null;
    state = State.RUNNING;
    lastEscalated = escalated;
    if (instruction instanceof RunAgent run) {
      assignTarget(run.target, result);
    } else if (instruction instanceof RunFlow run) {
      assignTarget(run.target, result);
    } else if (instruction instanceof CallLlm call) {
      assignTarget(call.target, result);
    } else if (instruction instanceof Parallel parallel) {
      if (!(result instanceof Map<?, ?> results)) {
        throw new IllegalArgumentException("parallel results must be a map keyed by target, got " + result);
      }
      for (ParallelBranch branch : parallel.branches) {
        if (branch.target != null && results.containsKey(branch.target)) {
          assignTarget(branch.target, results.get(branch.target));
        }
      }
    }
    pc++;
  }

  /**
   * 报告挂起调用失败
   * <p>
   * 失败位置处于保护区内时转入处理代码，执行保持可推进；否则执行进入 FAILED 并抛出异常。
   */
  public void fail(Throwable error) {
    requireSuspended();
    pending = null;
    state = State.RUNNING;
    lastEscalated = false;
    WorkflowRuntimeException wrapped = error instanceof WorkflowRuntimeException w
        ? w
        : new WorkflowRuntimeException(String.valueOf(error.getMessage()), error);
    handleFailure(wrapped);
  }

  private void requireSuspended() {
    if (state != State.SUSPENDED) {
      throw new IllegalStateException(RuntimeErrors.notSuspended(state.name()));
    }
  }

  private void handleFailure(RuntimeException error) {
    ProtectedRegion region = innermostRegion(pc);
    if (region == null) {
      state = State.FAILED;
      LOGGER.log(Level.FINE, "unhandled failure in {0} at {1}: {2}", new Object[]{unit.name, pc, error.getMessage()});
      throw error instanceof WorkflowRuntimeException w ? w : new WorkflowRuntimeException(error.getMessage(), error);
    }
    LOGGER.log(Level.FINE, "failure in {0} at {1} handled at {2}", new Object[]{unit.name, pc, region.handler});
    env.putSlot(ERROR_SLOT, error.getMessage());
    pc = region.handler;
  }

  private ProtectedRegion innermostRegion(int at) {
    ProtectedRegion best = null;
    for (ProtectedRegion region : unit.regions) {
      if (region.covers(at) && (best == null || region.end - region.start < best.end - best.start)) {
        best = region;
      }
    }
    return best;
  }

  private RuntimeEvent complete() {
    state = State.COMPLETED;
    terminal = new RuntimeEvent.Completed(env.slot(FlowModel.RETURN_SLOT));
    return terminal;
  }

  private RuntimeEvent abort(String reason) {
    state = State.ABORTED;
    terminal = new RuntimeEvent.Aborted(reason);
    return terminal;
  }

  private RuntimeEvent suspend(Instruction instruction, RuntimeEvent event) {
    pending = instruction;
    state = State.SUSPENDED;
    return event;
  }

  private void assignTarget(String target, Object value) {
    if (target != null) {
      env.assign(target, value);
    }
  }

  /** 执行一条指令；返回 null 表示继续下一条 */
  private RuntimeEvent step(Instruction instruction) {
    return instruction.accept(stepper);
  }

  private final class Stepper implements InstructionVisitor<RuntimeEvent> {
    @Override
    public RuntimeEvent visitAssign(Assign a) {
      Object value = eval(a.value);
      if (FlowModel.RETURN_SLOT.equals(a.target)) {
        env.putSlot(a.target, value);
      } else {
        env.assign(a.target, value);
      }
      pc++;
      return null;
    }

    @Override
    public RuntimeEvent visitAssignProperty(AssignProperty a) {
      assignProperty(a);
      pc++;
      return null;
    }

    @Override
    public RuntimeEvent visitJump(Jump j) {
      pc = j.target;
      return null;
    }

    @Override
    public RuntimeEvent visitJumpIfFalse(JumpIfFalse j) {
      pc = ExpressionEvaluator.toBool(eval(j.condition)) ? pc + 1 : j.target;
      return null;
    }

    @Override
    public RuntimeEvent visitMatchJump(MatchJump m) {
      String subject = ExpressionEvaluator.stringify(eval(m.subject));
      Integer target = m.cases.get(subject);
      pc = target != null ? target : m.defaultTarget;
      return null;
    }

    @Override
    public RuntimeEvent visitIterInit(IterInit it) {
      env.putSlot(it.slot, new Cursor(ExpressionEvaluator.iterate(eval(it.iterable))));
      pc++;
      return null;
    }

    @Override
    public RuntimeEvent visitIterNext(IterNext it) {
      Cursor cursor = (Cursor) env.slot(it.slot);
      if (cursor != null && cursor.index < cursor.items.size()) {
        env.assign(it.variable, cursor.items.get(cursor.index++));
        pc++;
      } else {
        env.clearSlot(it.slot);
        pc = it.exit;
      }
      return null;
    }

    @Override
    public RuntimeEvent visitCounterInit(CounterInit c) {
      env.putSlot(c.slot, 0);
      pc++;
      return null;
    }

    @Override
    public RuntimeEvent visitCounterCheck(CounterCheck c) {
      int count = (Integer) env.slot(c.slot);
      int limit = c.max < 0 ? RuntimeConfig.LOOP_MAX : c.max;
      if (count >= limit) {
        if (c.max < 0) {
          throw new WorkflowRuntimeException(RuntimeErrors.loopLimitExceeded(limit));
        }
        pc = c.exit;
      } else {
        env.putSlot(c.slot, count + 1);
        pc++;
      }
      return null;
    }

    @Override
    public RuntimeEvent visitRunAgent(RunAgent run) {
      lastEscalated = false;
      return suspend(run, new RuntimeEvent.AgentSuspension(run.agent, evalAll(run.args), run.promptInput));
    }

    @Override
    public RuntimeEvent visitRunFlow(RunFlow run) {
      return suspend(run, new RuntimeEvent.FlowSuspension(run.flow, evalAll(run.args)));
    }

    @Override
    public RuntimeEvent visitCallLlm(CallLlm call) {
      return suspend(call, new RuntimeEvent.LlmSuspension(call.prompt, evalAll(call.args), call.model));
    }

    @Override
    public RuntimeEvent visitParallel(Parallel parallel) {
      List<RuntimeEvent.ParallelSuspension.Branch> branches = new ArrayList<>(parallel.branches.size());
      for (ParallelBranch b : parallel.branches) {
        branches.add(new RuntimeEvent.ParallelSuspension.Branch(b.name, b.flow, evalAll(b.args), b.target));
      }
      return suspend(parallel, new RuntimeEvent.ParallelSuspension(branches));
    }

    @Override
    public RuntimeEvent visitEscalationCheck(EscalationCheck check) {
      return escalationCheck(check);
    }

    @Override
    public RuntimeEvent visitPush(Push push) {
      push(push);
      pc++;
      return null;
    }

    @Override
    public RuntimeEvent visitLog(Log log) {
      String message = ExpressionEvaluator.stringify(eval(log.message));
      LOGGER.log(Level.INFO, "[{0}] {1}", new Object[]{unit.name, message});
      pc++;
      return new RuntimeEvent.LogEvent(message);
    }

    @Override
    public RuntimeEvent visitNotify(Notify notify) {
      pc++;
      return new RuntimeEvent.NotifyEvent(ExpressionEvaluator.stringify(eval(notify.message)));
    }

    @Override
    public RuntimeEvent visitEscalate(Escalate escalate) {
      LOGGER.log(Level.WARNING, "[{0}] escalated to human: {1}", new Object[]{unit.name, escalate.message});
      pc++;
      return new RuntimeEvent.EscalationEvent(escalate.message);
    }

    @Override
    public RuntimeEvent visitAbort(Abort a) {
      return abort("abort statement in " + unit.name);
    }

    @Override
    public RuntimeEvent visitRetryStep(RetryStep retry) {
      pc++;
      return new RuntimeEvent.RetryStepEvent(
          retry.message == null ? null : ExpressionEvaluator.stringify(eval(retry.message)));
    }

    @Override
    public RuntimeEvent visitGuardrail(Guardrail g) {
      boolean triggered = g.condition == null || ExpressionEvaluator.toBool(eval(g.condition));
      String message = g.message == null ? null : ExpressionEvaluator.stringify(eval(g.message));
      pc++;
      return new RuntimeEvent.GuardrailEvent(g.action, g.guardrail, triggered, message);
    }

    @Override
    public RuntimeEvent visitHalt(Halt h) {
      return complete();
    }
  }

  private RuntimeEvent escalationCheck(EscalationCheck check) {
    if (!lastEscalated) {
      pc++;
      return null;
    }
    lastEscalated = false;
    switch (check.action) {
      case "RETURN":
        env.putSlot(FlowModel.RETURN_SLOT, check.value == null ? null : eval(check.value));
        return complete();
      case "CONTINUE":
        pc = check.continueTarget;
        return null;
      case "ABORT":
        return abort("agent escalated in " + unit.name);
      default:
        throw new IllegalStateException("unknown escalation action: " + check.action);
    }
  }

  @SuppressWarnings("unchecked")
  private void assignProperty(AssignProperty a) {
    String name = a.target;
    Object root = env.lookup(name);
    if (root == null) {
      root = new LinkedHashMap<String, Object>();
      env.assign(name, root);
    }
    Object current = root;
    for (int i = 0; i < a.path.size() - 1; i++) {
      Map<String, Object> map = asObject(a.path.get(i), current);
      Object child = map.get(a.path.get(i));
      if (child == null) {
        child = new LinkedHashMap<String, Object>();
        map.put(a.path.get(i), child);
      }
      current = child;
    }
    String last = a.path.get(a.path.size() - 1);
    asObject(last, current).put(last, eval(a.value));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asObject(String property, Object value) {
    if (!(value instanceof Map)) {
      throw new WorkflowRuntimeException(RuntimeErrors.notAnObject(property, value));
    }
    return (Map<String, Object>) value;
  }

  private void push(Push push) {
    String name = push.target;
    Object current = env.lookup(name);
    if (!(current instanceof List<?> list)) {
      throw new WorkflowRuntimeException(RuntimeErrors.pushTargetNotList(name, current));
    }
    // 宿主提供的列表可能不可变，统一复制
    List<Object> copy = new ArrayList<>(list);
    copy.add(eval(push.value));
    env.assign(name, copy);
  }

  private Object eval(FlowModel.Expr expr) {
    return ExpressionEvaluator.evaluate(expr, env);
  }

  private List<Object> evalAll(List<FlowModel.Expr> exprs) {
    List<Object> out = new ArrayList<>(exprs.size());
    for (FlowModel.Expr e : exprs) {
      out.add(eval(e));
    }
    return out;
  }

  /** for 循环迭代状态，存放在内部槽位中 */
  private static final class Cursor {
    final List<?> items;
    int index;

    Cursor(List<?> items) {
      this.items = items;
    }
  }
}
