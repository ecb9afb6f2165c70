package streetrace.dsl.runtime;

import java.util.List;

/**
 * {@link FlowExecution#next()} 产出的事件
 * <p>
 * 挂起类事件（{@link AgentSuspension} 等）要求调用方以 resume / fail 回应后才能继续；
 * 其他事件只是通知，直接再次调用 next() 即可。
 */
public sealed interface RuntimeEvent
    permits RuntimeEvent.AgentSuspension, RuntimeEvent.FlowSuspension, RuntimeEvent.LlmSuspension,
            RuntimeEvent.ParallelSuspension, RuntimeEvent.LogEvent, RuntimeEvent.NotifyEvent,
            RuntimeEvent.EscalationEvent, RuntimeEvent.GuardrailEvent, RuntimeEvent.RetryStepEvent,
            RuntimeEvent.Completed, RuntimeEvent.Aborted {

  /** 是否需要调用方提供结果后才能继续 */
  default boolean isSuspension() { return false; }

  /** 是否为终止事件 */
  default boolean isTerminal() { return false; }

  final class AgentSuspension implements RuntimeEvent {
    public final String agent;
    public final List<Object> args;
    /** 未显式传参时使用的 agent 默认 prompt，可能为 null */
    public final String promptInput;

    public AgentSuspension(String agent, List<Object> args, String promptInput) {
      this.agent = agent;
      this.args = args;
      this.promptInput = promptInput;
    }

    @Override public boolean isSuspension() { return true; }
    @Override public String toString() { return "AgentSuspension[" + agent + ", " + args + "]"; }
  }

  final class FlowSuspension implements RuntimeEvent {
    public final String flow;
    public final List<Object> args;

    public FlowSuspension(String flow, List<Object> args) {
      this.flow = flow;
      this.args = args;
    }

    @Override public boolean isSuspension() { return true; }
    @Override public String toString() { return "FlowSuspension[" + flow + ", " + args + "]"; }
  }

  final class LlmSuspension implements RuntimeEvent {
    public final String prompt;
    public final List<Object> args;
    public final String model;

    public LlmSuspension(String prompt, List<Object> args, String model) {
      this.prompt = prompt;
      this.args = args;
      this.model = model;
    }

    @Override public boolean isSuspension() { return true; }
    @Override public String toString() { return "LlmSuspension[" + prompt + ", " + args + "]"; }
  }

  /** 结果须以 target → 结果 的 Map 回传，与完成顺序无关 */
  final class ParallelSuspension implements RuntimeEvent {
    public final List<Branch> branches;

    public ParallelSuspension(List<Branch> branches) {
      this.branches = branches;
    }

    public static final class Branch {
      public final String name;
      public final boolean flow;
      public final List<Object> args;
      public final String target;

      public Branch(String name, boolean flow, List<Object> args, String target) {
        this.name = name;
        this.flow = flow;
        this.args = args;
        this.target = target;
      }

      @Override public String toString() { return (flow ? "flow " : "agent ") + name + " -> " + target; }
    }

    @Override public boolean isSuspension() { return true; }
    @Override public String toString() { return "ParallelSuspension" + branches; }
  }

  final class LogEvent implements RuntimeEvent {
    public final String message;
    public LogEvent(String message) { this.message = message; }
    @Override public String toString() { return "LogEvent[" + message + "]"; }
  }

  final class NotifyEvent implements RuntimeEvent {
    public final String message;
    public NotifyEvent(String message) { this.message = message; }
    @Override public String toString() { return "NotifyEvent[" + message + "]"; }
  }

  final class EscalationEvent implements RuntimeEvent {
    public final String message;
    public EscalationEvent(String message) { this.message = message; }
    @Override public String toString() { return "EscalationEvent[" + message + "]"; }
  }

  final class GuardrailEvent implements RuntimeEvent {
    public final String action;
    public final String guardrail;
    public final boolean triggered;
    public final String message;

    public GuardrailEvent(String action, String guardrail, boolean triggered, String message) {
      this.action = action;
      this.guardrail = guardrail;
      this.triggered = triggered;
      this.message = message;
    }

    @Override public String toString() { return "GuardrailEvent[" + action + ", triggered=" + triggered + "]"; }
  }

  final class RetryStepEvent implements RuntimeEvent {
    public final String message;
    public RetryStepEvent(String message) { this.message = message; }
    @Override public String toString() { return "RetryStepEvent[" + message + "]"; }
  }

  final class Completed implements RuntimeEvent {
    public final Object returnValue;
    public Completed(Object returnValue) { this.returnValue = returnValue; }
    @Override public boolean isTerminal() { return true; }
    @Override public String toString() { return "Completed[" + returnValue + "]"; }
  }

  final class Aborted implements RuntimeEvent {
    public final String reason;
    public Aborted(String reason) { this.reason = reason; }
    @Override public boolean isTerminal() { return true; }
    @Override public String toString() { return "Aborted[" + reason + "]"; }
  }
}
