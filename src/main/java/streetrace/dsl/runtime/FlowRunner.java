package streetrace.dsl.runtime;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import streetrace.dsl.codegen.FlowModel.AgentSpec;
import streetrace.dsl.codegen.FlowModel.EscalationSpec;
import streetrace.dsl.codegen.FlowModel.FlowUnit;
import streetrace.dsl.codegen.FlowModel.PromptSpec;
import streetrace.dsl.codegen.FlowModel.WorkflowProgram;

/**
 * 以 {@link WorkflowHost} 驱动 {@link FlowExecution} 直到结束的参考驱动器
 * <p>
 * 嵌套 flow 在同一线程内递归执行；parallel 分支交给 {@link ParallelDispatcher}。
 * {@code on_start} 处理器写入全局环境，每次 flow 执行在其子环境中进行。
 * agent 输出满足其 instruction prompt 上的升级条件时按升级恢复。
 */
public final class FlowRunner {
  private static final Logger LOGGER = Logger.getLogger(FlowRunner.class.getName());

  static final String ON_START = "on_start";

  private final WorkflowProgram program;
  private final WorkflowHost host;
  private final ParallelDispatcher dispatcher;
  private final VariableEnv globals = new VariableEnv();

  public FlowRunner(WorkflowProgram program, WorkflowHost host, ParallelDispatcher dispatcher) {
    this.program = program;
    this.host = host;
    this.dispatcher = dispatcher;
  }

  /**
   * 运行一个 flow
   *
   * @param flowName flow 名
   * @param args 按参数位置传入的实参
   * @return {@link RuntimeEvent.Completed} 或 {@link RuntimeEvent.Aborted}
   * @throws WorkflowRuntimeException 未被处理的运行时错误
   */
  public RuntimeEvent run(String flowName, List<?> args) {
    FlowUnit unit = program.flows.get(flowName);
    if (unit == null) {
      throw new WorkflowRuntimeException(RuntimeErrors.unknownFlow(flowName));
    }
    return drive(FlowExecution.start(unit, globals.nested(), args));
  }

  /**
   * 运行一个事件处理器，例如 {@code on_start}
   *
   * @param handlerName 处理器单元名
   * @param variables 初始变量，如 input_prompt
   */
  public RuntimeEvent runHandler(String handlerName, Map<String, ?> variables) {
    FlowUnit unit = program.handlers.get(handlerName);
    if (unit == null) {
      throw new WorkflowRuntimeException(RuntimeErrors.unknownFlow(handlerName));
    }
    VariableEnv env = ON_START.equals(handlerName) ? globals : globals.nested();
    variables.forEach(env::bind);
    return drive(new FlowExecution(unit, env));
  }

  /** on_start 处理器写入的全局变量 */
  public Map<String, Object> globals() {
    return globals.snapshot();
  }

  private RuntimeEvent drive(FlowExecution execution) {
    LOGGER.log(Level.FINE, "running {0}", execution.unitName());
    while (true) {
      RuntimeEvent event = execution.next();
      if (event.isTerminal()) {
        LOGGER.log(Level.FINE, "{0} finished: {1}", new Object[]{execution.unitName(), event});
        return event;
      }
      if (event.isSuspension()) {
        serve(execution, event);
      } else {
        deliver(execution.unitName(), event);
      }
    }
  }

  private void serve(FlowExecution execution, RuntimeEvent event) {
    Object result;
    try {
      if (event instanceof RuntimeEvent.AgentSuspension agent) {
        result = host.runAgent(agent.agent, agent.args, agent.promptInput);
        if (escalates(agent.agent, result)) {
          LOGGER.log(Level.FINE, "agent {0} escalated", agent.agent);
          execution.resumeEscalated(result);
          return;
        }
      } else if (event instanceof RuntimeEvent.FlowSuspension flow) {
        result = runNested(flow.flow, flow.args);
      } else if (event instanceof RuntimeEvent.LlmSuspension llm) {
        result = host.callLlm(llm.prompt, llm.args, llm.model);
      } else {
        RuntimeEvent.ParallelSuspension parallel = (RuntimeEvent.ParallelSuspension) event;
        result = dispatcher.dispatch(parallel.branches, this::invokeBranch);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      execution.fail(e);
      return;
    } catch (Exception e) {
      execution.fail(e);
      return;
    }
    execution.resume(result);
  }

  private Object invokeBranch(RuntimeEvent.ParallelSuspension.Branch branch) throws Exception {
    if (branch.flow) {
      return runNested(branch.name, branch.args);
    }
    return host.runAgent(branch.name, branch.args, null);
  }

  private Object runNested(String flowName, List<Object> args) {
    RuntimeEvent outcome = run(flowName, args);
    if (outcome instanceof RuntimeEvent.Aborted aborted) {
      throw new WorkflowRuntimeException("flow '" + flowName + "' aborted: " + aborted.reason);
    }
    return ((RuntimeEvent.Completed) outcome).returnValue;
  }

  private void deliver(String unit, RuntimeEvent event) {
    if (event instanceof RuntimeEvent.LogEvent log) {
      host.log(unit, log.message);
    } else if (event instanceof RuntimeEvent.NotifyEvent notify) {
      host.notify(unit, notify.message);
    } else if (event instanceof RuntimeEvent.EscalationEvent escalation) {
      host.escalate(unit, escalation.message);
    } else if (event instanceof RuntimeEvent.GuardrailEvent guardrail) {
      host.guardrail(unit, guardrail);
    } else if (event instanceof RuntimeEvent.RetryStepEvent retry) {
      host.retryStep(unit, retry.message);
    }
  }

  /**
   * agent 输出是否满足其 instruction prompt 声明的升级条件
   */
  boolean escalates(String agentName, Object output) {
    AgentSpec agent = program.agents.get(agentName);
    if (agent == null || agent.instruction == null) {
      return false;
    }
    PromptSpec prompt = program.prompts.get(agent.instruction);
    if (prompt == null || prompt.escalation == null) {
      return false;
    }
    return matches(prompt.escalation, ExpressionEvaluator.stringify(output));
  }

  static boolean matches(EscalationSpec condition, String output) {
    switch (condition.op) {
      case "~":
        return ExpressionEvaluator.normalize(output).equals(ExpressionEvaluator.normalize(condition.value));
      case "==":
        return output.equals(condition.value);
      case "!=":
        return !output.equals(condition.value);
      case "contains":
        return output.contains(condition.value);
      default:
        throw new WorkflowRuntimeException("unsupported escalation operator: " + condition.op);
    }
  }
}
