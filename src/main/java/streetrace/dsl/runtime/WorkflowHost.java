package streetrace.dsl.runtime;

import java.util.List;

/**
 * 工作流运行时对外部世界的依赖
 * <p>
 * agent 与 LLM 调用由宿主实现；通知类回调默认忽略。
 */
public interface WorkflowHost {

  /**
   * 运行一个 agent
   *
   * @param agent agent 名
   * @param args 已求值的参数
   * @param promptInput 未传参时 agent 的默认 prompt 名，可能为 null
   * @return agent 输出
   * @throws Exception 调用失败，按 failure 块语义处理
   */
  Object runAgent(String agent, List<Object> args, String promptInput) throws Exception;

  /**
   * 直接调用 LLM
   *
   * @param prompt prompt 名
   * @param args 已求值的参数
   * @param model 覆盖的模型名，可能为 null
   */
  Object callLlm(String prompt, List<Object> args, String model) throws Exception;

  default void log(String unit, String message) {}

  default void notify(String unit, String message) {}

  default void escalate(String unit, String message) {}

  default void guardrail(String unit, RuntimeEvent.GuardrailEvent event) {}

  default void retryStep(String unit, String message) {}
}
