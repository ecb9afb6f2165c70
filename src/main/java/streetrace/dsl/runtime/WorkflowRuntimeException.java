package streetrace.dsl.runtime;

/**
 * 指令执行失败。位于保护区内时由 on failure 处理器接管，否则终止执行。
 */
public class WorkflowRuntimeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public WorkflowRuntimeException(String message) {
    super(message);
  }

  public WorkflowRuntimeException(String message, Throwable cause) {
    super(message, cause);
  }
}
