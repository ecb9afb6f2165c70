package streetrace.dsl.runtime;

/**
 * 运行时错误消息统一生成工具。
 *
 * <p>消息主体为英文，附带恢复提示，便于宿主直接展示给工作流作者。</p>
 */
public final class RuntimeErrors {

  private RuntimeErrors() {
  }

  /**
   * 为消息附加恢复提示。
   */
  public static String withHint(String message, String hint) {
    return message + "\nHint: " + hint;
  }

  public static String unknownFunction(String name) {
    return withHint("unknown function: " + name, "use one of the builtin functions such as len, str, upper, lower, join");
  }

  public static String notIterable(Object value) {
    return withHint("value is not iterable: " + describe(value), "iterate over a list, an object or a string");
  }

  public static String notAnObject(String property, Object value) {
    return withHint("cannot read property '" + property + "' of " + describe(value),
        "make sure the variable holds an object before accessing its fields");
  }

  public static String unsupportedOperator(String op, Object left, Object right) {
    return withHint("operator '" + op + "' is not supported for " + describe(left) + " and " + describe(right),
        "convert the operands to numbers or strings first");
  }

  public static String loopLimitExceeded(int limit) {
    return withHint("loop exceeded the safety limit of " + limit + " iterations",
        "add 'max N' to the loop or raise streetrace.loop.max");
  }

  public static String unknownFlow(String name) {
    return withHint("unknown flow: " + name, "check the flow name passed to the runner");
  }

  public static String notSuspended(String state) {
    return withHint("execution is not waiting for a result (state: " + state + ")",
        "call resume only after next() returned a suspension event");
  }

  public static String parallelTimeout(long seconds) {
    return withHint("parallel block timed out after " + seconds + "s",
        "raise streetrace.parallel.timeout.seconds or reduce the work per branch");
  }

  public static String pushTargetNotList(String name, Object value) {
    return withHint("cannot push to '" + name + "': " + describe(value) + " is not a list",
        "initialise it with '$" + name + " = []' first");
  }

  static String describe(Object value) {
    if (value == null) return "null";
    return value.getClass().getSimpleName() + "(" + value + ")";
  }
}
