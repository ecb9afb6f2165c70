package streetrace.dsl.runtime;

/**
 * 参考运行时配置
 *
 * 集中管理可调参数，在类加载时读取一次。优先读取系统属性，
 * 缺失时回退到环境变量，再回退到默认值。
 */
public final class RuntimeConfig {
  private RuntimeConfig() {}

  /**
   * 调试模式开关
   * 系统属性：streetrace.debug；环境变量：STREETRACE_DSL_DEBUG
   * 启用时记录每条指令的执行
   */
  public static final boolean DEBUG = read("streetrace.debug", "STREETRACE_DSL_DEBUG") != null;

  /**
   * 并行分派线程数
   * 系统属性：streetrace.parallel.threads；环境变量：STREETRACE_PARALLEL_THREADS
   * 默认为可用处理器数
   */
  public static final int PARALLEL_THREADS = readInt("streetrace.parallel.threads", "STREETRACE_PARALLEL_THREADS",
      Runtime.getRuntime().availableProcessors());

  /**
   * 一个 parallel 块的整体超时（秒）
   * 系统属性：streetrace.parallel.timeout.seconds
   */
  public static final long PARALLEL_TIMEOUT_SECONDS = readInt("streetrace.parallel.timeout.seconds", null, 300);

  /**
   * 无上限 loop 的安全迭代上限
   * 系统属性：streetrace.loop.max
   */
  public static final int LOOP_MAX = readInt("streetrace.loop.max", null, 10000);

  private static String read(String property, String env) {
    String value = System.getProperty(property);
    if (value == null && env != null) {
      value = System.getenv(env);
    }
    return value;
  }

  private static int readInt(String property, String env, int defaultValue) {
    String value = read(property, env);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Math.max(1, Integer.parseInt(value.trim()));
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
