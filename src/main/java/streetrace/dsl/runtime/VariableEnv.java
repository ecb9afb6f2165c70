package streetrace.dsl.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次执行的变量环境
 * <p>
 * 分两部分：
 * <ul>
 *   <li>用户变量：沿外层作用域解析，赋值更新最近一个持有该名称的作用域，否则落在本层</li>
 *   <li>运行时槽位：返回值、错误消息、循环游标与计数器，只属于本层执行，从不向外层写入，也不被内层继承</li>
 * </ul>
 * 全局作用域中的 on start 处理器因此不会把自己的返回值或循环状态留给随后的 flow。
 */
public final class VariableEnv {
  private final VariableEnv outer;
  private final Map<String, Object> variables = new LinkedHashMap<>();
  private final Map<String, Object> slots = new HashMap<>();

  public VariableEnv() {
    this(null);
  }

  private VariableEnv(VariableEnv outer) {
    this.outer = outer;
  }

  /**
   * 以给定初值创建环境
   */
  public static VariableEnv of(Map<String, ?> initial) {
    VariableEnv env = new VariableEnv();
    env.variables.putAll(initial);
    return env;
  }

  /** 嵌套一层作用域，用于 flow 与非 on start 处理器 */
  public VariableEnv nested() {
    return new VariableEnv(this);
  }

  /**
   * 读取名称：本层槽位优先，其次沿作用域链查用户变量，都没有时为 null
   */
  public Object lookup(String name) {
    if (slots.containsKey(name)) {
      return slots.get(name);
    }
    VariableEnv owner = ownerOf(name);
    return owner == null ? null : owner.variables.get(name);
  }

  /** 赋值用户变量 */
  public void assign(String name, Object value) {
    VariableEnv owner = ownerOf(name);
    (owner == null ? this : owner).variables.put(name, value);
  }

  /** 在本层绑定，遮蔽外层同名变量；用于参数与处理器输入 */
  public void bind(String name, Object value) {
    variables.put(name, value);
  }

  public boolean isDefined(String name) {
    return ownerOf(name) != null;
  }

  public Object slot(String name) {
    return slots.get(name);
  }

  public void putSlot(String name, Object value) {
    slots.put(name, value);
  }

  public void clearSlot(String name) {
    slots.remove(name);
  }

  /**
   * 对宿主可见的变量快照：内层覆盖外层，不含运行时槽位
   */
  public Map<String, Object> snapshot() {
    Deque<VariableEnv> chain = new ArrayDeque<>();
    for (VariableEnv e = this; e != null; e = e.outer) {
      chain.push(e);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    for (VariableEnv e : chain) {
      out.putAll(e.variables);
    }
    return out;
  }

  private VariableEnv ownerOf(String name) {
    for (VariableEnv e = this; e != null; e = e.outer) {
      if (e.variables.containsKey(name)) {
        return e;
      }
    }
    return null;
  }
}
