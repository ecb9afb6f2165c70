package streetrace.dsl.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 内置函数注册表
 * <p>
 * 供表达式中的函数调用与消息插值 {@code ${fn(path)}} 使用。
 * 带点的名称（{@code lib.fn}）按最后一段查找。
 */
public final class Builtins {

  @FunctionalInterface
  public interface BuiltinFunction {
    Object call(Object[] args) throws BuiltinException;
  }

  public static final class BuiltinException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    public BuiltinException(String message) { super(message); }
  }

  private static final Map<String, BuiltinFunction> REGISTRY = new HashMap<>();

  static {
    register("len", args -> {
      checkArity("len", args, 1);
      Object v = args[0];
      if (v == null) return 0;
      if (v instanceof String s) return s.length();
      if (v instanceof Collection<?> c) return c.size();
      if (v instanceof Map<?, ?> m) return m.size();
      throw new BuiltinException("len: unsupported value " + RuntimeErrors.describe(v));
    });

    register("str", args -> {
      checkArity("str", args, 1);
      return ExpressionEvaluator.stringify(args[0]);
    });

    register("upper", args -> {
      checkArity("upper", args, 1);
      return ExpressionEvaluator.stringify(args[0]).toUpperCase(Locale.ROOT);
    });

    register("lower", args -> {
      checkArity("lower", args, 1);
      return ExpressionEvaluator.stringify(args[0]).toLowerCase(Locale.ROOT);
    });

    register("trim", args -> {
      checkArity("trim", args, 1);
      return ExpressionEvaluator.stringify(args[0]).strip();
    });

    register("join", args -> {
      if (args.length < 1 || args.length > 2) {
        throw new BuiltinException("join: expected 1 or 2 arguments, got " + args.length);
      }
      String sep = args.length == 2 ? ExpressionEvaluator.stringify(args[1]) : ", ";
      List<String> parts = new ArrayList<>();
      for (Object item : toList("join", args[0])) {
        parts.add(ExpressionEvaluator.stringify(item));
      }
      return String.join(sep, parts);
    });

    register("keys", args -> {
      checkArity("keys", args, 1);
      if (!(args[0] instanceof Map<?, ?> m)) {
        throw new BuiltinException("keys: expected an object, got " + RuntimeErrors.describe(args[0]));
      }
      List<Object> out = new ArrayList<>();
      for (Object k : m.keySet()) out.add(String.valueOf(k));
      return out;
    });

    register("first", args -> {
      checkArity("first", args, 1);
      List<?> list = toList("first", args[0]);
      return list.isEmpty() ? null : list.get(0);
    });

    register("last", args -> {
      checkArity("last", args, 1);
      List<?> list = toList("last", args[0]);
      return list.isEmpty() ? null : list.get(list.size() - 1);
    });
  }

  private Builtins() {}

  private static void register(String name, BuiltinFunction fn) {
    REGISTRY.put(name, fn);
  }

  public static boolean has(String name) {
    return REGISTRY.containsKey(simpleName(name));
  }

  public static Set<String> names() {
    return Set.copyOf(REGISTRY.keySet());
  }

  /**
   * 调用内置函数
   *
   * @throws BuiltinException 函数不存在或参数不合法
   */
  public static Object call(String name, Object... args) {
    BuiltinFunction fn = REGISTRY.get(simpleName(name));
    if (fn == null) {
      throw new BuiltinException(RuntimeErrors.unknownFunction(name));
    }
    return fn.call(args);
  }

  private static String simpleName(String name) {
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot + 1) : name;
  }

  private static void checkArity(String name, Object[] args, int expected) {
    if (args.length != expected) {
      throw new BuiltinException(name + ": expected " + expected + " argument(s), got " + args.length);
    }
  }

  private static List<?> toList(String name, Object v) {
    if (v instanceof List<?> l) return l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    throw new BuiltinException(name + ": expected a list, got " + RuntimeErrors.describe(v));
  }
}
