package streetrace.dsl.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import streetrace.dsl.codegen.FlowModel;
import streetrace.dsl.codegen.FlowModel.*;

/**
 * 降级表达式求值
 * <p>
 * 变量缺失求值为 null；属性访问遇到 null 继续得到 null，遇到非对象值报错。
 * {@code ~} 为规范化相等：忽略大小写、标点与多余空白。
 */
public final class ExpressionEvaluator {
  private ExpressionEvaluator() {}

  public static Object evaluate(FlowModel.Expr expr, VariableEnv env) {
    return evaluate(expr, env, null);
  }

  /**
   * @param item filter 条件中的当前元素；不在 filter 中时为 null
   */
  static Object evaluate(FlowModel.Expr expr, VariableEnv env, Object item) {
    return expr.accept(new Evaluation(env, item));
  }

  private static final class Evaluation implements ExprVisitor<Object> {
    private final VariableEnv env;
    private final Object item;

    Evaluation(VariableEnv env, Object item) {
      this.env = env;
      this.item = item;
    }

    private Object eval(FlowModel.Expr expr) {
      return expr.accept(this);
    }

    @Override
    public Object visitConst(Const c) {
      return c.value;
    }

    @Override
    public Object visitVar(Var v) {
      return env.lookup(v.name);
    }

    @Override
    public Object visitProp(Prop p) {
      return navigate(eval(p.base), p.path);
    }

    @Override
    public Object visitBinary(Binary b) {
      return binary(b, env, item);
    }

    @Override
    public Object visitUnary(Unary u) {
      Object operand = eval(u.operand);
      if ("not".equals(u.op)) {
        return !toBool(operand);
      }
      if (operand instanceof Integer i) return -i;
      if (operand instanceof Long l) return -l;
      if (operand instanceof Number n) return -n.doubleValue();
      throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator(u.op, operand, null));
    }

    @Override
    public Object visitCall(Call call) {
      Object[] args = new Object[call.args.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = eval(call.args.get(i));
      }
      return Builtins.call(call.function, args);
    }

    @Override
    public Object visitList(ListE list) {
      List<Object> out = new ArrayList<>(list.elements.size());
      for (FlowModel.Expr e : list.elements) {
        out.add(eval(e));
      }
      return out;
    }

    @Override
    public Object visitObject(ObjectE obj) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<String, FlowModel.Expr> e : obj.entries.entrySet()) {
        out.put(e.getKey(), eval(e.getValue()));
      }
      return out;
    }

    @Override
    public Object visitFilter(Filter f) {
      List<Object> out = new ArrayList<>();
      for (Object element : iterate(eval(f.source))) {
        if (toBool(evaluate(f.condition, env, element))) {
          out.add(element);
        }
      }
      return out;
    }

    @Override
    public Object visitItem(Item it) {
      return navigate(item, it.path);
    }

    @Override
    public Object visitTemplate(Template t) {
      return render(t, env);
    }
  }

  /** 插值模板渲染：洞为变量路径，可选包裹一个内置函数 */
  public static String render(Template template, VariableEnv env) {
    StringBuilder sb = new StringBuilder();
    for (TemplatePart part : template.parts) {
      if (part.isLiteral()) {
        sb.append(part.text);
        continue;
      }
      Object value = navigate(env.lookup(part.path.get(0)), part.path.subList(1, part.path.size()));
      if (part.function != null) {
        value = Builtins.call(part.function, value);
      }
      sb.append(stringify(value));
    }
    return sb.toString();
  }

  static Object navigate(Object base, List<String> path) {
    Object current = base;
    for (String key : path) {
      if (current == null) {
        return null;
      }
      if (current instanceof Map<?, ?> m) {
        current = m.get(key);
      } else {
        throw new WorkflowRuntimeException(RuntimeErrors.notAnObject(key, current));
      }
    }
    return current;
  }

  private static Object binary(Binary b, VariableEnv env, Object item) {
    switch (b.op) {
      case "and":
        return toBool(evaluate(b.left, env, item)) && toBool(evaluate(b.right, env, item));
      case "or":
        return toBool(evaluate(b.left, env, item)) || toBool(evaluate(b.right, env, item));
      default:
        break;
    }
    Object l = evaluate(b.left, env, item);
    Object r = evaluate(b.right, env, item);
    switch (b.op) {
      case "==":
        return looseEquals(l, r);
      case "!=":
        return !looseEquals(l, r);
      case "~":
        return normalize(stringify(l)).equals(normalize(stringify(r)));
      case "contains":
        return contains(l, r);
      case ">":
        return compare(b.op, l, r) > 0;
      case "<":
        return compare(b.op, l, r) < 0;
      case ">=":
        return compare(b.op, l, r) >= 0;
      case "<=":
        return compare(b.op, l, r) <= 0;
      case "+":
        return plus(l, r);
      case "-":
      case "*":
      case "/":
        return arithmetic(b.op, l, r);
      default:
        throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator(b.op, l, r));
    }
  }

  private static boolean looseEquals(Object l, Object r) {
    if (l instanceof Number a && r instanceof Number c) {
      double x = a.doubleValue();
      double y = c.doubleValue();
      // 无穷与 NaN 没有十进制表示；NaN 与任何值都不相等
      if (!Double.isFinite(x) || !Double.isFinite(y)) {
        return x == y;
      }
      return toDecimal(a).compareTo(toDecimal(c)) == 0;
    }
    return Objects.equals(l, r);
  }

  private static BigDecimal toDecimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
    return BigDecimal.valueOf(n.doubleValue());
  }

  private static boolean contains(Object container, Object needle) {
    if (container == null) return false;
    if (container instanceof String s) return s.contains(stringify(needle));
    if (container instanceof Collection<?> c) return c.contains(needle);
    if (container instanceof Map<?, ?> m) return m.containsKey(stringify(needle));
    throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator("contains", container, needle));
  }

  private static int compare(String op, Object l, Object r) {
    if (l instanceof Number a && r instanceof Number c) {
      return Double.compare(a.doubleValue(), c.doubleValue());
    }
    if (l instanceof String a && r instanceof String c) {
      return a.compareTo(c);
    }
    throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator(op, l, r));
  }

  private static Object plus(Object l, Object r) {
    if (l instanceof Number && r instanceof Number) {
      return arithmetic("+", l, r);
    }
    if (l instanceof List<?> a && r instanceof List<?> c) {
      List<Object> out = new ArrayList<>(a);
      out.addAll(c);
      return out;
    }
    if (l instanceof String || r instanceof String) {
      return stringify(l) + stringify(r);
    }
    throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator("+", l, r));
  }

  private static Object arithmetic(String op, Object l, Object r) {
    if (!(l instanceof Number a) || !(r instanceof Number c)) {
      throw new WorkflowRuntimeException(RuntimeErrors.unsupportedOperator(op, l, r));
    }
    boolean integral = isIntegral(a) && isIntegral(c);
    if (integral) {
      long x = a.longValue();
      long y = c.longValue();
      switch (op) {
        case "+": return narrow(x + y);
        case "-": return narrow(x - y);
        case "*": return narrow(x * y);
        default:
          if (y == 0) throw new WorkflowRuntimeException("division by zero");
          if (x % y == 0) return narrow(x / y);
          return (double) x / y;
      }
    }
    double x = a.doubleValue();
    double y = c.doubleValue();
    switch (op) {
      case "+": return x + y;
      case "-": return x - y;
      case "*": return x * y;
      default:
        if (y == 0.0) throw new WorkflowRuntimeException("division by zero");
        return x / y;
    }
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  private static Object narrow(long v) {
    return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? (Object) (int) v : (Object) v;
  }

  /** for 循环与 filter 可迭代的值：列表、集合、对象（按键）、字符串（按字符） */
  static List<?> iterate(Object value) {
    if (value == null) return List.of();
    if (value instanceof List<?> l) return l;
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value instanceof Map<?, ?> m) return new ArrayList<>(m.keySet());
    if (value instanceof String s) {
      List<String> chars = new ArrayList<>(s.length());
      for (int i = 0; i < s.length(); i++) chars.add(String.valueOf(s.charAt(i)));
      return chars;
    }
    throw new WorkflowRuntimeException(RuntimeErrors.notIterable(value));
  }

  public static boolean toBool(Object o) {
    if (o instanceof Boolean b) return b;
    if (o instanceof Number n) return n.doubleValue() != 0.0;
    if (o instanceof String s) {
      var ls = s.trim().toLowerCase(Locale.ROOT);
      if ("false".equals(ls)) return false;
      return !ls.isEmpty();
    }
    if (o instanceof Collection<?> c) return !c.isEmpty();
    if (o instanceof Map<?, ?> m) return !m.isEmpty();
    return o != null;
  }

  /** 文本化：null 为空串，其余沿用 toString */
  public static String stringify(Object o) {
    return o == null ? "" : String.valueOf(o);
  }

  /** 规范化文本：小写、去标点、压缩空白 */
  public static String normalize(String s) {
    return s.toLowerCase(Locale.ROOT)
        .replaceAll("[^\\p{L}\\p{N}\\s]", "")
        .replaceAll("\\s+", " ")
        .strip();
  }
}
