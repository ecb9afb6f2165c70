package streetrace.dsl.codegen;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * schema 名 → 结构化类型 的注册表
 * <p>
 * 运行时据此校验结构化输出。字段类型为基础类型（string / int / float / bool）
 * 或另一个已注册的 schema，可包一层列表和/或可空。
 */
public final class SchemaRegistry {
  private final Map<String, StructuredType> types;

  public SchemaRegistry() {
    this.types = new LinkedHashMap<>();
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  SchemaRegistry(Map<String, StructuredType> types) {
    this.types = new LinkedHashMap<>(types);
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class FieldType {
    public String name;
    public String base;
    public boolean list;
    public boolean optional;

    public FieldType() {}

    public FieldType(String name, String base, boolean list, boolean optional) {
      this.name = name;
      this.base = base;
      this.list = list;
      this.optional = optional;
    }
  }

  public static final class StructuredType {
    public String name;
    public List<FieldType> fields = new ArrayList<>();
  }

  public void register(StructuredType type) {
    types.put(type.name, type);
  }

  public StructuredType get(String name) {
    return types.get(name);
  }

  public boolean contains(String name) {
    return types.containsKey(name);
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(types.keySet());
  }

  @JsonValue
  Map<String, StructuredType> types() {
    return Collections.unmodifiableMap(types);
  }

  /**
   * 校验一个值是否符合 schema
   *
   * @param schema schema 名
   * @param asList 是否期望该 schema 的列表
   * @param value 待校验的值（Map / List / 基础值）
   * @return 问题列表，空表示通过
   */
  public List<String> validate(String schema, boolean asList, Object value) {
    List<String> problems = new ArrayList<>();
    if (!types.containsKey(schema)) {
      problems.add("unknown schema '" + schema + "'");
      return problems;
    }
    if (asList) {
      if (!(value instanceof List<?> items)) {
        problems.add("expected a list of " + schema);
        return problems;
      }
      for (int i = 0; i < items.size(); i++) {
        checkObject(schema, items.get(i), "[" + i + "]", problems);
      }
    } else {
      checkObject(schema, value, "", problems);
    }
    return problems;
  }

  private void checkObject(String schema, Object value, String path, List<String> problems) {
    if (!(value instanceof Map<?, ?> object)) {
      problems.add(label(path) + "expected object of type " + schema);
      return;
    }
    for (FieldType field : types.get(schema).fields) {
      String fieldPath = path.isEmpty() ? field.name : path + "." + field.name;
      Object v = object.get(field.name);
      if (v == null) {
        if (!field.optional) {
          problems.add(label(fieldPath) + "missing required field");
        }
        continue;
      }
      if (field.list) {
        if (!(v instanceof List<?> items)) {
          problems.add(label(fieldPath) + "expected list");
          continue;
        }
        for (int i = 0; i < items.size(); i++) {
          checkValue(field.base, items.get(i), fieldPath + "[" + i + "]", problems);
        }
      } else {
        checkValue(field.base, v, fieldPath, problems);
      }
    }
  }

  private void checkValue(String base, Object v, String path, List<String> problems) {
    boolean ok = switch (base) {
      case "string" -> v instanceof String;
      case "int" -> v instanceof Integer || v instanceof Long;
      case "float" -> v instanceof Number;
      case "bool" -> v instanceof Boolean;
      default -> {
        if (types.containsKey(base)) {
          checkObject(base, v, path, problems);
        } else {
          problems.add(label(path) + "unknown schema '" + base + "'");
        }
        yield true;
      }
    };
    if (!ok) {
      problems.add(label(path) + "expected " + base);
    }
  }

  private static String label(String path) {
    return path.isEmpty() ? "" : path + ": ";
  }
}
