package streetrace.dsl.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 作用域竞技场
 * <p>
 * 一次分析的全部作用域记录保存在同一个列表中，父作用域以下标引用。
 * 查找沿父链向上直到全局作用域；分析结束时整个竞技场随之丢弃。
 * 下标 {@link #GLOBAL} 固定为全局作用域，并预置内建只读名称。
 */
public final class ScopeArena {
  public static final int GLOBAL = 0;
  static final int NO_PARENT = -1;

  public static final List<String> BUILTIN_NAMES =
      List.of("input_prompt", "conversation", "current_agent", "session_id", "turn_count");

  public enum ScopeType { GLOBAL, FLOW, HANDLER, BLOCK }

  /** 作用域内的名称绑定 */
  public static final class Symbol {
    public enum Kind { VARIABLE, PARAMETER, BUILTIN }

    public final String name;
    public final Kind kind;
    /** 引入该名称的 AST 节点，内建名称为 null */
    public final Object node;

    public Symbol(String name, Kind kind, Object node) {
      this.name = name;
      this.kind = kind;
      this.node = node;
    }

    @Override
    public String toString() {
      return name + ":" + kind;
    }
  }

  private static final class ScopeRecord {
    final ScopeType type;
    final int parent;
    final Map<String, Symbol> locals = new LinkedHashMap<>();

    ScopeRecord(ScopeType type, int parent) {
      this.type = type;
      this.parent = parent;
    }
  }

  private final List<ScopeRecord> records = new ArrayList<>();

  public ScopeArena() {
    records.add(new ScopeRecord(ScopeType.GLOBAL, NO_PARENT));
    for (String name : BUILTIN_NAMES) {
      define(GLOBAL, name, Symbol.Kind.BUILTIN, null);
    }
  }

  /**
   * 新建子作用域
   *
   * @return 新作用域的下标
   */
  public int open(ScopeType type, int parent) {
    if (parent < 0 || parent >= records.size()) {
      throw new IllegalArgumentException("unknown parent scope: " + parent);
    }
    records.add(new ScopeRecord(type, parent));
    return records.size() - 1;
  }

  public void define(int scope, String name, Symbol.Kind kind, Object node) {
    records.get(scope).locals.put(name, new Symbol(name, kind, node));
  }

  public Optional<Symbol> lookup(int scope, String name) {
    int current = scope;
    while (current != NO_PARENT) {
      ScopeRecord record = records.get(current);
      Symbol symbol = record.locals.get(name);
      if (symbol != null) {
        return Optional.of(symbol);
      }
      current = record.parent;
    }
    return Optional.empty();
  }

  public boolean isDefinedLocally(int scope, String name) {
    return records.get(scope).locals.containsKey(name);
  }

  public ScopeType typeOf(int scope) {
    return records.get(scope).type;
  }

  public int parentOf(int scope) {
    return records.get(scope).parent;
  }

  public Map<String, Symbol> locals(int scope) {
    return Collections.unmodifiableMap(records.get(scope).locals);
  }

  public int size() {
    return records.size();
  }
}
