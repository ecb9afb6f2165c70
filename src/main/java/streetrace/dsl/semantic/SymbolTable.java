package streetrace.dsl.semantic;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import streetrace.dsl.ast.DslAst;
import streetrace.dsl.ast.DslAst.AgentDef;
import streetrace.dsl.ast.DslAst.FlowDef;
import streetrace.dsl.ast.DslAst.ModelDef;
import streetrace.dsl.ast.DslAst.PromptDef;
import streetrace.dsl.ast.DslAst.RetryPolicyDef;
import streetrace.dsl.ast.DslAst.SchemaDef;
import streetrace.dsl.ast.DslAst.TimeoutPolicyDef;
import streetrace.dsl.ast.DslAst.ToolDef;

/**
 * 顶层定义的符号表
 * <p>
 * 每个类别一张表，名称区分大小写且在类别内唯一。写入只发生在
 * {@link SemanticAnalyzer} 的单次分析中，之后以只读方式交给降级阶段。
 * prompt 表保存的是合并后的定义。
 */
public final class SymbolTable {
  private final Map<SymbolKind, Map<String, DslAst.Definition>> tables = new EnumMap<>(SymbolKind.class);

  SymbolTable() {
    for (SymbolKind kind : SymbolKind.values()) {
      tables.put(kind, new LinkedHashMap<>());
    }
  }

  /**
   * 登记定义；同名已存在时不覆盖。
   *
   * @return 已存在的定义，没有则为 null
   */
  DslAst.Definition putIfAbsent(SymbolKind kind, String name, DslAst.Definition def) {
    return tables.get(kind).putIfAbsent(name, def);
  }

  /** 用合并结果替换 prompt */
  void replacePrompt(String name, PromptDef merged) {
    tables.get(SymbolKind.PROMPT).put(name, merged);
  }

  public boolean contains(SymbolKind kind, String name) {
    return name != null && tables.get(kind).containsKey(name);
  }

  public Set<String> names(SymbolKind kind) {
    return Collections.unmodifiableSet(tables.get(kind).keySet());
  }

  public int size(SymbolKind kind) {
    return tables.get(kind).size();
  }

  public Map<String, ModelDef> models() { return view(SymbolKind.MODEL); }

  public Map<String, SchemaDef> schemas() { return view(SymbolKind.SCHEMA); }

  public Map<String, ToolDef> tools() { return view(SymbolKind.TOOL); }

  public Map<String, PromptDef> prompts() { return view(SymbolKind.PROMPT); }

  public Map<String, AgentDef> agents() { return view(SymbolKind.AGENT); }

  public Map<String, FlowDef> flows() { return view(SymbolKind.FLOW); }

  public Map<String, RetryPolicyDef> retryPolicies() { return view(SymbolKind.RETRY_POLICY); }

  public Map<String, TimeoutPolicyDef> timeoutPolicies() { return view(SymbolKind.TIMEOUT_POLICY); }

  /** 降级阶段所需的合并 prompt 视图 */
  public MergedPrompts mergedPrompts() {
    return new MergedPrompts(prompts());
  }

  @SuppressWarnings("unchecked")
  private <T extends DslAst.Definition> Map<String, T> view(SymbolKind kind) {
    return Collections.unmodifiableMap((Map<String, T>) (Map<String, ?>) tables.get(kind));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SymbolTable{");
    boolean first = true;
    for (Map.Entry<SymbolKind, Map<String, DslAst.Definition>> e : tables.entrySet()) {
      if (e.getValue().isEmpty()) continue;
      if (!first) sb.append(", ");
      sb.append(e.getKey().label()).append('=').append(e.getValue().keySet());
      first = false;
    }
    return sb.append('}').toString();
  }
}
