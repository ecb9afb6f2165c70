package streetrace.dsl.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import streetrace.dsl.ast.DslAst.PromptDef;

/**
 * 合并后的 prompt 视图
 * <p>
 * 只能从 {@link SymbolTable#mergedPrompts()} 获得。降级阶段以此为必需参数，
 * 避免误用 AST 中未合并的 prompt 定义而丢失分散声明的修饰符。
 */
public final class MergedPrompts {
  private final Map<String, PromptDef> prompts;

  MergedPrompts(Map<String, PromptDef> prompts) {
    this.prompts = Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
  }

  public PromptDef get(String name) {
    return prompts.get(name);
  }

  public boolean contains(String name) {
    return prompts.containsKey(name);
  }

  public Set<String> names() {
    return prompts.keySet();
  }

  public Map<String, PromptDef> asMap() {
    return prompts;
  }

  public int size() {
    return prompts.size();
  }
}
