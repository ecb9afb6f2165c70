package streetrace.dsl.semantic;

import java.util.Collection;
import java.util.Optional;

/**
 * 未定义引用的修复建议策略
 */
@FunctionalInterface
public interface SuggestionStrategy {

  /**
   * @param kind 被引用的定义类别
   * @param name 未能解析的名称
   * @param candidates 该类别下已定义的全部名称
   * @return 面向用户的建议文本；没有可建议内容时为空
   */
  Optional<String> suggest(SymbolKind kind, String name, Collection<String> candidates);
}
