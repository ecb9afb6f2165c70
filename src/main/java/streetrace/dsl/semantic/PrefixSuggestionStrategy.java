package streetrace.dsl.semantic;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * 默认建议策略：按前三个字符（忽略大小写）匹配候选名；
 * 无匹配时列出该类别下的全部已定义名称。
 */
public final class PrefixSuggestionStrategy implements SuggestionStrategy {
  public static final PrefixSuggestionStrategy INSTANCE = new PrefixSuggestionStrategy();

  private static final int PREFIX_LENGTH = 3;

  @Override
  public Optional<String> suggest(SymbolKind kind, String name, Collection<String> candidates) {
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    String prefix = prefixOf(name);
    for (String candidate : candidates) {
      if (prefixOf(candidate).equals(prefix)) {
        return Optional.of("did you mean '" + candidate + "'?");
      }
    }
    return Optional.of("defined " + kind.label() + "s are: " + String.join(", ", candidates));
  }

  private static String prefixOf(String s) {
    String lower = s.toLowerCase(Locale.ROOT);
    return lower.length() <= PREFIX_LENGTH ? lower : lower.substring(0, PREFIX_LENGTH);
  }
}
