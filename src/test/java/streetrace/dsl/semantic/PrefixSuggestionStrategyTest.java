package streetrace.dsl.semantic;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * PrefixSuggestionStrategy 单元测试
 */
public class PrefixSuggestionStrategyTest {

  private final SuggestionStrategy strategy = PrefixSuggestionStrategy.INSTANCE;

  @Test
  public void testPrefixMatchIgnoresCase() {
    Optional<String> s = strategy.suggest(SymbolKind.MODEL, "GPT4", List.of("claude", "gpt-4o"));
    assertEquals(Optional.of("did you mean 'gpt-4o'?"), s);
  }

  @Test
  public void testShortNameComparedWhole() {
    assertEquals(Optional.of("did you mean 'ab'?"), strategy.suggest(SymbolKind.TOOL, "AB", List.of("ab", "abc")));
  }

  @Test
  public void testListsCandidatesWhenNoPrefixMatches() {
    Optional<String> s = strategy.suggest(SymbolKind.SCHEMA, "zzz", List.of("Review", "Issue"));
    assertEquals(Optional.of("defined schemas are: Review, Issue"), s);
  }

  @Test
  public void testNoCandidates() {
    assertTrue(strategy.suggest(SymbolKind.FLOW, "main", List.of()).isEmpty(), "没有候选时不给建议");
  }
}
