package streetrace.dsl.grammar;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import streetrace.dsl.errors.ErrorCode;

/**
 * DslParser 单元测试
 *
 * 覆盖：合法源码解析、重复解析结果一致、缩进与注释处理、语法错误码与位置。
 */
public class DslParserTest {

  private static final String SAMPLE = """
      streetrace v1

      # 模型与工具
      model main = anthropic/claude-sonnet
      tool fs = builtin streetrace.fs

      schema Result:
          value: string
          tags: string[]
          score: float?

      prompt analyze expecting Result using model "main": \"""
          Analyze the input.
          \"""

      agent analyzer:
          tools fs
          instruction analyze
          produces result

      flow main $input:
          $items = [1, 2, 3]
          for $i in $items do
              log "item ${i}"
          end
          run agent analyzer with $input
          return $result

      on input do
          mask pii
      end
      """;

  @Test
  public void testParseValidSource() {
    StreetraceParser.FileContext tree = DslParser.parse(SAMPLE);
    assertNotNull(tree);
    assertNotNull(tree.versionDecl(), "应解析出版本声明");
    assertEquals(7, tree.topLevel().size(), "应解析出 7 个顶层定义");
  }

  @Test
  public void testReparseIsIdempotent() {
    String first = DslParser.parse(SAMPLE).toStringTree();
    String second = DslParser.parse(SAMPLE).toStringTree();
    assertEquals(first, second, "同一输入两次解析应得到结构相同的树");
  }

  @Test
  public void testCommentsAndBlankLinesDoNotAffectIndentation() {
    String source = """
        flow main:
            $x = 1

            # 注释行缩进不同也不影响块结构
          # 另一条注释
            $y = 2
        """;
    StreetraceParser.FileContext tree = DslParser.parse(source);
    StreetraceParser.FlowDefContext flow = tree.topLevel(0).flowDef();
    assertEquals(2, flow.block().statement().size(), "空行与注释行不应打断块");
  }

  @Test
  public void testMultiWordFlowName() {
    StreetraceParser.FileContext tree = DslParser.parse("""
        flow get agent goal:
            return 1
        """);
    assertEquals(3, tree.topLevel(0).flowDef().flowName().identifier().size());
  }

  @Test
  public void testMissingTrailingNewlineAccepted() {
    assertDoesNotThrow(() -> DslParser.parse("model m = a/b"));
  }

  @Test
  public void testMismatchedDedent() {
    String source = """
        flow main:
            $x = 1
          $y = 2
        """;
    SyntaxError error = assertThrows(SyntaxError.class, () -> DslParser.parse(source));
    assertEquals(ErrorCode.E0008, error.getCode());
    assertEquals(3, error.getLine(), "错误应定位在回退缩进的那一行");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "model = a/b\n",
      "flow main:\n    $x = = 1\n",
      "agent a:\n    instruction\n",
      "flow main:\n    $x = @\n",
  })
  public void testInvalidTokenReportsE0007(String source) {
    SyntaxError error = assertThrows(SyntaxError.class, () -> DslParser.parse(source));
    assertEquals(ErrorCode.E0007, error.getCode(), "非法 token 应报告 E0007: " + error.getMessage());
    assertTrue(error.getLine() >= 1 && error.getColumn() >= 1, "错误位置从 1 开始计数");
  }

  @Test
  public void testUnexpectedIndent() {
    String source = """
        model m = a/b
            model n = c/d
        """;
    SyntaxError error = assertThrows(SyntaxError.class, () -> DslParser.parse(source));
    assertEquals(ErrorCode.E0008, error.getCode());
  }

  @Test
  public void testIndentLexerEmitsParserIndentTokens() {
    StreetraceIndentLexer lexer = new StreetraceIndentLexer(CharStreams.fromString("flow main:\n    $x = 1\n"));
    List<Integer> types = new ArrayList<>();
    for (Token t = lexer.nextToken(); t.getType() != Token.EOF; t = lexer.nextToken()) {
      types.add(t.getType());
    }
    assertEquals(1, types.stream().filter(t -> t == StreetraceParser.INDENT).count(), "块开始应合成一个 INDENT");
    assertEquals(1, types.stream().filter(t -> t == StreetraceParser.DEDENT).count(), "EOF 前应关闭缩进");
    assertTrue(types.indexOf(StreetraceParser.INDENT) < types.indexOf(StreetraceParser.DEDENT));
  }
}
