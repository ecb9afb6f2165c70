package streetrace.dsl.grammar;

import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.dfa.DFA;

/**
 * DSL 解析入口
 * <p>
 * 源码 → {@link StreetraceIndentLexer} → {@link StreetraceParser} → 带位置信息的解析树。
 * 每次调用创建独立的词法/语法分析器实例，不共享可变状态。
 */
public final class DslParser {
  private static final Logger LOGGER = Logger.getLogger(DslParser.class.getName());

  private DslParser() {}

  /**
   * 解析 DSL 源码
   *
   * @param source DSL 源码
   * @return 以 {@code file} 规则为根的解析树
   * @throws SyntaxError 遇到第一个词法或语法错误时抛出
   */
  public static StreetraceParser.FileContext parse(String source) {
    return parse(source, false);
  }

  /**
   * 解析 DSL 源码，可选开启歧义诊断
   *
   * @param source DSL 源码
   * @param debug 为 true 时以精确歧义检测模式运行，并在 FINE 级别记录歧义
   * @return 解析树
   * @throws SyntaxError 遇到第一个词法或语法错误时抛出
   */
  public static StreetraceParser.FileContext parse(String source, boolean debug) {
    StreetraceIndentLexer lexer = new StreetraceIndentLexer(CharStreams.fromString(source));
    lexer.removeErrorListeners();
    lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

    StreetraceParser parser = new StreetraceParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(SyntaxErrorListener.INSTANCE);
    if (debug) {
      parser.getInterpreter().setPredictionMode(PredictionMode.LL_EXACT_AMBIG_DETECTION);
      parser.addErrorListener(new AmbiguityLogger());
    }
    return parser.file();
  }

  private static final class AmbiguityLogger extends BaseErrorListener {
    @Override
    public void reportAmbiguity(Parser recognizer, DFA dfa, int startIndex, int stopIndex,
                                boolean exact, BitSet ambigAlts, ATNConfigSet configs) {
      if (LOGGER.isLoggable(Level.FINE)) {
        String rule = recognizer.getRuleNames()[dfa.atnStartState.ruleIndex];
        String text = recognizer.getTokenStream().getText(
            recognizer.getTokenStream().get(startIndex), recognizer.getTokenStream().get(stopIndex));
        LOGGER.log(Level.FINE, "ambiguity in rule {0} for ''{1}'', alternatives {2}",
            new Object[] {rule, text, ambigAlts});
      }
    }
  }
}
