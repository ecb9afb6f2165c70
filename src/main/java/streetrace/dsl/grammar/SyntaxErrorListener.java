package streetrace.dsl.grammar;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import streetrace.dsl.errors.ErrorCode;

/**
 * 将 ANTLR 报告的第一个错误转换为 {@link SyntaxError} 并立即抛出。
 * <p>
 * 词法与语法分析器共用同一个实例，默认的控制台监听器需事先移除。
 */
final class SyntaxErrorListener extends BaseErrorListener {
  static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

  private SyntaxErrorListener() {}

  @Override
  public void syntaxError(Recognizer<?, ?> recognizer,
                          Object offendingSymbol,
                          int line, int charPositionInLine,
                          String msg,
                          RecognitionException e) {
    int column = charPositionInLine + 1;
    if (recognizer instanceof Lexer) {
      throw new SyntaxError(ErrorCode.E0007, "invalid character", line, column,
          msg.replace("token recognition error at: ", "unexpected character "));
    }
    if (offendingSymbol instanceof Token token) {
      switch (token.getType()) {
        case Token.EOF -> throw new SyntaxError(ErrorCode.E0007, "unexpected end of input", line, column, msg);
        case StreetraceParser.INDENT -> throw new SyntaxError(ErrorCode.E0008, "unexpected indent", line, column,
            "remove the extra indentation or add a block header ending in ':' or 'do'");
        case StreetraceParser.DEDENT -> throw new SyntaxError(ErrorCode.E0008, "unexpected dedent", line, column, msg);
        default -> throw new SyntaxError(ErrorCode.E0007,
            "unexpected token '" + displayText(token) + "'", line, column, msg);
      }
    }
    throw new SyntaxError(ErrorCode.E0007, msg, line, column);
  }

  private static String displayText(Token token) {
    String text = token.getText();
    if (text == null) {
      return "<" + token.getType() + ">";
    }
    if (token.getType() == StreetraceParser.NEWLINE) {
      return "\\n";
    }
    return text;
  }
}
