package streetrace.dsl.grammar;

import java.util.ArrayDeque;
import java.util.Deque;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Token;
import streetrace.dsl.errors.ErrorCode;

/**
 * 缩进感知词法分析器
 * <p>
 * 在生成的 {@link StreetraceLexer} 之上合成 INDENT / DEDENT token：
 * <ul>
 *   <li>连续的 NEWLINE（空行、仅注释行）折叠为一个，以最后一行的缩进为准</li>
 *   <li>括号 ( [ { 内部的换行被忽略，允许多行字面量</li>
 *   <li>回退到从未打开过的缩进列时抛出 {@link SyntaxError}（E0008）</li>
 *   <li>EOF 前补齐 NEWLINE 并关闭所有未闭合的缩进</li>
 * </ul>
 */
public class StreetraceIndentLexer extends StreetraceLexer {
  private static final int TAB_WIDTH = 8;

  private final Deque<Token> pending = new ArrayDeque<>();
  private final Deque<Integer> indents = new ArrayDeque<>();
  private int openBrackets = 0;
  private Token lastEmitted;
  private Token lookahead;

  public StreetraceIndentLexer(CharStream input) {
    super(input);
  }

  @Override
  public Token nextToken() {
    if (!pending.isEmpty()) {
      return remember(pending.poll());
    }
    Token t = fetch();
    switch (t.getType()) {
      case LPAREN, LBRACK, LBRACE -> openBrackets++;
      case RPAREN, RBRACK, RBRACE -> openBrackets = Math.max(0, openBrackets - 1);
      case NEWLINE -> {
        return remember(onNewline(t));
      }
      case EOF -> {
        return remember(onEof(t));
      }
      default -> { }
    }
    return remember(t);
  }

  @Override
  public void reset() {
    super.reset();
    pending.clear();
    indents.clear();
    openBrackets = 0;
    lastEmitted = null;
    lookahead = null;
  }

  private Token fetch() {
    if (lookahead != null) {
      Token t = lookahead;
      lookahead = null;
      return t;
    }
    return super.nextToken();
  }

  private Token remember(Token t) {
    lastEmitted = t;
    return t;
  }

  private Token onNewline(Token newline) {
    // 括号内换行不参与语句划分
    if (openBrackets > 0) {
      return nextToken();
    }
    Token last = newline;
    Token next = fetch();
    while (next.getType() == NEWLINE) {
      last = next;
      next = fetch();
    }
    // 文件开头的空行直接丢弃
    if (lastEmitted == null || lastEmitted.getType() == NEWLINE) {
      lookahead = next;
      return nextToken();
    }
    lookahead = next;
    if (next.getType() == EOF) {
      return newline;
    }

    int indent = indentationOf(last.getText());
    int current = currentIndent();
    if (indent > current) {
      indents.push(indent);
      pending.add(synthetic(StreetraceParser.INDENT, "<INDENT>", next));
    } else if (indent < current) {
      while (!indents.isEmpty() && indents.peek() > indent) {
        indents.pop();
        pending.add(synthetic(StreetraceParser.DEDENT, "<DEDENT>", next));
      }
      if (currentIndent() != indent) {
        throw new SyntaxError(ErrorCode.E0008, "mismatched indentation",
            next.getLine(), next.getCharPositionInLine() + 1,
            "unexpected dedent to column " + (indent + 1)
                + "; check that all lines in the block have consistent indentation");
      }
    }
    return newline;
  }

  private Token onEof(Token eof) {
    if (lastEmitted != null && lastEmitted.getType() == EOF) {
      return eof;
    }
    if (lastEmitted != null && lastEmitted.getType() != NEWLINE && lastEmitted.getType() != StreetraceParser.DEDENT) {
      pending.add(synthetic(NEWLINE, "\n", eof));
    }
    while (!indents.isEmpty()) {
      indents.pop();
      pending.add(synthetic(StreetraceParser.DEDENT, "<DEDENT>", eof));
    }
    if (pending.isEmpty()) {
      return eof;
    }
    pending.add(eof);
    return pending.poll();
  }

  private int currentIndent() {
    return indents.isEmpty() ? 0 : indents.peek();
  }

  private Token synthetic(int type, String text, Token anchor) {
    CommonToken token = new CommonToken(_tokenFactorySourcePair, type, Token.DEFAULT_CHANNEL,
        anchor.getStartIndex(), anchor.getStartIndex() - 1);
    token.setText(text);
    token.setLine(anchor.getLine());
    token.setCharPositionInLine(anchor.getCharPositionInLine());
    return token;
  }

  static int indentationOf(String newlineText) {
    int width = 0;
    for (int i = 0; i < newlineText.length(); i++) {
      char c = newlineText.charAt(i);
      if (c == '\r' || c == '\n') {
        width = 0;
      } else if (c == '\t') {
        width += TAB_WIDTH - (width % TAB_WIDTH);
      } else if (c == ' ') {
        width++;
      }
    }
    return width;
  }
}
