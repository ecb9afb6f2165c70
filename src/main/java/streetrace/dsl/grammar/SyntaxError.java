package streetrace.dsl.grammar;

import streetrace.dsl.errors.ErrorCode;

/**
 * 语法错误：词法或语法分析阶段遇到的第一个错误。
 * <p>
 * 解析采用 fail-fast 策略，不产出部分解析树；错误位置取最早可确定的 token。
 */
public final class SyntaxError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCode code;
  private final int line;
  private final int column;
  private final String help;

  public SyntaxError(ErrorCode code, String message, int line, int column, String help) {
    super(message);
    this.code = code;
    this.line = line;
    this.column = column;
    this.help = help;
  }

  public SyntaxError(ErrorCode code, String message, int line, int column) {
    this(code, message, line, column, null);
  }

  public ErrorCode getCode() { return code; }

  /** 1 起始的行号 */
  public int getLine() { return line; }

  /** 1 起始的列号 */
  public int getColumn() { return column; }

  public String getHelp() { return help; }

  @Override
  public String toString() {
    return "SyntaxError[" + code + "] " + line + ":" + column + " " + getMessage();
  }
}
