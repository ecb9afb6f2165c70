package streetrace.dsl.ast;

import java.util.Objects;

/**
 * 源码位置，行列均从 1 开始；结束位置可缺省。
 */
public final class SourcePosition {
  public final int line;
  public final int column;
  public final Integer endLine;
  public final Integer endColumn;

  public SourcePosition(int line, int column, Integer endLine, Integer endColumn) {
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  public SourcePosition(int line, int column) {
    this(line, column, null, null);
  }

  public static SourcePosition at(int line, int column) {
    return new SourcePosition(line, column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SourcePosition that)) return false;
    return line == that.line && column == that.column
        && Objects.equals(endLine, that.endLine) && Objects.equals(endColumn, that.endColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column, endLine, endColumn);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
