package streetrace.dsl.semantic;

import java.util.Objects;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.errors.ErrorCode;

/**
 * 语义分析发现的问题。只作为值收集，不会被抛出。
 */
public final class SemanticError {
  private final ErrorCode code;
  private final String message;
  private final SourcePosition position;
  private final String suggestion;

  public SemanticError(ErrorCode code, String message, SourcePosition position, String suggestion) {
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
    this.position = position;
    this.suggestion = suggestion;
  }

  public SemanticError(ErrorCode code, String message, SourcePosition position) {
    this(code, message, position, null);
  }

  public ErrorCode code() { return code; }

  public String message() { return message; }

  /** 可能为 null */
  public SourcePosition position() { return position; }

  /** 修复建议，可能为 null */
  public String suggestion() { return suggestion; }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(code.name()).append(": ").append(message);
    if (position != null) {
      sb.append(" at ").append(position);
    }
    if (suggestion != null) {
      sb.append(" (").append(suggestion).append(')');
    }
    return sb.toString();
  }
}
