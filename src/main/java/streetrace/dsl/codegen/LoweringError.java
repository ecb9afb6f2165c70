package streetrace.dsl.codegen;

import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.errors.ErrorCode;

/**
 * 降级阶段发现的结构性错误，遇到即中止。
 */
public final class LoweringError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient SourcePosition position;

  public LoweringError(String message, SourcePosition position) {
    super(message);
    this.position = position;
  }

  /** 可能为 null */
  public SourcePosition getPosition() {
    return position;
  }

  public ErrorCode getCode() {
    return ErrorCode.E0018;
  }
}
