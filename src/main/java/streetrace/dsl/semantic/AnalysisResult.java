package streetrace.dsl.semantic;

import java.util.List;

/**
 * 语义分析结果：全部错误与警告一次性返回；警告不影响有效性。
 */
public final class AnalysisResult {
  private final List<SemanticError> errors;
  private final List<SemanticError> warnings;
  private final SymbolTable symbols;

  AnalysisResult(List<SemanticError> errors, List<SemanticError> warnings, SymbolTable symbols) {
    this.errors = List.copyOf(errors);
    this.warnings = List.copyOf(warnings);
    this.symbols = symbols;
  }

  public boolean isValid() {
    return errors.isEmpty();
  }

  public List<SemanticError> errors() { return errors; }

  public List<SemanticError> warnings() { return warnings; }

  public SymbolTable symbols() { return symbols; }

  @Override
  public String toString() {
    return "AnalysisResult{valid=" + isValid() + ", errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
  }
}
