package streetrace.dsl.semantic;

/**
 * 符号表中的定义类别，{@link #label()} 用于诊断消息。
 */
public enum SymbolKind {
  MODEL("model"),
  SCHEMA("schema"),
  TOOL("tool"),
  PROMPT("prompt"),
  AGENT("agent"),
  FLOW("flow"),
  RETRY_POLICY("retry policy"),
  TIMEOUT_POLICY("timeout policy");

  private final String label;

  SymbolKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
