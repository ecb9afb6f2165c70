package streetrace.dsl.errors;

import java.util.Map;

/**
 * 稳定的诊断错误码
 * <p>
 * 编号约定：E00xx 为错误，W0xxx 为警告。消息模板使用 {@code {name}} 形式的占位符，
 * 由 {@link #format(Map)} 填充；模板内容是编辑器与 CLI 依赖的对外契约，修改需谨慎。
 */
public enum ErrorCode {
  E0001("reference", "undefined reference to {kind} '{name}'"),
  E0002("reference", "variable '${name}' used before definition"),
  E0003("reference", "duplicate definition of {kind} '{name}'"),
  E0007("syntax", "invalid token or unexpected end of input"),
  E0008("syntax", "mismatched indentation"),
  E0009("semantic", "invalid guardrail action '{action}' in {context} context"),
  E0010("semantic", "missing required property '{field}' in {kind}"),
  E0011("semantic", "circular agent reference detected: {cycle}"),
  E0012("semantic", "'{statement}' is only allowed inside a loop"),
  E0013("semantic", "prompt '{name}' has no body"),
  E0014("semantic", "conflicting {field} for prompt '{name}': '{first}' vs '{second}'"),
  E0016("semantic", "instruction '{prompt}' references runtime variable '${name}'"),
  E0017("syntax", "numeric literal '{value}' is out of range"),
  E0018("lowering", "construct cannot be lowered: {detail}"),
  W0002("semantic", "agent '{name}' has both delegate and use (unusual pattern)");

  private final String category;
  private final String template;

  ErrorCode(String category, String template) {
    this.category = category;
    this.template = template;
  }

  public String category() { return category; }

  public String template() { return template; }

  public boolean isWarning() { return name().startsWith("W"); }

  /**
   * 按占位符填充消息模板；未提供的占位符保持原样。
   */
  public String format(Map<String, ?> args) {
    String out = template;
    for (Map.Entry<String, ?> e : args.entrySet()) {
      out = out.replace("{" + e.getKey() + "}", String.valueOf(e.getValue()));
    }
    return out;
  }
}
