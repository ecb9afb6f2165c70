package streetrace.dsl.semantic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import streetrace.dsl.ast.DslAst.EscalationCondition;
import streetrace.dsl.ast.DslAst.PromptDef;
import streetrace.dsl.errors.ErrorCode;

/**
 * 同名 prompt 合并
 * <p>
 * 按出现顺序处理：
 * <ul>
 *   <li>正文仅在新定义的正文非空时被替换，空正文的声明不会清空已有正文；</li>
 *   <li>model / expecting / inherit / escalation 各自取第一个提供者的值，
 *       之后出现不同的非空值报告 E0014；</li>
 *   <li>全部处理完后正文仍为空的 prompt 报告一次 E0013。</li>
 * </ul>
 */
final class PromptMerger {
  private final Map<String, PromptDef> merged = new LinkedHashMap<>();
  private final List<SemanticError> errors;

  PromptMerger(List<SemanticError> errors) {
    this.errors = errors;
  }

  void add(PromptDef incoming) {
    PromptDef existing = merged.get(incoming.name);
    if (existing == null) {
      merged.put(incoming.name, incoming);
      return;
    }
    String body = incoming.hasBody() ? incoming.body : existing.body;
    String model = pick("model", existing, existing.model, incoming, incoming.model);
    String expecting = pick("expecting", existing, existing.expecting, incoming, incoming.expecting);
    String inherit = pick("inherit", existing, existing.inherit, incoming, incoming.inherit);
    EscalationCondition escalation = pick("escalation condition", existing, existing.escalationCondition,
        incoming, incoming.escalationCondition);
    merged.put(incoming.name,
        new PromptDef(existing.name, body, model, expecting, inherit, escalation, existing.position));
  }

  private <T> T pick(String field, PromptDef existing, T current, PromptDef incoming, T offered) {
    if (current == null) {
      return offered;
    }
    if (offered != null && !Objects.equals(current, offered)) {
      errors.add(new SemanticError(ErrorCode.E0014,
          ErrorCode.E0014.format(Map.of(
              "field", field,
              "name", existing.name,
              "first", String.valueOf(current),
              "second", String.valueOf(offered))),
          incoming.position,
          "remove one of the conflicting '" + field + "' values"));
    }
    return current;
  }

  /**
   * 结束合并并检查缺失正文
   *
   * @return 名称 → 合并后的 prompt，保持首次出现顺序
   */
  Map<String, PromptDef> finish() {
    for (PromptDef p : merged.values()) {
      if (!p.hasBody()) {
        errors.add(new SemanticError(ErrorCode.E0013,
            ErrorCode.E0013.format(Map.of("name", p.name)),
            p.position,
            "add a body with 'prompt " + p.name + ": \"\"\"...\"\"\"'"));
      }
    }
    return merged;
  }
}
