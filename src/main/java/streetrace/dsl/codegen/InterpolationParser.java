package streetrace.dsl.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.codegen.FlowModel.TemplatePart;

/**
 * 消息文本中的 {@code ${...}} 插值
 * <p>
 * 洞内只接受两种形式：点分变量路径（{@code a.b.c}，可带 {@code $} 前缀），
 * 或包裹一个此类路径的单个函数调用（{@code fn(a.b)}）。其他表达式报告降级错误。
 */
public final class InterpolationParser {
  private static final String PATH = "\\$?[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*";
  private static final Pattern PATH_ONLY = Pattern.compile(PATH);
  private static final Pattern FUNCTION_CALL =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\(\\s*(" + PATH + ")\\s*\\)");

  private InterpolationParser() {}

  public static boolean hasInterpolation(String text) {
    return text.contains("${");
  }

  /**
   * 拆分为字面文本与插值洞
   *
   * @throws LoweringError 洞未闭合或包含不支持的表达式
   */
  public static List<TemplatePart> parse(String text, SourcePosition position) {
    List<TemplatePart> parts = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      int open = text.indexOf("${", i);
      if (open < 0) {
        parts.add(TemplatePart.literal(text.substring(i)));
        break;
      }
      if (open > i) {
        parts.add(TemplatePart.literal(text.substring(i, open)));
      }
      int close = text.indexOf('}', open + 2);
      if (close < 0) {
        throw new LoweringError("unterminated interpolation in '" + text + "'", position);
      }
      parts.add(hole(text.substring(open + 2, close).strip(), position));
      i = close + 1;
    }
    return parts;
  }

  private static TemplatePart hole(String content, SourcePosition position) {
    if (PATH_ONLY.matcher(content).matches()) {
      return TemplatePart.hole(path(content), null);
    }
    Matcher call = FUNCTION_CALL.matcher(content);
    if (call.matches()) {
      return TemplatePart.hole(path(call.group(2)), call.group(1));
    }
    throw new LoweringError("unsupported interpolation '${" + content
        + "}': only variable paths and single function calls are allowed", position);
  }

  private static List<String> path(String dotted) {
    String bare = dotted.startsWith("$") ? dotted.substring(1) : dotted;
    return new ArrayList<>(Arrays.asList(bare.split("\\.")));
  }
}
