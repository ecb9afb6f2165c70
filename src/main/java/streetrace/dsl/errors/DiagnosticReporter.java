package streetrace.dsl.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * rustc 风格的诊断格式化器
 *
 * <pre>
 * error[E0001]: undefined reference to model 'fast'
 *   --> my_agent.sr:15:18
 *      |
 *   14 | prompt review
 *   15 |     using model "fast"
 *      |                  ^^^^
 *   16 | agent:
 *      |
 *      = help: defined models are: main, compact
 * </pre>
 */
public final class DiagnosticReporter {
  private static final int GUTTER_WIDTH = 5;
  private static final int CONTEXT_LINES = 1;

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private final Map<String, String> sources = new HashMap<>();

  public DiagnosticReporter addSource(String file, String source) {
    sources.put(file, source);
    return this;
  }

  public String format(Diagnostic d) {
    StringBuilder out = new StringBuilder();
    out.append(d.severity().label()).append('[').append(d.code()).append(']');
    out.append(": ").append(d.message()).append('\n');
    out.append("  --> ").append(d.file());
    if (d.hasPosition()) {
      out.append(':').append(d.line()).append(':').append(d.column());
    }
    out.append('\n');
    writeContext(out, d);
    if (d.help() != null && !d.help().isEmpty()) {
      out.append(" ".repeat(GUTTER_WIDTH)).append("= help: ").append(d.help()).append('\n');
    }
    return out.toString();
  }

  public String formatAll(List<Diagnostic> diagnostics) {
    if (diagnostics.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < diagnostics.size(); i++) {
      if (i > 0) {
        out.append('\n');
      }
      out.append(format(diagnostics.get(i)));
    }
    out.append('\n').append(summary(diagnostics)).append('\n');
    return out.toString();
  }

  /**
   * 汇总行，例如 {@code 2 errors, 1 warning}
   */
  public static String summary(List<Diagnostic> diagnostics) {
    long errors = diagnostics.stream().filter(Diagnostic::isError).count();
    long warnings = diagnostics.size() - errors;
    List<String> parts = new ArrayList<>();
    if (errors > 0) {
      parts.add(errors + (errors == 1 ? " error" : " errors"));
    }
    if (warnings > 0) {
      parts.add(warnings + (warnings == 1 ? " warning" : " warnings"));
    }
    return parts.isEmpty() ? "no problems" : String.join(", ", parts);
  }

  /**
   * 供编辑器集成使用的 JSON 输出
   */
  public String formatJson(List<Diagnostic> diagnostics, String file) {
    List<Diagnostic> errors = diagnostics.stream().filter(Diagnostic::isError).toList();
    List<Diagnostic> warnings = diagnostics.stream().filter(d -> !d.isError()).toList();
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("version", "1.0");
    result.put("file", file);
    result.put("valid", errors.isEmpty());
    result.put("errors", errors);
    result.put("warnings", warnings);
    try {
      return MAPPER.writeValueAsString(result);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize diagnostics: " + e.getMessage(), e);
    }
  }

  private void writeContext(StringBuilder out, Diagnostic d) {
    String gutter = " ".repeat(GUTTER_WIDTH) + "|";
    String source = sources.get(d.file());
    if (source == null || !d.hasPosition()) {
      out.append(gutter).append('\n');
      return;
    }
    String[] lines = source.split("\n", -1);
    int idx = d.line() - 1;
    if (idx < 0 || idx >= lines.length) {
      out.append(gutter).append('\n');
      return;
    }
    int from = Math.max(0, idx - CONTEXT_LINES);
    int to = Math.min(lines.length, idx + CONTEXT_LINES + 1);
    out.append(gutter).append('\n');
    for (int i = from; i < to; i++) {
      String text = stripCarriageReturn(lines[i]);
      out.append(String.format("%" + (GUTTER_WIDTH - 1) + "d ", i + 1)).append("| ").append(text).append('\n');
      if (i == idx) {
        writeCarets(out, d, text);
      }
    }
    out.append(gutter).append('\n');
  }

  private static void writeCarets(StringBuilder out, Diagnostic d, String line) {
    int col = Math.max(0, d.column() - 1);
    StringBuilder spacing = new StringBuilder();
    for (int i = 0; i < Math.min(col, line.length()); i++) {
      spacing.append(line.charAt(i) == '\t' ? '\t' : ' ');
    }
    int span;
    if (d.endColumn() != null && d.endLine() != null && d.endLine().equals(d.line())) {
      span = Math.max(1, d.endColumn() - d.column());
    } else {
      span = guessSpan(line, col);
    }
    out.append(" ".repeat(GUTTER_WIDTH)).append("| ").append(spacing).append("^".repeat(span)).append('\n');
  }

  private static int guessSpan(String line, int col) {
    if (col >= line.length()) {
      return 1;
    }
    char first = line.charAt(col);
    if (first == '"' || first == '\'') {
      int close = line.indexOf(first, col + 1);
      return close > col ? close - col + 1 : 1;
    }
    int end = col;
    while (end < line.length() && (Character.isLetterOrDigit(line.charAt(end))
        || line.charAt(end) == '_' || line.charAt(end) == '$' || line.charAt(end) == '.')) {
      end++;
    }
    return Math.max(1, end - col);
  }

  private static String stripCarriageReturn(String s) {
    return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
  }
}
