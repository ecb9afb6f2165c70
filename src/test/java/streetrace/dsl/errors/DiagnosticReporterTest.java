package streetrace.dsl.errors;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * DiagnosticReporter 单元测试
 * <p>
 * 测试目标：
 * 1. 带上下文行与插入符的文本格式
 * 2. 汇总行的单复数
 * 3. 编辑器集成的 JSON 输出
 */
public class DiagnosticReporterTest {

  private static final String SOURCE = String.join("\n",
      "model main = openai/gpt-4o",
      "prompt review using model \"fast\": \"x\"",
      "agent:",
      "");

  private DiagnosticReporter reporter;
  private Diagnostic undefinedModel;
  private Diagnostic warning;

  @BeforeEach
  public void setUp() {
    reporter = new DiagnosticReporter().addSource("a.sr", SOURCE);
    undefinedModel = Diagnostic.error(ErrorCode.E0001, "undefined reference to model 'fast'",
        "a.sr", 2, 27, "defined models are: main");
    warning = Diagnostic.warning(ErrorCode.W0002, "agent 'x' has both delegate and use (unusual pattern)",
        "a.sr", 3, 1, null);
  }

  @Test
  public void testFormatWithContext() {
    String expected = String.join("\n",
        "error[E0001]: undefined reference to model 'fast'",
        "  --> a.sr:2:27",
        "     |",
        "   1 | model main = openai/gpt-4o",
        "   2 | prompt review using model \"fast\": \"x\"",
        "     | " + " ".repeat(26) + "^^^^^^",
        "   3 | agent:",
        "     |",
        "     = help: defined models are: main",
        "");
    assertEquals(expected, reporter.format(undefinedModel));
  }

  @Test
  public void testExplicitEndColumnControlsCarets() {
    Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, ErrorCode.E0001, "bad", "a.sr",
        1, 7, 1, 11, null);
    String out = reporter.format(d);
    assertTrue(out.contains("     | " + " ".repeat(6) + "^^^^\n"), "插入符宽度取自结束列");
  }

  @Test
  public void testFormatWithoutSource() {
    Diagnostic d = Diagnostic.error(ErrorCode.E0018, "internal failure", "other.sr", 4, 2, null);
    assertEquals("error[E0018]: internal failure\n  --> other.sr:4:2\n     |\n", reporter.format(d));
  }

  @Test
  public void testDiagnosticWithoutPosition() throws Exception {
    Diagnostic d = new Diagnostic(Diagnostic.Severity.ERROR, ErrorCode.E0018, "no location", "a.sr",
        null, null, null, null, null);
    assertFalse(d.hasPosition());
    assertEquals("error[E0018]: no location\n  --> a.sr\n     |\n", reporter.format(d), "位置未知时不输出行列与上下文");

    JsonNode json = new ObjectMapper().readTree(reporter.formatJson(List.of(d), "a.sr")).get("errors").get(0);
    assertFalse(json.has("line"), "未知位置不应编造为 1:1");
    assertFalse(json.has("column"));
  }

  @Test
  public void testLineOutOfRangeHasNoContext() {
    Diagnostic d = Diagnostic.error(ErrorCode.E0001, "x", "a.sr", 42, 1, null);
    assertFalse(reporter.format(d).contains("42 |"));
  }

  @Test
  public void testSummary() {
    assertEquals("no problems", DiagnosticReporter.summary(List.of()));
    assertEquals("1 error", DiagnosticReporter.summary(List.of(undefinedModel)));
    assertEquals("2 errors, 1 warning", DiagnosticReporter.summary(List.of(undefinedModel, warning, undefinedModel)));
    assertEquals("2 warnings", DiagnosticReporter.summary(List.of(warning, warning)));
  }

  @Test
  public void testFormatAllAppendsSummary() {
    String out = reporter.formatAll(List.of(undefinedModel, warning));
    assertTrue(out.startsWith("error[E0001]"));
    assertTrue(out.contains("\nwarning[W0002]: agent 'x'"));
    assertTrue(out.endsWith("\n1 error, 1 warning\n"));
    assertEquals("", reporter.formatAll(List.of()));
  }

  @Test
  public void testFormatJson() throws Exception {
    JsonNode root = new ObjectMapper().readTree(reporter.formatJson(List.of(undefinedModel, warning), "a.sr"));

    assertEquals("1.0", root.get("version").asText());
    assertEquals("a.sr", root.get("file").asText());
    assertFalse(root.get("valid").asBoolean());
    JsonNode error = root.get("errors").get(0);
    assertEquals("error", error.get("severity").asText());
    assertEquals("E0001", error.get("code").asText());
    assertEquals(2, error.get("line").asInt());
    assertEquals(27, error.get("column").asInt());
    assertEquals("defined models are: main", error.get("help").asText());
    assertFalse(error.has("end_line"), "空字段不输出");
    assertEquals(1, root.get("warnings").size());
  }

  @Test
  public void testFormatJsonValidWhenOnlyWarnings() throws Exception {
    JsonNode root = new ObjectMapper().readTree(reporter.formatJson(List.of(warning), "a.sr"));
    assertTrue(root.get("valid").asBoolean());
    assertEquals(0, root.get("errors").size());
  }
}
