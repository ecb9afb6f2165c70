package streetrace.dsl.errors;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * 带源码位置的诊断信息（错误或警告）
 * <p>
 * 行号与列号均从 1 开始；位置未知时两者为 null，JSON 中省略。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagnostic {

  public enum Severity {
    ERROR("error"),
    WARNING("warning");

    private final String label;

    Severity(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }
  }

  private final Severity severity;
  private final ErrorCode code;
  private final String message;
  private final String file;
  private final Integer line;
  private final Integer column;
  private final Integer endLine;
  private final Integer endColumn;
  private final String help;

  public Diagnostic(Severity severity, ErrorCode code, String message, String file,
                    Integer line, Integer column, Integer endLine, Integer endColumn, String help) {
    this.severity = Objects.requireNonNull(severity, "severity");
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
    this.file = file;
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.help = help;
  }

  public static Diagnostic error(ErrorCode code, String message, String file, int line, int column, String help) {
    return new Diagnostic(Severity.ERROR, code, message, file, line, column, null, null, help);
  }

  public static Diagnostic warning(ErrorCode code, String message, String file, int line, int column, String help) {
    return new Diagnostic(Severity.WARNING, code, message, file, line, column, null, null, help);
  }

  @JsonProperty("severity")
  public Severity severity() { return severity; }

  @JsonProperty("code")
  public ErrorCode code() { return code; }

  @JsonProperty("message")
  public String message() { return message; }

  @JsonProperty("file")
  public String file() { return file; }

  @JsonProperty("line")
  public Integer line() { return line; }

  @JsonProperty("column")
  public Integer column() { return column; }

  @JsonProperty("end_line")
  public Integer endLine() { return endLine; }

  @JsonProperty("end_column")
  public Integer endColumn() { return endColumn; }

  @JsonProperty("help")
  public String help() { return help; }

  @JsonIgnore
  public boolean isError() { return severity == Severity.ERROR; }

  @JsonIgnore
  public boolean hasPosition() { return line != null && column != null; }

  @Override
  public String toString() {
    String where = hasPosition() ? file + ":" + line + ":" + column : file;
    return severity.label() + "[" + code + "]: " + message + " (" + where + ")";
  }
}
