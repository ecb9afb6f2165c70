package streetrace.dsl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import streetrace.dsl.ast.AstBuilder;
import streetrace.dsl.ast.DslAst.AgentDef;
import streetrace.dsl.ast.DslAst.Definition;
import streetrace.dsl.ast.DslAst.DslFile;
import streetrace.dsl.ast.DslAst.EventHandler;
import streetrace.dsl.ast.DslAst.FlowDef;
import streetrace.dsl.ast.DslAst.ModelDef;
import streetrace.dsl.ast.DslAst.PromptDef;
import streetrace.dsl.ast.DslAst.ToolDef;
import streetrace.dsl.ast.SourcePosition;
import streetrace.dsl.codegen.CodeGenerator;
import streetrace.dsl.codegen.FlowModel.WorkflowProgram;
import streetrace.dsl.codegen.GenerationResult;
import streetrace.dsl.codegen.LoweringError;
import streetrace.dsl.errors.Diagnostic;
import streetrace.dsl.errors.DiagnosticReporter;
import streetrace.dsl.grammar.DslParser;
import streetrace.dsl.grammar.SyntaxError;
import streetrace.dsl.semantic.AnalysisResult;
import streetrace.dsl.semantic.SemanticAnalyzer;
import streetrace.dsl.semantic.SemanticError;
import streetrace.dsl.semantic.SymbolTable;
import streetrace.dsl.sourcemap.SourceMapRegistry;

/**
 * Streetrace DSL 编译器入口
 * <p>
 * 编译管道：
 * <pre>
 * 源码 → normalizeSource → DslParser（解析树） → AstBuilder（AST）
 *      → SemanticAnalyzer（符号表 + 诊断） → CodeGenerator（可执行表示 + 源码映射）
 * </pre>
 * 任一阶段失败即中止，不向后续阶段传递带未解决错误的中间结果。
 * 每次编译使用全新的分析器、作用域与符号表，不存在跨调用缓存。
 */
public final class DslCompiler {

  private static final Logger LOGGER = Logger.getLogger(DslCompiler.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT)
      .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private DslCompiler() {
    // 工具类，禁止实例化
  }

  /**
   * 编译选项
   */
  public static final class CompileOptions {
    private final String sourceName;
    private final boolean debugParser;

    public CompileOptions(String sourceName, boolean debugParser) {
      this.sourceName = sourceName != null ? sourceName : "<input>";
      this.debugParser = debugParser;
    }

    public static CompileOptions named(String sourceName) {
      return new CompileOptions(sourceName, false);
    }

    public String sourceName() { return sourceName; }

    /** 为 true 时解析器以精确歧义检测模式运行并记录歧义 */
    public boolean debugParser() { return debugParser; }
  }

  /**
   * 编译产物
   */
  public static final class CompiledWorkflow {
    private final WorkflowProgram program;
    private final SourceMapRegistry sourceMap;
    private final SymbolTable symbols;
    private final List<Diagnostic> warnings;

    CompiledWorkflow(WorkflowProgram program, SourceMapRegistry sourceMap, SymbolTable symbols,
                     List<Diagnostic> warnings) {
      this.program = program;
      this.sourceMap = sourceMap;
      this.symbols = symbols;
      this.warnings = Collections.unmodifiableList(warnings);
    }

    public WorkflowProgram program() { return program; }

    public SourceMapRegistry sourceMap() { return sourceMap; }

    public SymbolTable symbols() { return symbols; }

    public List<Diagnostic> warnings() { return warnings; }
  }

  /**
   * 源文件的定义计数
   */
  public static final class FileStats {
    public final int models;
    public final int tools;
    public final int prompts;
    public final int agents;
    public final int flows;
    public final int handlers;

    public FileStats(int models, int tools, int prompts, int agents, int flows, int handlers) {
      this.models = models;
      this.tools = tools;
      this.prompts = prompts;
      this.agents = agents;
      this.flows = flows;
      this.handlers = handlers;
    }

    static FileStats empty() {
      return new FileStats(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String toString() {
      return "FileStats{models=" + models + ", tools=" + tools + ", prompts=" + prompts
          + ", agents=" + agents + ", flows=" + flows + ", handlers=" + handlers + "}";
    }
  }

  /**
   * 编译失败异常，携带失败阶段与完整诊断列表
   */
  public static final class CompilationException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Stage { PARSE, SEMANTIC, LOWERING }

    private final Stage stage;
    private final transient List<Diagnostic> diagnostics;

    public CompilationException(Stage stage, List<Diagnostic> diagnostics) {
      super(stage + " failed: " + DiagnosticReporter.summary(diagnostics)
          + (diagnostics.isEmpty() ? "" : "\n" + diagnostics.get(0)));
      this.stage = stage;
      this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Stage getStage() { return stage; }

    public List<Diagnostic> getDiagnostics() { return diagnostics; }
  }

  /**
   * 规范化源码：缺少结尾换行时补上
   */
  public static String normalizeSource(String source) {
    if (source.isEmpty() || source.endsWith("\n")) {
      return source;
    }
    return source + "\n";
  }

  /**
   * 解析源码为 AST
   *
   * @throws SyntaxError 遇到第一个语法错误时抛出
   */
  public static DslFile parse(String source) {
    return parse(source, false);
  }

  public static DslFile parse(String source, boolean debugParser) {
    return AstBuilder.build(DslParser.parse(normalizeSource(source), debugParser));
  }

  /**
   * 编译源码
   *
   * @param source DSL 源码
   * @param sourceName 源码标识，用于诊断与源码映射
   * @return 可执行表示、源码映射与符号表
   * @throws CompilationException 任一阶段失败
   */
  public static CompiledWorkflow compile(String source, String sourceName) throws CompilationException {
    return compile(source, CompileOptions.named(sourceName));
  }

  public static CompiledWorkflow compile(String source, CompileOptions options) throws CompilationException {
    String name = options.sourceName();
    LOGGER.log(Level.FINE, "compiling {0}", name);

    DslFile ast;
    try {
      ast = parse(source, options.debugParser());
    } catch (SyntaxError e) {
      throw new CompilationException(CompilationException.Stage.PARSE, List.of(toDiagnostic(e, name)));
    }

    AnalysisResult analysis = new SemanticAnalyzer().analyze(ast);
    List<Diagnostic> warnings = toDiagnostics(analysis.warnings(), name);
    if (!analysis.isValid()) {
      List<Diagnostic> diagnostics = toDiagnostics(analysis.errors(), name);
      diagnostics.addAll(warnings);
      throw new CompilationException(CompilationException.Stage.SEMANTIC, diagnostics);
    }

    GenerationResult generated;
    try {
      generated = new CodeGenerator().generate(ast, name, analysis.symbols().mergedPrompts());
    } catch (LoweringError e) {
      throw new CompilationException(CompilationException.Stage.LOWERING, List.of(toDiagnostic(e, name)));
    }
    LOGGER.log(Level.FINE, "compiled {0}: {1} flows, {2} handlers",
        new Object[]{name, generated.program().flows.size(), generated.program().handlers.size()});
    return new CompiledWorkflow(generated.program(), generated.sourceMap(), analysis.symbols(), warnings);
  }

  /**
   * 校验源码，收集语法错误、语义错误、警告与降级错误；从不抛出
   */
  public static List<Diagnostic> validate(String source, String sourceName) {
    String name = sourceName != null ? sourceName : "<input>";
    List<Diagnostic> diagnostics = new ArrayList<>();
    DslFile ast;
    try {
      ast = parse(source);
    } catch (SyntaxError e) {
      diagnostics.add(toDiagnostic(e, name));
      return diagnostics;
    }

    AnalysisResult analysis = new SemanticAnalyzer().analyze(ast);
    diagnostics.addAll(toDiagnostics(analysis.errors(), name));
    diagnostics.addAll(toDiagnostics(analysis.warnings(), name));
    if (!analysis.isValid()) {
      return diagnostics;
    }
    try {
      new CodeGenerator().generate(ast, name, analysis.symbols().mergedPrompts());
    } catch (LoweringError e) {
      diagnostics.add(toDiagnostic(e, name));
    }
    return diagnostics;
  }

  /**
   * 统计源码中的定义数量；无法解析时返回全零
   */
  public static FileStats fileStats(String source) {
    DslFile ast;
    try {
      ast = parse(source);
    } catch (SyntaxError e) {
      LOGGER.log(Level.FINE, "stats unavailable: {0}", e.getMessage());
      return FileStats.empty();
    }
    int models = 0;
    int tools = 0;
    int prompts = 0;
    int agents = 0;
    int flows = 0;
    int handlers = 0;
    for (Definition d : ast.definitions) {
      if (d instanceof ModelDef) models++;
      else if (d instanceof ToolDef) tools++;
      else if (d instanceof PromptDef) prompts++;
      else if (d instanceof AgentDef) agents++;
      else if (d instanceof FlowDef) flows++;
      else if (d instanceof EventHandler) handlers++;
    }
    return new FileStats(models, tools, prompts, agents, flows, handlers);
  }

  /**
   * 将可执行表示序列化为 JSON
   */
  public static String toJson(WorkflowProgram program) {
    try {
      return MAPPER.writeValueAsString(program);
    } catch (IOException e) {
      throw new UncheckedIOException("JSON 序列化失败: " + e.getMessage(), e);
    }
  }

  /**
   * 从 JSON 读回可执行表示
   *
   * @throws IOException JSON 格式错误或结构不符
   */
  public static WorkflowProgram fromJson(String json) throws IOException {
    return MAPPER.readValue(json, WorkflowProgram.class);
  }

  static Diagnostic toDiagnostic(SyntaxError e, String file) {
    return Diagnostic.error(e.getCode(), e.getMessage(), file, e.getLine(), e.getColumn(), e.getHelp());
  }

  static Diagnostic toDiagnostic(LoweringError e, String file) {
    SourcePosition pos = e.getPosition();
    return new Diagnostic(Diagnostic.Severity.ERROR, e.getCode(), e.getMessage(), file,
        pos != null ? pos.line : null, pos != null ? pos.column : null, null, null, null);
  }

  static List<Diagnostic> toDiagnostics(List<SemanticError> errors, String file) {
    List<Diagnostic> out = new ArrayList<>(errors.size());
    for (SemanticError e : errors) {
      SourcePosition pos = e.position();
      Integer line = pos != null ? pos.line : null;
      Integer column = pos != null ? pos.column : null;
      Integer endLine = pos != null ? pos.endLine : null;
      Integer endColumn = pos != null ? pos.endColumn : null;
      Diagnostic.Severity severity = e.code().isWarning() ? Diagnostic.Severity.WARNING : Diagnostic.Severity.ERROR;
      out.add(new Diagnostic(severity, e.code(), e.message(), file, line, column, endLine, endColumn, e.suggestion()));
    }
    return out;
  }
}
