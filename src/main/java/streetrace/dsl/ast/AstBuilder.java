package streetrace.dsl.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import streetrace.dsl.ast.DslAst.*;
import streetrace.dsl.errors.ErrorCode;
import streetrace.dsl.grammar.StreetraceBaseVisitor;
import streetrace.dsl.grammar.StreetraceParser;
import streetrace.dsl.grammar.SyntaxError;

/**
 * 解析树 → AST
 * <p>
 * 纯结构转换：每个语法产生式对应一种 AST 节点，保留起始位置；
 * 不做任何引用或重复检查，这些由语义分析负责。
 */
public final class AstBuilder extends StreetraceBaseVisitor<Object> {
  private static final Logger LOGGER = Logger.getLogger(AstBuilder.class.getName());

  /** 解析树构建 AST 的入口 */
  public static DslFile build(StreetraceParser.FileContext ctx) {
    return new AstBuilder().visitFile(ctx);
  }

  @Override
  public DslFile visitFile(StreetraceParser.FileContext ctx) {
    VersionDecl version = null;
    if (ctx.versionDecl() != null) {
      version = new VersionDecl(ctx.versionDecl().identifier().getText(), pos(ctx.versionDecl()));
    }
    List<Definition> defs = new ArrayList<>();
    for (StreetraceParser.TopLevelContext top : ctx.topLevel()) {
      defs.add((Definition) visit(top.getChild(0)));
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "AST built: {0} top-level definitions", defs.size());
    }
    return new DslFile(version, defs, SourcePosition.at(1, 1));
  }

  // ============================================================
  // 导入
  // ============================================================

  @Override
  public ImportDef visitStreetraceImport(StreetraceParser.StreetraceImportContext ctx) {
    return new ImportDef(ctx.identifier().getText(), "streetrace", ImportKind.STREETRACE, pos(ctx));
  }

  @Override
  public ImportDef visitLocalImport(StreetraceParser.LocalImportContext ctx) {
    String path = ctx.LOCAL_PATH().getText();
    String file = path.substring(path.lastIndexOf('/') + 1);
    int dot = file.lastIndexOf('.');
    String name = dot > 0 ? file.substring(0, dot) : file;
    return new ImportDef(name, path, ImportKind.LOCAL, pos(ctx));
  }

  @Override
  public ImportDef visitPipImport(StreetraceParser.PipImportContext ctx) {
    return new ImportDef(ctx.identifier().getText(), unquote(ctx.STRING().getText()), ImportKind.PIP, pos(ctx));
  }

  @Override
  public ImportDef visitMcpImport(StreetraceParser.McpImportContext ctx) {
    return new ImportDef(ctx.identifier().getText(), unquote(ctx.STRING().getText()), ImportKind.MCP, pos(ctx));
  }

  // ============================================================
  // 模型 / 工具 / schema
  // ============================================================

  @Override
  public ModelDef visitModelShort(StreetraceParser.ModelShortContext ctx) {
    StreetraceParser.ModelSpecContext spec = ctx.modelSpec();
    String providerModel = spec.STRING() != null ? unquote(spec.STRING().getText()) : spec.getText();
    return new ModelDef(ctx.identifier().getText(), providerModel, null, pos(ctx));
  }

  @Override
  public ModelDef visitModelLong(StreetraceParser.ModelLongContext ctx) {
    Map<String, Object> props = new LinkedHashMap<>();
    for (StreetraceParser.PropertyLineContext line : ctx.propertyLine()) {
      props.put(line.identifier().getText(), propertyValue(line.propertyValue()));
    }
    Object provider = props.get("provider");
    Object model = props.get("name");
    String providerModel = null;
    if (provider != null && model != null) {
      providerModel = provider + "/" + model;
    } else if (model != null) {
      providerModel = String.valueOf(model);
    }
    return new ModelDef(ctx.identifier().getText(), providerModel, props, pos(ctx));
  }

  @Override
  public ToolDef visitMcpTool(StreetraceParser.McpToolContext ctx) {
    String authType = null;
    String authValue = null;
    if (ctx.toolAuth() != null) {
      authType = ctx.toolAuth().kind.getText();
      authValue = unquote(ctx.toolAuth().STRING().getText());
    }
    return new ToolDef(ctx.identifier().getText(), ToolKind.MCP, unquote(ctx.STRING().getText()),
        authType, authValue, null, null, null, pos(ctx));
  }

  @Override
  public ToolDef visitBuiltinTool(StreetraceParser.BuiltinToolContext ctx) {
    return new ToolDef(ctx.identifier().getText(), ToolKind.BUILTIN, null, null, null,
        ctx.dottedName().getText(), null, null, pos(ctx));
  }

  @Override
  public ToolDef visitLongTool(StreetraceParser.LongToolContext ctx) {
    Map<String, Object> props = new LinkedHashMap<>();
    Map<String, String> headers = new LinkedHashMap<>();
    for (StreetraceParser.ToolPropertyContext p : ctx.toolProperty()) {
      if (p instanceof StreetraceParser.ToolHeadersContext h) {
        for (StreetraceParser.HeaderLineContext line : h.headerLine()) {
          StreetraceParser.HeaderKeyContext key = line.headerKey();
          String k = key.STRING() != null ? unquote(key.STRING().getText()) : key.getText();
          headers.put(k, unquote(line.STRING().getText()));
        }
      } else if (p instanceof StreetraceParser.ToolFieldContext f) {
        props.put(f.identifier().getText(), propertyValue(f.propertyValue()));
      }
    }
    ToolKind kind = null;
    Object type = props.remove("type");
    if (type != null) {
      String t = String.valueOf(type).toLowerCase();
      if (t.equals("mcp")) kind = ToolKind.MCP;
      else if (t.equals("builtin")) kind = ToolKind.BUILTIN;
    }
    Object url = props.remove("url");
    Object ref = props.remove("ref");
    return new ToolDef(ctx.identifier().getText(), kind,
        url == null ? null : String.valueOf(url), null, null,
        ref == null ? null : String.valueOf(ref), headers, props, pos(ctx));
  }

  @Override
  public SchemaDef visitSchemaDef(StreetraceParser.SchemaDefContext ctx) {
    List<SchemaField> fields = new ArrayList<>();
    for (StreetraceParser.SchemaFieldContext f : ctx.schemaField()) {
      fields.add(new SchemaField(f.identifier().getText(), typeExpr(f.typeExpr()), pos(f)));
    }
    return new SchemaDef(ctx.identifier().getText(), fields, pos(ctx));
  }

  private TypeExpr typeExpr(StreetraceParser.TypeExprContext ctx) {
    if (ctx instanceof StreetraceParser.GenericListTypeContext g) {
      return new TypeExpr(g.identifier().getText(), true, g.QUESTION() != null);
    }
    StreetraceParser.NamedTypeContext n = (StreetraceParser.NamedTypeContext) ctx;
    return new TypeExpr(n.identifier().getText(), n.LBRACK() != null, n.QUESTION() != null);
  }

  // ============================================================
  // prompt
  // ============================================================

  @Override
  public PromptDef visitPromptDef(StreetraceParser.PromptDefContext ctx) {
    String model = null;
    String expecting = null;
    String inherit = null;
    for (StreetraceParser.PromptModifierContext m : ctx.promptModifier()) {
      if (m instanceof StreetraceParser.UsingModelContext u) {
        model = u.STRING() != null ? unquote(u.STRING().getText()) : u.identifier().getText();
      } else if (m instanceof StreetraceParser.ExpectingContext e) {
        expecting = e.identifier().getText() + (e.LBRACK() != null ? "[]" : "");
      } else if (m instanceof StreetraceParser.InheritContext i) {
        inherit = i.variableName().getText();
      }
    }

    String body = "";
    StreetraceParser.PromptBodyContext bodyCtx = ctx.getRuleContext(StreetraceParser.PromptBodyContext.class, 0);
    if (bodyCtx != null) {
      body = bodyCtx.TRIPLE_STRING() != null
          ? tripleString(bodyCtx.TRIPLE_STRING().getText())
          : unquote(bodyCtx.STRING().getText()).strip();
    }

    StreetraceParser.EscalationClauseContext clause =
        ctx.getRuleContext(StreetraceParser.EscalationClauseContext.class, 0);
    StreetraceParser.EscalationBlockContext block =
        ctx.getRuleContext(StreetraceParser.EscalationBlockContext.class, 0);
    if (clause == null && block != null) {
      clause = block.escalationClause();
    }
    EscalationCondition condition = null;
    if (clause != null) {
      condition = new EscalationCondition(clause.op.getText(), unquote(clause.STRING().getText()));
    }
    return new PromptDef(ctx.identifier().getText(), body, model, expecting, inherit, condition, pos(ctx));
  }

  // ============================================================
  // agent / 策略
  // ============================================================

  @Override
  public AgentDef visitAgentDef(StreetraceParser.AgentDefContext ctx) {
    String name = ctx.identifier() != null ? ctx.identifier().getText() : null;
    List<String> tools = new ArrayList<>();
    List<String> delegate = new ArrayList<>();
    List<String> use = new ArrayList<>();
    String instruction = null;
    String prompt = null;
    String produces = null;
    String retry = null;
    String timeoutRef = null;
    Integer timeoutValue = null;
    String timeoutUnit = null;
    String description = null;
    Map<String, SourcePosition> positions = new LinkedHashMap<>();

    for (StreetraceParser.AgentPropertyContext p : ctx.agentProperty()) {
      if (p instanceof StreetraceParser.AgentToolsContext c) {
        tools.addAll(names(c.nameList()));
        positions.putIfAbsent("tools", pos(p));
      } else if (p instanceof StreetraceParser.AgentInstructionContext c) {
        instruction = c.identifier().getText();
        positions.put("instruction", pos(p));
      } else if (p instanceof StreetraceParser.AgentPromptContext c) {
        prompt = c.identifier().getText();
        positions.put("prompt", pos(p));
      } else if (p instanceof StreetraceParser.AgentProducesContext c) {
        produces = c.variableName().getText();
        positions.put("produces", pos(p));
      } else if (p instanceof StreetraceParser.AgentRetryContext c) {
        retry = c.identifier().getText();
        positions.put("retry", pos(p));
      } else if (p instanceof StreetraceParser.AgentTimeoutValueContext c) {
        timeoutValue = parseCount(c.INT());
        timeoutUnit = timeUnit(c.timeUnit());
        positions.put("timeout", pos(p));
      } else if (p instanceof StreetraceParser.AgentTimeoutRefContext c) {
        timeoutRef = c.identifier().getText();
        positions.put("timeout", pos(p));
      } else if (p instanceof StreetraceParser.AgentDescriptionContext c) {
        description = unquote(c.STRING().getText());
      } else if (p instanceof StreetraceParser.AgentDelegateContext c) {
        delegate.addAll(names(c.nameList()));
        positions.putIfAbsent("delegate", pos(p));
      } else if (p instanceof StreetraceParser.AgentUseContext c) {
        use.addAll(names(c.nameList()));
        positions.putIfAbsent("use", pos(p));
      }
    }
    return new AgentDef(name, tools, instruction, prompt, produces, retry, timeoutRef, timeoutValue,
        timeoutUnit, description, delegate, use, pos(ctx), positions);
  }

  @Override
  public RetryPolicyDef visitRetryPolicyDef(StreetraceParser.RetryPolicyDefContext ctx) {
    String backoff = ctx.backoff != null ? ctx.backoff.getText() : null;
    return new RetryPolicyDef(ctx.identifier().getText(), parseCount(ctx.INT()), backoff, pos(ctx));
  }

  @Override
  public TimeoutPolicyDef visitTimeoutPolicyDef(StreetraceParser.TimeoutPolicyDefContext ctx) {
    return new TimeoutPolicyDef(ctx.identifier().getText(), parseCount(ctx.INT()),
        timeUnit(ctx.timeUnit()), pos(ctx));
  }

  private static String timeUnit(StreetraceParser.TimeUnitContext ctx) {
    if (ctx.SECONDS() != null) return "seconds";
    if (ctx.MINUTES() != null) return "minutes";
    return "hours";
  }

  // ============================================================
  // flow / 事件处理器
  // ============================================================

  @Override
  public FlowDef visitFlowDef(StreetraceParser.FlowDefContext ctx) {
    List<String> params = new ArrayList<>();
    for (TerminalNode v : ctx.VARIABLE()) {
      params.add(v.getText());
    }
    return new FlowDef(flowName(ctx.flowName()), params, block(ctx.block()), pos(ctx));
  }

  @Override
  public EventHandler visitEventHandler(StreetraceParser.EventHandlerContext ctx) {
    Timing timing = ctx.timing.getType() == StreetraceParser.AFTER ? Timing.AFTER : Timing.ON;
    EventType type = EventType.fromLabel(ctx.eventType().getText());
    List<Stmt> body = new ArrayList<>();
    for (StreetraceParser.HandlerStatementContext s : ctx.handlerBlock().handlerStatement()) {
      if (s.guardrailAction() != null) {
        body.add((Stmt) visit(s.guardrailAction()));
      } else {
        body.add(statement(s.statement()));
      }
    }
    return new EventHandler(timing, type, body, pos(ctx));
  }

  @Override
  public MaskAction visitMaskAction(StreetraceParser.MaskActionContext ctx) {
    return new MaskAction(ctx.identifier().getText(), pos(ctx));
  }

  @Override
  public BlockAction visitBlockAction(StreetraceParser.BlockActionContext ctx) {
    return new BlockAction(expr(ctx.expression()), pos(ctx));
  }

  @Override
  public WarnAction visitWarnIfAction(StreetraceParser.WarnIfActionContext ctx) {
    return new WarnAction(expr(ctx.expression()), null, pos(ctx));
  }

  @Override
  public WarnAction visitWarnMessageAction(StreetraceParser.WarnMessageActionContext ctx) {
    return new WarnAction(null, unquote(ctx.STRING().getText()), pos(ctx));
  }

  @Override
  public RetryAction visitRetryAction(StreetraceParser.RetryActionContext ctx) {
    return new RetryAction(expr(ctx.expression(0)), expr(ctx.expression(1)), pos(ctx));
  }

  // ============================================================
  // 语句
  // ============================================================

  private List<Stmt> block(StreetraceParser.BlockContext ctx) {
    List<Stmt> out = new ArrayList<>();
    for (StreetraceParser.StatementContext s : ctx.statement()) {
      out.add(statement(s));
    }
    return out;
  }

  private Stmt statement(StreetraceParser.StatementContext ctx) {
    if (ctx.simpleStatement() != null) {
      return simple(ctx.simpleStatement());
    }
    return (Stmt) visit(ctx.compoundStatement().getChild(0));
  }

  private Stmt simple(StreetraceParser.SimpleStatementContext ctx) {
    return (Stmt) visit(ctx.getChild(0));
  }

  @Override
  public RunStmt visitRunAgent(StreetraceParser.RunAgentContext ctx) {
    String target = ctx.variableName() != null ? ctx.variableName().getText() : null;
    EscalationHandler handler = null;
    if (ctx.escalationHandler() != null) {
      StreetraceParser.EscalationActionContext a = ctx.escalationHandler().escalationAction();
      if (a instanceof StreetraceParser.EscalationReturnContext r) {
        handler = new EscalationHandler(EscalationAction.RETURN, expr(r.expression()));
      } else if (a instanceof StreetraceParser.EscalationContinueContext) {
        handler = new EscalationHandler(EscalationAction.CONTINUE, null);
      } else {
        handler = new EscalationHandler(EscalationAction.ABORT, null);
      }
    }
    return new RunStmt(target, ctx.identifier().getText(), exprs(ctx.expression()), false, handler, pos(ctx));
  }

  @Override
  public RunStmt visitRunFlow(StreetraceParser.RunFlowContext ctx) {
    String target = ctx.variableName() != null ? ctx.variableName().getText() : null;
    return new RunStmt(target, flowName(ctx.flowName()), exprs(ctx.expression()), true, null, pos(ctx));
  }

  @Override
  public CallStmt visitCallStmt(StreetraceParser.CallStmtContext ctx) {
    String target = ctx.variableName() != null ? ctx.variableName().getText() : null;
    List<StreetraceParser.IdentifierContext> ids = ctx.identifier();
    String model = null;
    if (ctx.STRING() != null) {
      model = unquote(ctx.STRING().getText());
    } else if (ids.size() > 1) {
      model = ids.get(1).getText();
    }
    return new CallStmt(target, ids.get(0).getText(), exprs(ctx.expression()), model, pos(ctx));
  }

  @Override
  public Assignment visitAssignment(StreetraceParser.AssignmentContext ctx) {
    return new Assignment(ctx.variableName().getText(), expr(ctx.expression()), pos(ctx));
  }

  @Override
  public PropertyAssignment visitPropertyAssignment(StreetraceParser.PropertyAssignmentContext ctx) {
    List<String> path = new ArrayList<>();
    for (StreetraceParser.IdentifierContext id : ctx.identifier()) {
      path.add(id.getText());
    }
    return new PropertyAssignment(ctx.variableName().getText(), path, expr(ctx.expression()), pos(ctx));
  }

  @Override
  public ReturnStmt visitReturnStmt(StreetraceParser.ReturnStmtContext ctx) {
    return new ReturnStmt(expr(ctx.expression()), pos(ctx));
  }

  @Override
  public PushStmt visitPushStmt(StreetraceParser.PushStmtContext ctx) {
    return new PushStmt(expr(ctx.expression()), ctx.variableName().getText(), pos(ctx));
  }

  @Override
  public LogStmt visitLogStmt(StreetraceParser.LogStmtContext ctx) {
    return new LogStmt(expr(ctx.expression()), pos(ctx));
  }

  @Override
  public NotifyStmt visitNotifyStmt(StreetraceParser.NotifyStmtContext ctx) {
    return new NotifyStmt(expr(ctx.expression()), pos(ctx));
  }

  @Override
  public EscalateStmt visitEscalateStmt(StreetraceParser.EscalateStmtContext ctx) {
    String message = ctx.STRING() != null ? unquote(ctx.STRING().getText()) : null;
    return new EscalateStmt(message, pos(ctx));
  }

  @Override
  public ContinueStmt visitContinueStmt(StreetraceParser.ContinueStmtContext ctx) {
    return new ContinueStmt(pos(ctx));
  }

  @Override
  public AbortStmt visitAbortStmt(StreetraceParser.AbortStmtContext ctx) {
    return new AbortStmt(pos(ctx));
  }

  @Override
  public RetryStepStmt visitRetryStepStmt(StreetraceParser.RetryStepStmtContext ctx) {
    return new RetryStepStmt(expr(ctx.expression()), pos(ctx));
  }

  @Override
  public ForLoop visitForLoop(StreetraceParser.ForLoopContext ctx) {
    return new ForLoop(ctx.variableName().getText(), expr(ctx.expression()), block(ctx.block()), pos(ctx));
  }

  @Override
  public IfBlock visitIfBlock(StreetraceParser.IfBlockContext ctx) {
    return new IfBlock(expr(ctx.expression()), block(ctx.block()), pos(ctx));
  }

  @Override
  public MatchBlock visitMatchBlock(StreetraceParser.MatchBlockContext ctx) {
    List<MatchCase> cases = new ArrayList<>();
    for (StreetraceParser.MatchCaseContext c : ctx.matchCase()) {
      cases.add(new MatchCase(unquote(c.STRING().getText()), simple(c.simpleStatement()), pos(c)));
    }
    Stmt elseBody = ctx.matchElse() != null ? simple(ctx.matchElse().simpleStatement()) : null;
    return new MatchBlock(expr(ctx.expression()), cases, elseBody, pos(ctx));
  }

  @Override
  public ParallelBlock visitParallelBlock(StreetraceParser.ParallelBlockContext ctx) {
    return new ParallelBlock(block(ctx.block()), pos(ctx));
  }

  @Override
  public LoopBlock visitLoopBlock(StreetraceParser.LoopBlockContext ctx) {
    Integer max = ctx.INT() != null ? Integer.valueOf(parseCount(ctx.INT())) : null;
    return new LoopBlock(max, block(ctx.block()), pos(ctx));
  }

  @Override
  public FailureBlock visitFailureBlock(StreetraceParser.FailureBlockContext ctx) {
    return new FailureBlock(block(ctx.block()), pos(ctx));
  }

  // ============================================================
  // 表达式
  // ============================================================

  private Expr expr(ParserRuleContext ctx) {
    return (Expr) visit(ctx);
  }

  private List<Expr> exprs(List<? extends ParserRuleContext> ctxs) {
    List<Expr> out = new ArrayList<>(ctxs.size());
    for (ParserRuleContext c : ctxs) {
      out.add(expr(c));
    }
    return out;
  }

  @Override
  public Expr visitFilterExpr(StreetraceParser.FilterExprContext ctx) {
    return new FilterExpr(expr(ctx.unary()), expr(ctx.orExpr()), pos(ctx));
  }

  @Override
  public Expr visitPlainExpr(StreetraceParser.PlainExprContext ctx) {
    return expr(ctx.orExpr());
  }

  @Override
  public Expr visitOrExpr(StreetraceParser.OrExprContext ctx) {
    Expr left = expr(ctx.andExpr(0));
    for (int i = 1; i < ctx.andExpr().size(); i++) {
      left = new BinaryOp("or", left, expr(ctx.andExpr(i)), left.position());
    }
    return left;
  }

  @Override
  public Expr visitAndExpr(StreetraceParser.AndExprContext ctx) {
    Expr left = expr(ctx.notExpr(0));
    for (int i = 1; i < ctx.notExpr().size(); i++) {
      left = new BinaryOp("and", left, expr(ctx.notExpr(i)), left.position());
    }
    return left;
  }

  @Override
  public Expr visitNegation(StreetraceParser.NegationContext ctx) {
    return new UnaryOp("not", expr(ctx.notExpr()), pos(ctx));
  }

  @Override
  public Expr visitComparisonExpr(StreetraceParser.ComparisonExprContext ctx) {
    return expr(ctx.comparison());
  }

  @Override
  public Expr visitComparison(StreetraceParser.ComparisonContext ctx) {
    Expr left = expr(ctx.additive(0));
    if (ctx.op == null) {
      return left;
    }
    return new BinaryOp(ctx.op.getText(), left, expr(ctx.additive(1)), left.position());
  }

  @Override
  public Expr visitAdditive(StreetraceParser.AdditiveContext ctx) {
    Expr left = expr(ctx.multiplicative(0));
    for (int i = 1; i < ctx.multiplicative().size(); i++) {
      left = new BinaryOp(ctx.ops.get(i - 1).getText(), left, expr(ctx.multiplicative(i)), left.position());
    }
    return left;
  }

  @Override
  public Expr visitMultiplicative(StreetraceParser.MultiplicativeContext ctx) {
    Expr left = expr(ctx.unary(0));
    for (int i = 1; i < ctx.unary().size(); i++) {
      left = new BinaryOp(ctx.ops.get(i - 1).getText(), left, expr(ctx.unary(i)), left.position());
    }
    return left;
  }

  @Override
  public Expr visitUnaryMinus(StreetraceParser.UnaryMinusContext ctx) {
    return new UnaryOp("-", expr(ctx.unary()), pos(ctx));
  }

  @Override
  public Expr visitUnaryPrimary(StreetraceParser.UnaryPrimaryContext ctx) {
    return expr(ctx.primary());
  }

  @Override
  public Expr visitLiteralExpr(StreetraceParser.LiteralExprContext ctx) {
    return expr(ctx.literal());
  }

  @Override
  public Expr visitCallExpr(StreetraceParser.CallExprContext ctx) {
    return new FunctionCall(ctx.dottedName().getText(), exprs(ctx.expression()), pos(ctx));
  }

  @Override
  public Expr visitVariableExpr(StreetraceParser.VariableExprContext ctx) {
    return withProperties(new VarRef(ctx.VARIABLE().getText(), pos(ctx)), ctx.identifier(), ctx);
  }

  @Override
  public Expr visitInitialPromptExpr(StreetraceParser.InitialPromptExprContext ctx) {
    return new VarRef("input_prompt", pos(ctx));
  }

  @Override
  public Expr visitNameExpr(StreetraceParser.NameExprContext ctx) {
    List<StreetraceParser.IdentifierContext> ids = ctx.identifier();
    VarRef base = new VarRef(ids.get(0).getText(), pos(ctx));
    return withProperties(base, ids.subList(1, ids.size()), ctx);
  }

  private Expr withProperties(VarRef base, List<StreetraceParser.IdentifierContext> props, ParserRuleContext ctx) {
    if (props.isEmpty()) {
      return base;
    }
    List<String> names = new ArrayList<>(props.size());
    for (StreetraceParser.IdentifierContext id : props) {
      names.add(id.getText());
    }
    return new PropertyAccess(base, names, pos(ctx));
  }

  @Override
  public Expr visitImplicitPropertyExpr(StreetraceParser.ImplicitPropertyExprContext ctx) {
    List<String> names = new ArrayList<>();
    for (StreetraceParser.IdentifierContext id : ctx.identifier()) {
      names.add(id.getText());
    }
    return new ImplicitProperty(names, pos(ctx));
  }

  @Override
  public Expr visitListExpr(StreetraceParser.ListExprContext ctx) {
    return new ListLiteral(exprs(ctx.expression()), pos(ctx));
  }

  @Override
  public Expr visitObjectExpr(StreetraceParser.ObjectExprContext ctx) {
    Map<String, Expr> entries = new LinkedHashMap<>();
    for (StreetraceParser.ObjectEntryContext e : ctx.objectEntry()) {
      String key = e.STRING() != null ? unquote(e.STRING().getText()) : e.identifier().getText();
      entries.put(key, expr(e.expression()));
    }
    return new ObjectLiteral(entries, pos(ctx));
  }

  @Override
  public Expr visitParenExpr(StreetraceParser.ParenExprContext ctx) {
    return expr(ctx.expression());
  }

  @Override
  public Expr visitStringLiteral(StreetraceParser.StringLiteralContext ctx) {
    return new Literal(unquote(ctx.STRING().getText()), LiteralType.STRING, pos(ctx));
  }

  @Override
  public Expr visitTripleStringLiteral(StreetraceParser.TripleStringLiteralContext ctx) {
    return new Literal(tripleString(ctx.TRIPLE_STRING().getText()), LiteralType.STRING, pos(ctx));
  }

  @Override
  public Expr visitIntLiteral(StreetraceParser.IntLiteralContext ctx) {
    return new Literal(parseInteger(ctx.INT().getText(), ctx.getStart()), LiteralType.INT, pos(ctx));
  }

  @Override
  public Expr visitFloatLiteral(StreetraceParser.FloatLiteralContext ctx) {
    return new Literal(Double.valueOf(ctx.FLOAT().getText()), LiteralType.FLOAT, pos(ctx));
  }

  @Override
  public Expr visitTrueLiteral(StreetraceParser.TrueLiteralContext ctx) {
    return new Literal(Boolean.TRUE, LiteralType.BOOL, pos(ctx));
  }

  @Override
  public Expr visitFalseLiteral(StreetraceParser.FalseLiteralContext ctx) {
    return new Literal(Boolean.FALSE, LiteralType.BOOL, pos(ctx));
  }

  @Override
  public Expr visitNullLiteral(StreetraceParser.NullLiteralContext ctx) {
    return new Literal(null, LiteralType.NULL, pos(ctx));
  }

  // ============================================================
  // 工具方法
  // ============================================================

  private static List<String> names(StreetraceParser.NameListContext ctx) {
    List<String> out = new ArrayList<>();
    for (StreetraceParser.DottedNameContext d : ctx.dottedName()) {
      out.add(d.getText());
    }
    return out;
  }

  /** 多词 flow 名以单个空格连接 */
  private static String flowName(StreetraceParser.FlowNameContext ctx) {
    StringBuilder sb = new StringBuilder();
    for (StreetraceParser.IdentifierContext id : ctx.identifier()) {
      if (sb.length() > 0) sb.append(' ');
      sb.append(id.getText());
    }
    return sb.toString();
  }

  private static Object propertyValue(StreetraceParser.PropertyValueContext ctx) {
    if (ctx instanceof StreetraceParser.StringValueContext s) {
      return unquote(s.STRING().getText());
    }
    if (ctx instanceof StreetraceParser.IntValueContext) {
      return parseInteger(ctx.getText(), ctx.getStart());
    }
    if (ctx instanceof StreetraceParser.FloatValueContext) {
      return Double.valueOf(ctx.getText());
    }
    if (ctx instanceof StreetraceParser.TrueValueContext) {
      return Boolean.TRUE;
    }
    if (ctx instanceof StreetraceParser.FalseValueContext) {
      return Boolean.FALSE;
    }
    return ctx.getText();
  }

  /** 整数字面量：int 范围内为 Integer，否则为 Long；超出 long 报 E0017 */
  private static Number parseInteger(String text, Token at) {
    long v;
    try {
      v = Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw outOfRange(text, at, "integer literals must fit in 64 bits", e);
    }
    if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
      return (int) v;
    }
    return v;
  }

  /** 次数、时长、循环上限等计数值必须落在 int 范围内 */
  private static int parseCount(TerminalNode token) {
    try {
      return Integer.parseInt(token.getText());
    } catch (NumberFormatException e) {
      throw outOfRange(token.getText(), token.getSymbol(), "use a value no larger than " + Integer.MAX_VALUE, e);
    }
  }

  private static SyntaxError outOfRange(String text, Token at, String help, NumberFormatException cause) {
    SyntaxError error = new SyntaxError(ErrorCode.E0017, ErrorCode.E0017.format(Map.of("value", text)),
        at.getLine(), at.getCharPositionInLine() + 1, help);
    error.initCause(cause);
    return error;
  }

  private static SourcePosition pos(ParserRuleContext ctx) {
    Token start = ctx.getStart();
    return new SourcePosition(start.getLine(), start.getCharPositionInLine() + 1);
  }

  /** 三引号正文：去除定界符与公共缩进，首尾空白不保留 */
  static String tripleString(String raw) {
    return raw.substring(3, raw.length() - 3).stripIndent().strip();
  }

  /** 去除引号并处理转义 */
  static String unquote(String raw) {
    String inner = raw.substring(1, raw.length() - 1);
    if (inner.indexOf('\\') < 0) {
      return inner;
    }
    StringBuilder sb = new StringBuilder(inner.length());
    for (int i = 0; i < inner.length(); i++) {
      char c = inner.charAt(i);
      if (c == '\\' && i + 1 < inner.length()) {
        char n = inner.charAt(++i);
        switch (n) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          case 'r' -> sb.append('\r');
          default -> sb.append(n);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
