package streetrace.dsl.codegen;

import streetrace.dsl.codegen.FlowModel.WorkflowProgram;
import streetrace.dsl.sourcemap.SourceMapRegistry;

/**
 * 降级产物：可执行表示与对应的源码映射
 */
public final class GenerationResult {
  private final WorkflowProgram program;
  private final SourceMapRegistry sourceMap;

  GenerationResult(WorkflowProgram program, SourceMapRegistry sourceMap) {
    this.program = program;
    this.sourceMap = sourceMap;
  }

  public WorkflowProgram program() { return program; }

  public SourceMapRegistry sourceMap() { return sourceMap; }
}
