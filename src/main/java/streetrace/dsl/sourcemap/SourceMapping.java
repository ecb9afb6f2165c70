package streetrace.dsl.sourcemap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 生成位置 → DSL 源码位置
 * <p>
 * {@code unit} 为生成单元名（{@code <dsl:file>#flow}），{@code generatedPosition}
 * 为该单元中的指令下标。
 */
public final class SourceMapping {
  private final String unit;
  private final int generatedPosition;
  private final int sourceLine;
  private final int sourceColumn;
  private final String sourceFile;

  @JsonCreator
  public SourceMapping(@JsonProperty("unit") String unit,
                       @JsonProperty("generated_position") int generatedPosition,
                       @JsonProperty("source_line") int sourceLine,
                       @JsonProperty("source_column") int sourceColumn,
                       @JsonProperty("source_file") String sourceFile) {
    this.unit = unit;
    this.generatedPosition = generatedPosition;
    this.sourceLine = sourceLine;
    this.sourceColumn = sourceColumn;
    this.sourceFile = sourceFile;
  }

  @JsonProperty("unit")
  public String unit() { return unit; }

  @JsonProperty("generated_position")
  public int generatedPosition() { return generatedPosition; }

  @JsonProperty("source_line")
  public int sourceLine() { return sourceLine; }

  @JsonProperty("source_column")
  public int sourceColumn() { return sourceColumn; }

  @JsonProperty("source_file")
  public String sourceFile() { return sourceFile; }

  @Override
  public String toString() {
    return unit + "@" + generatedPosition + " -> " + sourceFile + ":" + sourceLine + ":" + sourceColumn;
  }
}
