package streetrace.dsl.sourcemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 按生成单元分组的源码映射
 * <p>
 * 映射只追加，同一单元内按发射顺序排列且生成位置单调不减；
 * 查找返回位置不大于目标的最近一条映射。
 */
public final class SourceMapRegistry {
  private static final String UNIT_PREFIX = "<dsl:";

  private final Map<String, List<SourceMapping>> units = new LinkedHashMap<>();

  /** 生成单元名，例如 {@code <dsl:main.sr>#main} */
  public static String unitName(String sourceFile, String unit) {
    return UNIT_PREFIX + sourceFile + ">#" + unit;
  }

  public void add(SourceMapping mapping) {
    List<SourceMapping> list = units.computeIfAbsent(mapping.unit(), k -> new ArrayList<>());
    if (!list.isEmpty() && list.get(list.size() - 1).generatedPosition() > mapping.generatedPosition()) {
      throw new IllegalArgumentException("source mappings must be appended in emission order: " + mapping);
    }
    list.add(mapping);
  }

  /**
   * 查找最近的前置映射
   *
   * @param unit 生成单元名
   * @param generatedPosition 生成位置（指令下标）
   * @return 位置不大于目标的最后一条映射；没有则为空
   */
  public Optional<SourceMapping> lookup(String unit, int generatedPosition) {
    List<SourceMapping> list = units.get(unit);
    if (list == null || list.isEmpty()) {
      return Optional.empty();
    }
    int lo = 0;
    int hi = list.size() - 1;
    int found = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (list.get(mid).generatedPosition() <= generatedPosition) {
        found = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    return found < 0 ? Optional.empty() : Optional.of(list.get(found));
  }

  public List<SourceMapping> mappings(String unit) {
    List<SourceMapping> list = units.get(unit);
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  /** 全部映射，按单元登记顺序再按发射顺序 */
  public List<SourceMapping> all() {
    List<SourceMapping> out = new ArrayList<>();
    for (List<SourceMapping> list : units.values()) {
      out.addAll(list);
    }
    return out;
  }

  public Set<String> units() {
    return Collections.unmodifiableSet(units.keySet());
  }

  public int size() {
    int n = 0;
    for (List<SourceMapping> list : units.values()) {
      n += list.size();
    }
    return n;
  }
}
