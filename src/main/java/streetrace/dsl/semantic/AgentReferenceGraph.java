package streetrace.dsl.semantic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * agent 之间 delegate / use 引用构成的有向图
 * <p>
 * 使用 DFS 检测循环：递归栈中出现回边即为环。
 * 每个环只报告一次，以环上节点的集合去重。
 */
final class AgentReferenceGraph {
  // agent -> 被引用的 agent（保持声明顺序，保证报告稳定）
  private final Map<String, List<String>> edges = new LinkedHashMap<>();

  void addAgent(String name, List<String> references) {
    edges.computeIfAbsent(name, k -> new ArrayList<>()).addAll(references);
  }

  /**
   * 查找全部循环引用
   *
   * @return 每个环的路径，形如 {@code [a, b, a]}
   */
  List<List<String>> findCycles() {
    List<List<String>> cycles = new ArrayList<>();
    Set<Set<String>> reported = new HashSet<>();
    Set<String> visited = new HashSet<>();
    for (String start : edges.keySet()) {
      if (!visited.contains(start)) {
        dfs(start, visited, new LinkedHashSet<>(), cycles, reported);
      }
    }
    return cycles;
  }

  private void dfs(String node, Set<String> visited, LinkedHashSet<String> stack,
                   List<List<String>> cycles, Set<Set<String>> reported) {
    visited.add(node);
    stack.add(node);
    for (String next : edges.getOrDefault(node, List.of())) {
      // 未定义的 agent 由引用检查报告，这里跳过
      if (!edges.containsKey(next)) {
        continue;
      }
      if (stack.contains(next)) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String s : stack) {
          if (s.equals(next)) inCycle = true;
          if (inCycle) path.add(s);
        }
        if (reported.add(new HashSet<>(path))) {
          path.add(next);
          cycles.add(path);
        }
      } else if (!visited.contains(next)) {
        dfs(next, visited, stack, cycles, reported);
      }
    }
    stack.remove(node);
  }
}
