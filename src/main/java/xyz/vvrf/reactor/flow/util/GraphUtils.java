package xyz.vvrf.reactor.flow.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Flow 图结构的工具方法：可达性、环检测和文本描述。
 * 边表结构为 {@code 源节点 -> (边名 -> 目标节点)}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 从起始节点出发可达的节点集合 (BFS)。
     */
    public static Set<String> reachableFrom(String start, Map<String, Map<String, String>> edges) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : edges.getOrDefault(current, Collections.emptyMap()).values()) {
                if (!visited.contains(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    /**
     * 使用深度优先搜索检测图中是否存在环。
     */
    public static boolean hasCycle(Set<String> nodeIds, Map<String, Map<String, String>> edges) {
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String id : nodeIds) {
            if (!visited.contains(id) && hasCycleDFS(id, visited, visiting, edges)) {
                return true;
            }
        }
        return false;
    }

    // DFS 辅助方法
    private static boolean hasCycleDFS(String nodeId, Set<String> visited, Set<String> visiting,
                                       Map<String, Map<String, String>> edges) {
        visited.add(nodeId);
        visiting.add(nodeId);
        for (String neighbor : edges.getOrDefault(nodeId, Collections.emptyMap()).values()) {
            if (visiting.contains(neighbor)) {
                log.debug("检测到环: '{}' -> '{}'", nodeId, neighbor);
                return true;
            }
            if (!visited.contains(neighbor) && hasCycleDFS(neighbor, visited, visiting, edges)) {
                return true;
            }
        }
        visiting.remove(nodeId); // 回溯
        return false;
    }

    public static String describe(String flowName, String startNodeId, Set<String> nodeIds,
                                  Map<String, Map<String, String>> edges) {
        StringBuilder sb = new StringBuilder();
        sb.append("Flow '").append(flowName).append("' (start: ").append(startNodeId).append(")\n");
        for (String id : nodeIds) {
            Map<String, String> out = edges.getOrDefault(id, Collections.emptyMap());
            if (out.isEmpty()) {
                sb.append("  ").append(id).append(" (terminal)\n");
                continue;
            }
            out.forEach((edge, target) ->
                    sb.append("  ").append(id).append(" --").append(edge).append("--> ").append(target).append('\n'));
        }
        return sb.toString();
    }
}
