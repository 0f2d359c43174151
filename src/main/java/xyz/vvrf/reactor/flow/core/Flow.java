package xyz.vvrf.reactor.flow.core;

import lombok.Getter;
import xyz.vvrf.reactor.flow.util.GraphUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 不可变的 Flow 图：按 ID 索引的节点表、{@code (节点ID, 边名) -> 节点ID} 的边表和起始节点。
 * 图允许有环 (例如指回自身的 "retry" 边)，运行时由 maxSteps 限制总步数。
 * 通过 {@link xyz.vvrf.reactor.flow.builder.FlowBuilder} 构建。
 *
 * @author ruifeng.wen
 */
@Getter
public final class Flow {

    private final String name;
    private final String startNodeId;
    private final Map<String, Node<?, ?>> nodes;
    private final Map<String, Map<String, String>> edges;
    private final int maxSteps;

    public Flow(String name, String startNodeId, Map<String, Node<?, ?>> nodes,
                Map<String, Map<String, String>> edges, int maxSteps) {
        this.name = Objects.requireNonNull(name, "Flow 名称不能为空");
        this.startNodeId = Objects.requireNonNull(startNodeId, "起始节点不能为空");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        edges.forEach((from, out) -> copy.put(from, Collections.unmodifiableMap(new LinkedHashMap<>(out))));
        this.edges = Collections.unmodifiableMap(copy);
        this.maxSteps = maxSteps;
    }

    public Node<?, ?> getStartNode() {
        return nodes.get(startNodeId);
    }

    public Optional<Node<?, ?>> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * 查找从 nodeId 沿 edge 到达的节点 ID。
     */
    public Optional<String> successor(String nodeId, String edge) {
        Map<String, String> out = edges.get(nodeId);
        return out == null ? Optional.empty() : Optional.ofNullable(out.get(edge));
    }

    public Set<String> edgesOf(String nodeId) {
        Map<String, String> out = edges.get(nodeId);
        return out == null ? Collections.emptySet() : out.keySet();
    }

    public boolean hasCycle() {
        return GraphUtils.hasCycle(nodes.keySet(), edges);
    }

    /**
     * 可读的图描述，每行一条边。
     */
    public String describe() {
        return GraphUtils.describe(name, startNodeId, nodes.keySet(), edges);
    }

    @Override
    public String toString() {
        return "Flow[" + name + ", start=" + startNodeId + ", nodes=" + nodes.keySet() + "]";
    }
}
