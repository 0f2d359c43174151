package xyz.vvrf.reactor.flow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;
import xyz.vvrf.reactor.flow.util.GraphUtils;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 用显式链式调用构建 {@link Flow}：
 * <pre>
 * Flow flow = FlowBuilder.named("trial-lookup")
 *         .start(query)
 *         .then(query, summarize)            // 默认边
 *         .on(query, "retry", query)         // 具名边
 *         .build();
 * </pre>
 * 所有图错误 (节点 ID 冲突、边指向未注册节点、同一条边重复定义、节点声明的边未连线、缺少起始节点)
 * 都在 {@link #build()} 时以 {@link FlowConfigurationException} 报告。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class FlowBuilder {

    public static final int DEFAULT_MAX_STEPS = 1000;

    private final String name;
    private final Map<String, Node<?, ?>> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> edges = new LinkedHashMap<>();
    private String startNodeId;
    private int maxSteps = DEFAULT_MAX_STEPS;

    private FlowBuilder(String name) {
        this.name = Objects.requireNonNull(name, "Flow 名称不能为空");
    }

    public static FlowBuilder named(String name) {
        return new FlowBuilder(name);
    }

    /**
     * 注册节点。同一个 ID 只能对应同一个节点实例。
     */
    public FlowBuilder node(Node<?, ?> node) {
        Objects.requireNonNull(node, "节点不能为空");
        Node<?, ?> existing = nodes.putIfAbsent(node.getId(), node);
        if (existing != null && existing != node) {
            throw new FlowConfigurationException(String.format("Flow '%s': 节点 ID '%s' 被两个不同的节点实例使用 (%s, %s)",
                    name, node.getId(), existing, node));
        }
        return this;
    }

    public FlowBuilder start(Node<?, ?> node) {
        node(node);
        this.startNodeId = node.getId();
        return this;
    }

    /**
     * 连接默认边 from -> to。
     */
    public FlowBuilder then(Node<?, ?> from, Node<?, ?> to) {
        return on(from, Node.DEFAULT_EDGE, to);
    }

    /**
     * 依次用默认边连接多个节点。
     */
    public FlowBuilder chain(Node<?, ?>... sequence) {
        for (int i = 0; i + 1 < sequence.length; i++) {
            then(sequence[i], sequence[i + 1]);
        }
        if (sequence.length == 1) {
            node(sequence[0]);
        }
        return this;
    }

    /**
     * 连接具名边 from --edge--> to。
     */
    public FlowBuilder on(Node<?, ?> from, String edge, Node<?, ?> to) {
        node(from);
        node(to);
        return edge(from.getId(), edge, to.getId());
    }

    /**
     * 按 ID 连接边，目标节点在 build 时必须已注册。
     */
    public FlowBuilder edge(String fromId, String edge, String toId) {
        Objects.requireNonNull(fromId, "源节点 ID 不能为空");
        Objects.requireNonNull(edge, "边名称不能为空");
        Objects.requireNonNull(toId, "目标节点 ID 不能为空");
        String previous = edges.computeIfAbsent(fromId, k -> new LinkedHashMap<>()).put(edge, toId);
        if (previous != null && !previous.equals(toId)) {
            throw new FlowConfigurationException(String.format("Flow '%s': 节点 '%s' 的边 '%s' 被重复定义 (%s, %s)",
                    name, fromId, edge, previous, toId));
        }
        return this;
    }

    public FlowBuilder maxSteps(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps 必须 >= 1");
        }
        this.maxSteps = maxSteps;
        return this;
    }

    public Flow build() {
        if (startNodeId == null) {
            throw new FlowConfigurationException(String.format("Flow '%s': 未指定起始节点", name));
        }
        for (Map.Entry<String, Map<String, String>> entry : edges.entrySet()) {
            String from = entry.getKey();
            if (!nodes.containsKey(from)) {
                throw new FlowConfigurationException(String.format("Flow '%s': 边的源节点 '%s' 未注册", name, from));
            }
            for (Map.Entry<String, String> e : entry.getValue().entrySet()) {
                if (!nodes.containsKey(e.getValue())) {
                    throw new FlowConfigurationException(String.format("Flow '%s': 节点 '%s' 的边 '%s' 指向未注册的节点 '%s'",
                            name, from, e.getKey(), e.getValue()));
                }
            }
        }
        for (Node<?, ?> node : nodes.values()) {
            Set<String> wired = edges.getOrDefault(node.getId(), new LinkedHashMap<>()).keySet();
            Set<String> missing = new HashSet<>(node.getDeclaredEdges());
            missing.removeAll(wired);
            if (!missing.isEmpty()) {
                throw new FlowConfigurationException(String.format("Flow '%s': 节点 '%s' 声明的边 %s 没有连线",
                        name, node.getId(), missing));
            }
        }

        Set<String> unreachable = new HashSet<>(nodes.keySet());
        unreachable.removeAll(GraphUtils.reachableFrom(startNodeId, edges));
        if (!unreachable.isEmpty()) {
            log.warn("Flow '{}': 以下节点从起始节点 '{}' 不可达: {}", name, startNodeId, unreachable);
        }

        Flow flow = new Flow(name, startNodeId, nodes, edges, maxSteps);
        log.debug("Flow '{}' 构建完成: {} 个节点, 有环: {}", name, nodes.size(), flow.hasCycle());
        return flow;
    }
}
