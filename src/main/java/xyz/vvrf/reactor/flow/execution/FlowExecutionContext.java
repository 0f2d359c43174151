package xyz.vvrf.reactor.flow.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.SharedContext;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 封装单次 Flow 执行的运行时状态。
 * 每次 {@link FlowEngine#run} / {@link FlowEngine#runAsync} 调用都会创建一个此类的实例。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class FlowExecutionContext {

    private final String requestId;
    private final Flow flow;
    private final SharedContext shared;
    private final ExecutionMode mode;
    private final long startNanos;

    private final List<String> path = new CopyOnWriteArrayList<>();
    private final AtomicInteger steps = new AtomicInteger();

    public FlowExecutionContext(Flow flow, SharedContext shared, ExecutionMode mode) {
        this.flow = flow;
        this.shared = shared;
        this.mode = mode;
        this.startNanos = System.nanoTime();

        this.requestId = shared.get(SharedContext.KEY_REQUEST_ID, String.class)
                .filter(id -> !id.trim().isEmpty())
                .orElseGet(() -> "flow-req-" + UUID.randomUUID().toString().substring(0, 8));
        shared.put(SharedContext.KEY_REQUEST_ID, requestId);
        shared.put(SharedContext.KEY_PATH, Collections.unmodifiableList(path));

        log.debug("[RequestId: {}][Flow: '{}'] 创建 FlowExecutionContext (mode: {}, maxSteps: {})",
                requestId, flow.getName(), mode, flow.getMaxSteps());
    }

    public String getFlowName() {
        return flow.getName();
    }

    /**
     * 进入下一个节点。超过 maxSteps 时抛出 {@link FlowConfigurationException}。
     */
    public void enterNode(String nodeId) {
        int step = steps.incrementAndGet();
        if (step > flow.getMaxSteps()) {
            throw new FlowConfigurationException(String.format("Flow '%s' 超过最大步数 %d，最近路径: %s",
                    flow.getName(), flow.getMaxSteps(), lastSteps(10)));
        }
        path.add(nodeId);
        log.trace("[RequestId: {}][Flow: '{}'] Step {} -> node '{}'", requestId, flow.getName(), step, nodeId);
    }

    public List<String> getPathSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(path));
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private List<String> lastSteps(int n) {
        List<String> snapshot = new ArrayList<>(path);
        return snapshot.subList(Math.max(0, snapshot.size() - n), snapshot.size());
    }
}
