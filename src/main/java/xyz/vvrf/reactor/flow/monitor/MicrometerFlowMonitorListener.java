package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 把节点和 Flow 执行结果同步到 Micrometer {@link MeterRegistry}，供宿主应用的监控系统导出。
 * <p>
 * 节点失败按 {@link xyz.vvrf.reactor.flow.exception.ErrorKind} 打标签，重试次数记录为分布。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerFlowMonitorListener implements FlowMonitorListener {

    static final String FLOW_TIMER = "flow.execution.time";
    static final String NODE_TIMER = "flow.node.execution.time";
    static final String NODE_ATTEMPTS = "flow.node.attempts";
    static final String NODE_CACHE_HITS = "flow.node.cache.hits";

    private final MeterRegistry registry;

    public MicrometerFlowMonitorListener(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry 不能为空");
    }

    @Override
    public void onFlowStart(String requestId, String flowName, ExecutionMode mode) {
        // 只在结束时记录
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, ExecutionMode mode, Duration totalDuration,
                               List<String> path, Throwable error) {
        Tags tags = Tags.of("flow", flowName, "mode", modeTag(mode), "outcome", error == null ? "ok" : "error")
                .and("steps", String.valueOf(path.size()));
        safely("flow timer", () -> registry.timer(FLOW_TIMER, tags).record(totalDuration));
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String nodeId, ExecutionMode mode) {
        // 只在结束时记录
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, boolean fromCache) {
        Tags node = Tags.of("flow", flowName, "node", nodeId, "mode", modeTag(mode));
        if (fromCache) {
            safely("cache hit counter", () -> registry.counter(NODE_CACHE_HITS, node).increment());
            return;
        }
        safely("node timer", () -> registry.timer(NODE_TIMER, node.and("outcome", "ok", "kind", "none"))
                .record(duration));
        recordAttempts(node, attempts);
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, Throwable error) {
        Tags node = Tags.of("flow", flowName, "node", nodeId, "mode", modeTag(mode));
        String kind = error == null ? "UNKNOWN" : ErrorClassifier.classify(error).name();
        safely("node timer", () -> registry.timer(NODE_TIMER, node.and("outcome", "error", "kind", kind))
                .record(duration));
        recordAttempts(node, attempts);
    }

    private void recordAttempts(Tags node, int attempts) {
        safely("attempts summary", () -> DistributionSummary.builder(NODE_ATTEMPTS)
                .tags(node)
                .description("每次节点执行实际发起的尝试次数")
                .register(registry)
                .record(attempts));
    }

    private static String modeTag(ExecutionMode mode) {
        return mode.name().toLowerCase();
    }

    private void safely(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("写入 Micrometer 指标失败 ({}): {}", what, e.getMessage(), e);
        }
    }
}
