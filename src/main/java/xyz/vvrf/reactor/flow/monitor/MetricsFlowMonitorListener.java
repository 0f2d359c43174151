package xyz.vvrf.reactor.flow.monitor;

import xyz.vvrf.reactor.flow.core.ExecutionMode;
import xyz.vvrf.reactor.flow.exception.ErrorClassifier;
import xyz.vvrf.reactor.flow.metrics.MetricsCollector;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 把节点和 Flow 的执行结果记录到 {@link MetricsCollector}。
 *
 * @author ruifeng.wen
 */
public class MetricsFlowMonitorListener implements FlowMonitorListener {

    static final String METRIC_NODE_EXECUTIONS = "flow.node.executions";
    static final String METRIC_NODE_DURATION = "flow.node.duration";
    static final String METRIC_FLOW_EXECUTIONS = "flow.executions";
    static final String METRIC_FLOW_DURATION = "flow.duration";

    private final MetricsCollector metrics;

    public MetricsFlowMonitorListener(MetricsCollector metrics) {
        this.metrics = Objects.requireNonNull(metrics, "MetricsCollector 不能为空");
    }

    @Override
    public void onFlowStart(String requestId, String flowName, ExecutionMode mode) {
        // 只在结束时记录
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, ExecutionMode mode, Duration totalDuration,
                               List<String> path, Throwable error) {
        String status = error == null ? "success" : "failure";
        metrics.increment(METRIC_FLOW_EXECUTIONS, MetricsCollector.tags("flow", flowName, "status", status, "mode", modeTag(mode)));
        metrics.observe(METRIC_FLOW_DURATION, seconds(totalDuration), MetricsCollector.tags("flow", flowName));
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String nodeId, ExecutionMode mode) {
        // 只在结束时记录
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, boolean fromCache) {
        String status = fromCache ? "cache_hit" : "success";
        metrics.increment(METRIC_NODE_EXECUTIONS, MetricsCollector.tags("flow", flowName, "node", nodeId, "status", status, "mode", modeTag(mode)));
        metrics.observe(METRIC_NODE_DURATION, seconds(duration), MetricsCollector.tags("flow", flowName, "node", nodeId));
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, Throwable error) {
        String kind = ErrorClassifier.classify(error).name().toLowerCase();
        metrics.increment(METRIC_NODE_EXECUTIONS, MetricsCollector.tags("flow", flowName, "node", nodeId, "status", "failure", "mode", modeTag(mode)));
        metrics.increment("flow.node.errors", MetricsCollector.tags("flow", flowName, "node", nodeId, "kind", kind));
        metrics.observe(METRIC_NODE_DURATION, seconds(duration), MetricsCollector.tags("flow", flowName, "node", nodeId));
    }

    private static String modeTag(ExecutionMode mode) {
        return mode.name().toLowerCase();
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }
}
