package xyz.vvrf.reactor.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.ExecutionMode;

import java.time.Duration;
import java.util.List;

/**
 * 把执行事件写入日志的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingFlowMonitorListener implements FlowMonitorListener {

    @Override
    public void onFlowStart(String requestId, String flowName, ExecutionMode mode) {
        log.info("[RequestId: {}][Flow: '{}'] Flow started (mode: {})", requestId, flowName, mode);
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, ExecutionMode mode, Duration totalDuration,
                               List<String> path, Throwable error) {
        if (error == null) {
            log.info("[RequestId: {}][Flow: '{}'] Flow completed in {} ms (mode: {}, path: {})",
                    requestId, flowName, totalDuration.toMillis(), mode, path);
        } else {
            log.error("[RequestId: {}][Flow: '{}'] Flow failed after {} ms (mode: {}, path: {}): {}",
                    requestId, flowName, totalDuration.toMillis(), mode, path, error.getMessage());
        }
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String nodeId, ExecutionMode mode) {
        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' started", requestId, flowName, nodeId);
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, boolean fromCache) {
        log.debug("[RequestId: {}][Flow: '{}'] Node '{}' succeeded in {} ms (attempts: {}, cached: {})",
                requestId, flowName, nodeId, duration.toMillis(), attempts, fromCache);
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String nodeId, ExecutionMode mode,
                              Duration duration, int attempts, Throwable error) {
        log.warn("[RequestId: {}][Flow: '{}'] Node '{}' failed after {} ms and {} attempt(s): {}",
                requestId, flowName, nodeId, duration.toMillis(), attempts, error.toString());
    }
}
